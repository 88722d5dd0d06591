package io.mhm.core.dispatch;

import java.util.concurrent.CompletionStage;

/**
 * What the webhook subsystem needs from the chat bot runtime: its event loop and a way to
 * reach a user for a direct message.
 */
public interface BotHandle {
    /**
     * The loop the bot runs on, or {@code null} when the runtime has not started one yet.
     */
    EventLoop eventLoop();

    CompletionStage<UserHandle> fetchUser(String externalId);
}
