package io.mhm.core.dispatch;

import io.mhm.core.welcome.WelcomeView;
import java.util.concurrent.CompletionStage;

public interface UserHandle {
    String externalId();

    /**
     * Sends a direct message. {@code view} may be {@code null}.
     */
    CompletionStage<Void> send(String text, WelcomeView view);
}
