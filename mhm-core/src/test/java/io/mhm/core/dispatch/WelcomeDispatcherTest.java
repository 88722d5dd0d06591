package io.mhm.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.FileWelcomeStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WelcomeDispatcherTest {

    @TempDir
    Path tempDir;

    private final ExternalUser user = new ExternalUser("123", "ana", "discord");
    private FileWelcomeStore store;
    private WelcomeDispatcher dispatcher;
    private SingleThreadEventLoop loop;

    @BeforeEach
    void setUp() {
        store = new FileWelcomeStore(tempDir.resolve("welcome_tracking.json"));
        dispatcher = new WelcomeDispatcher(store, new MarkWelcomedPolicy(store), Duration.ZERO);
        loop = new SingleThreadEventLoop("test-bot-loop");
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void marksWelcomedOnlyAfterTheDmIsSent() throws Exception {
        CompletableFuture<Void> delivery = new CompletableFuture<>();
        RecordingBotHandle bot = new RecordingBotHandle(loop, () -> delivery);

        assertThat(dispatcher.dispatchNotification(user, bot)).isTrue();

        awaitTrue(() -> bot.sent().size() == 1);
        assertThat(store.has("discord", "123")).isFalse();

        delivery.complete(null);

        awaitTrue(() -> store.has("discord", "123"));
        RecordingBotHandle.SentMessage message = bot.sent().get(0);
        assertThat(message.externalId()).isEqualTo("123");
        assertThat(message.text()).contains("Welcome to MHM, ana!");
        assertThat(message.view().buttons()).hasSize(2);
    }

    @Test
    void closedLoopSkipsTheDmButMarksWelcomed() {
        StubEventLoop closed = new StubEventLoop(true, false);

        assertThat(dispatcher.dispatchNotification(user, new RecordingBotHandle(closed))).isFalse();

        assertThat(closed.submissions).isZero();
        assertThat(store.has("discord", "123")).isTrue();
    }

    @Test
    void missingBotOrLoopIsTreatedLikeAClosedLoop() {
        assertThat(dispatcher.dispatchNotification(user, null)).isFalse();
        assertThat(store.has("discord", "123")).isTrue();

        ExternalUser other = new ExternalUser("456", "", "discord");
        assertThat(dispatcher.dispatchNotification(other, new RecordingBotHandle(null))).isFalse();
        assertThat(store.has("discord", "456")).isTrue();
    }

    @Test
    void loopClosingBetweenCheckAndSubmitDisposesTheTask() {
        StubEventLoop racing = new StubEventLoop(false, true);
        RecordingBotHandle bot = new RecordingBotHandle(racing);

        assertThat(dispatcher.dispatchNotification(user, bot)).isFalse();

        assertThat(racing.lastSubmitted).isInstanceOf(WelcomeTask.class);
        WelcomeTask task = (WelcomeTask) racing.lastSubmitted;
        assertThat(task.state()).isEqualTo(TicketState.DISPOSED);
        assertThat(store.has("discord", "123")).isTrue();
        assertThat(bot.fetched()).isEmpty();
    }

    @Test
    void acceptedSubmissionReturnsWithoutWaitingForDelivery() {
        StubEventLoop idle = new StubEventLoop(false, false);

        assertThat(dispatcher.dispatchNotification(user, new RecordingBotHandle(idle))).isTrue();

        WelcomeTask task = (WelcomeTask) idle.lastSubmitted;
        assertThat(task.state()).isEqualTo(TicketState.SUBMITTED);
        assertThat(store.has("discord", "123")).isFalse();
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
