package io.mhm.core.webhook;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mhm.core.dispatch.MarkWelcomedPolicy;
import io.mhm.core.dispatch.RecordingBotHandle;
import io.mhm.core.dispatch.SingleThreadEventLoop;
import io.mhm.core.dispatch.WelcomeDispatcher;
import io.mhm.core.identity.IdentityDirectory;
import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.FileWelcomeStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ApplicationHandlersTest {

    @TempDir
    Path tempDir;

    private final WebhookDecoder decoder = new WebhookDecoder(new ObjectMapper());
    private FileWelcomeStore store;
    private FakeIdentityDirectory identities;
    private SingleThreadEventLoop loop;
    private RecordingBotHandle bot;
    private ApplicationAuthorizedHandler authorized;
    private ApplicationDeauthorizedHandler deauthorized;

    @BeforeEach
    void setUp() {
        store = new FileWelcomeStore(tempDir.resolve("welcome_tracking.json"));
        identities = new FakeIdentityDirectory();
        loop = new SingleThreadEventLoop("handler-test-loop");
        // never completes, so nothing is marked by a delivered DM during these tests
        bot = new RecordingBotHandle(loop, CompletableFuture::new);
        WelcomeDispatcher dispatcher = new WelcomeDispatcher(store, new MarkWelcomedPolicy(store), Duration.ZERO);
        authorized = new ApplicationAuthorizedHandler("discord", store, identities, dispatcher, bot);
        deauthorized = new ApplicationDeauthorizedHandler("discord", store);
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void newUserIsHandedToTheDispatcherAndNameRecorded() {
        RouteOutcome outcome = authorized.handle(event("APPLICATION_AUTHORIZED", "123", "ana"));

        assertThat(outcome).isEqualTo(RouteOutcome.ACKNOWLEDGED);
        assertThat(identities.recorded).containsExactly(new ExternalUser("123", "ana", "discord"));
    }

    @Test
    void alreadyWelcomedUserIsAcknowledgedWithoutAsyncWork() throws Exception {
        store.mark("discord", "123");

        assertThat(authorized.handle(event("APPLICATION_AUTHORIZED", "123", "ana"))).isEqualTo(RouteOutcome.ACKNOWLEDGED);

        Thread.sleep(50);
        assertThat(bot.fetched()).isEmpty();
    }

    @Test
    void linkedUserIsNotWelcomed() throws Exception {
        identities.links.put("discord:123", "user-7");

        assertThat(authorized.handle(event("APPLICATION_AUTHORIZED", "123", "ana"))).isEqualTo(RouteOutcome.ACKNOWLEDGED);

        Thread.sleep(50);
        assertThat(bot.fetched()).isEmpty();
        assertThat(store.has("discord", "123")).isFalse();
    }

    @Test
    void identityFailuresDoNotBlockTheWelcome() {
        identities.failOnRecord = true;

        assertThat(authorized.handle(event("APPLICATION_AUTHORIZED", "123", "ana"))).isEqualTo(RouteOutcome.ACKNOWLEDGED);
    }

    @Test
    void closedRuntimeYieldsSoftFailureThenRedeliveryIsAcknowledged() {
        loop.close();

        assertThat(authorized.handle(event("APPLICATION_AUTHORIZED", "123", "ana"))).isEqualTo(RouteOutcome.FAILED);
        assertThat(store.has("discord", "123")).isTrue();
        assertThat(authorized.handle(event("APPLICATION_AUTHORIZED", "123", "ana"))).isEqualTo(RouteOutcome.ACKNOWLEDGED);
    }

    @Test
    void missingUserIdIsRejected() {
        assertThat(authorized.handle(event("APPLICATION_AUTHORIZED", "", "ana"))).isEqualTo(RouteOutcome.REJECTED);
        assertThat(deauthorized.handle(event("APPLICATION_DEAUTHORIZED", "", ""))).isEqualTo(RouteOutcome.REJECTED);
    }

    @Test
    void deauthorizationForgetsTheWelcome() {
        store.mark("discord", "123");

        assertThat(deauthorized.handle(event("APPLICATION_DEAUTHORIZED", "123", "ana"))).isEqualTo(RouteOutcome.ACKNOWLEDGED);

        assertThat(store.has("discord", "123")).isFalse();
        assertThat(deauthorized.handle(event("APPLICATION_DEAUTHORIZED", "123", "ana"))).isEqualTo(RouteOutcome.ACKNOWLEDGED);
    }

    private WebhookEvent event(String type, String id, String username) {
        String body = """
            {"type":1,"event":{"type":"%s","data":{"user":{"id":"%s","username":"%s"}}}}
            """.formatted(type, id, username);
        return decoder.decode(body.getBytes(StandardCharsets.UTF_8)).event();
    }

    private static final class FakeIdentityDirectory implements IdentityDirectory {
        final Map<String, String> links = new HashMap<>();
        final List<ExternalUser> recorded = new ArrayList<>();
        boolean failOnRecord;

        @Override
        public Optional<String> linkedUserId(String channelType, String externalId) {
            return Optional.ofNullable(links.get(channelType + ":" + externalId));
        }

        @Override
        public void recordDisplayName(ExternalUser user) throws IOException {
            if (failOnRecord) {
                throw new IOException("disk full");
            }
            recorded.add(user);
        }
    }
}
