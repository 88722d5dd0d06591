package io.mhm.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mhm.cli.CliContext;
import io.mhm.cli.MhmCliCommand;
import io.mhm.cli.OnboardCommand;
import io.mhm.cli.StatusCommand;
import io.mhm.cli.WebhookCommand;
import io.mhm.cli.WelcomedCommand;
import io.mhm.core.api.WebhookServer;
import io.mhm.core.config.ConfigPaths;
import io.mhm.core.config.ConfigService;
import io.mhm.core.config.model.MhmConfig;
import io.mhm.core.discord.DiscordRestBotHandle;
import io.mhm.core.dispatch.BotHandle;
import io.mhm.core.dispatch.MarkWelcomedPolicy;
import io.mhm.core.dispatch.SingleThreadEventLoop;
import io.mhm.core.dispatch.WelcomeDispatcher;
import io.mhm.core.identity.FileIdentityDirectory;
import io.mhm.core.identity.IdentityDirectory;
import io.mhm.core.webhook.ApplicationAuthorizedHandler;
import io.mhm.core.webhook.ApplicationDeauthorizedHandler;
import io.mhm.core.webhook.SignatureVerifier;
import io.mhm.core.webhook.WebhookDecoder;
import io.mhm.core.webhook.WebhookEvent;
import io.mhm.core.webhook.WebhookEventRouter;
import io.mhm.core.welcome.FileWelcomeStore;
import io.mhm.core.welcome.WelcomeStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MhmApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MhmApplication.class);
    private static final String CHANNEL_TYPE = "discord";

    private MhmApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            System.getenv(),
            portOverride -> runWebhookServer(configService, configPath, portOverride)
        );

        CommandLine commandLine = new CommandLine(new MhmCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("webhook", new WebhookCommand(context));
        commandLine.addSubcommand("welcomed", new WelcomedCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runWebhookServer(ConfigService configService, Path configPath, Integer portOverride) throws Exception {
        MhmConfig config = configService.loadEffective(configPath);
        int port = portOverride != null ? portOverride : config.webhook().port();
        Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
        Clock clock = Clock.system(ZoneId.of(config.storage().zone()));

        // fails fast when neither a key nor the unsigned opt-in is configured
        SignatureVerifier verifier = SignatureVerifier.create(
            config.webhook().publicKey(),
            config.webhook().allowUnsignedRequests()
        );

        ObjectMapper mapper = new ObjectMapper();
        WelcomeStore store = new FileWelcomeStore(ConfigPaths.welcomeLedger(dataDir), clock);
        IdentityDirectory identities = new FileIdentityDirectory(ConfigPaths.identityDirectory(dataDir), clock);
        WelcomeDispatcher dispatcher = new WelcomeDispatcher(
            store,
            new MarkWelcomedPolicy(store),
            Duration.ofMillis(Math.max(0, config.discord().settleDelayMillis()))
        );

        OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();

        CountDownLatch shutdown = new CountDownLatch(1);
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop("mhm-bot-loop")) {
            BotHandle bot = null;
            if (config.discord().configured()) {
                bot = new DiscordRestBotHandle(httpClient, mapper, config.discord().apiBase(), config.discord().botToken(), loop);
            } else {
                LOG.warn("No Discord bot token configured; new users will be marked welcomed without a DM");
            }

            WebhookEventRouter router = new WebhookEventRouter()
                .register(
                    WebhookEvent.APPLICATION_AUTHORIZED,
                    new ApplicationAuthorizedHandler(CHANNEL_TYPE, store, identities, dispatcher, bot)
                )
                .register(WebhookEvent.APPLICATION_DEAUTHORIZED, new ApplicationDeauthorizedHandler(CHANNEL_TYPE, store));

            try (WebhookServer server = new WebhookServer(
                port,
                config.webhook().host(),
                verifier,
                new WebhookDecoder(mapper),
                router,
                mapper
            )) {
                Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
                server.start();
                System.out.println("Webhook server started on http://" + config.webhook().host() + ":" + server.port());
                System.out.println("Welcome ledger: " + ConfigPaths.welcomeLedger(dataDir));
                shutdown.await();
            }
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
        return 0;
    }
}
