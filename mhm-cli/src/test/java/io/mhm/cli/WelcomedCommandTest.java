package io.mhm.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.mhm.core.config.ConfigService;
import io.mhm.core.welcome.FileWelcomeStore;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class WelcomedCommandTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path ledger;
    private CliContext context;

    @BeforeEach
    void setUp() throws Exception {
        Path dataDir = tempDir.resolve("data");
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "storage": { "dataDir": "%s" } }
            """.formatted(dataDir.toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
        ledger = dataDir.resolve("welcome_tracking.json");
        context = new CliContext(new ConfigService(), configPath, Map.of());
    }

    @Test
    void listsWelcomedUsers() {
        new FileWelcomeStore(ledger).mark("discord", "123");

        CommandResult result = run(new WelcomedCommand(context));

        assertThat(result.code()).isZero();
        assertThat(result.out()).contains("discord:123");
    }

    @Test
    void showsStatusForOneUser() {
        new FileWelcomeStore(ledger).mark("discord", "123");

        assertThat(run(new WelcomedCommand(context), "123").out()).contains("discord:123 welcomed at");
        assertThat(run(new WelcomedCommand(context), "456").out()).contains("discord:456 not welcomed");
    }

    @Test
    void clearsOneUserSoTheyAreWelcomedAgain() {
        new FileWelcomeStore(ledger).mark("discord", "123");

        CommandResult result = run(new WelcomedCommand(context), "--clear", "123");

        assertThat(result.code()).isZero();
        assertThat(result.out()).contains("Cleared discord:123");
        assertThat(new FileWelcomeStore(ledger).has("discord", "123")).isFalse();
    }

    @Test
    void clearWithoutIdIsAUsageError() {
        assertThat(run(new WelcomedCommand(context), "--clear").code()).isEqualTo(2);
    }

    @Test
    void webhookCommandPassesPortOverrideToRunner() {
        Integer[] seen = new Integer[1];
        CliContext withRunner = new CliContext(new ConfigService(), configPath, Map.of(), port -> {
            seen[0] = port;
            return 0;
        });

        assertThat(run(new WebhookCommand(withRunner), "--port", "9999").code()).isZero();
        assertThat(seen[0]).isEqualTo(9999);
    }

    @Test
    void statusReportsConfigurationWithEnvironmentApplied() {
        CliContext withEnv = new CliContext(new ConfigService(), configPath, Map.of("DISCORD_BOT_TOKEN", "token"));

        CommandResult result = run(new StatusCommand(withEnv));

        assertThat(result.code()).isZero();
        assertThat(result.out())
            .contains("Discord bot configured: true")
            .contains("Signature verification: not configured")
            .contains(ledger.toString());
    }

    private static CommandResult run(Object command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).execute(args);
        } finally {
            System.setOut(originalOut);
        }
        return new CommandResult(code, out.toString(StandardCharsets.UTF_8));
    }

    private record CommandResult(int code, String out) {
    }
}
