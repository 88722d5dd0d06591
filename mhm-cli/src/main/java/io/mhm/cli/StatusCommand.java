package io.mhm.cli;

import io.mhm.core.config.ConfigPaths;
import io.mhm.core.config.model.MhmConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MhmConfig config = context.loadConfig();
            Path dataDir = context.dataDir(config);
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Webhook listen: " + config.webhook().host() + ":" + config.webhook().port());
            System.out.println("Signature verification: " + (config.webhook().signed()
                ? "ed25519"
                : config.webhook().allowUnsignedRequests() ? "DISABLED (unsigned requests allowed)" : "not configured"));
            System.out.println("Discord bot configured: " + config.discord().configured());
            System.out.println("Settle delay: " + config.discord().settleDelayMillis() + " ms");
            System.out.println("Data directory: " + dataDir);
            System.out.println("Welcome ledger: " + ConfigPaths.welcomeLedger(dataDir));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
