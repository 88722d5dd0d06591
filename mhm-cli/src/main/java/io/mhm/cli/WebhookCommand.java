package io.mhm.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "webhook", description = "Start the Discord webhook server")
public final class WebhookCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Listen port (overrides config)")
    Integer port;

    public WebhookCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.webhookRunner().run(port);
        } catch (Exception e) {
            System.err.println("Webhook command failed: " + e.getMessage());
            return 1;
        }
    }
}
