package io.mhm.cli;

@FunctionalInterface
public interface WebhookRunner {
    /**
     * Runs the webhook server until the process is asked to stop.
     *
     * @param portOverride port from the command line, or {@code null} for the configured one
     */
    int run(Integer portOverride) throws Exception;
}
