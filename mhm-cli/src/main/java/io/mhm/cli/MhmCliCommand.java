package io.mhm.cli;

import picocli.CommandLine.Command;

@Command(name = "mhm", mixinStandardHelpOptions = true, description = "MHM webhook gateway")
public final class MhmCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
