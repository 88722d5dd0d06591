package io.mhm.cli;

import io.mhm.core.config.ConfigPaths;
import io.mhm.core.config.model.MhmConfig;
import io.mhm.core.welcome.FileWelcomeStore;
import io.mhm.core.welcome.WelcomeRecord;
import io.mhm.core.welcome.WelcomeStore;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "welcomed", description = "Inspect or reset the welcome ledger")
public final class WelcomedCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "External user id; omit to list every entry")
    String externalId;

    @Option(names = {"-c", "--channel"}, description = "Channel type", defaultValue = "discord")
    String channel;

    @Option(names = "--clear", description = "Forget the welcome so the user is greeted again")
    boolean clear;

    public WelcomedCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MhmConfig config = context.loadConfig();
            WelcomeStore store = new FileWelcomeStore(
                ConfigPaths.welcomeLedger(context.dataDir(config)),
                Clock.system(ZoneId.of(config.storage().zone()))
            );

            if (externalId == null || externalId.isBlank()) {
                if (clear) {
                    System.err.println("--clear needs an external user id");
                    return 2;
                }
                Map<String, WelcomeRecord> records = new TreeMap<>(store.list());
                if (records.isEmpty()) {
                    System.out.println("No welcomed users");
                }
                records.forEach((key, record) -> System.out.println(key + "  " + record.welcomedAt()));
                return 0;
            }

            if (clear) {
                if (!store.clear(channel, externalId)) {
                    System.err.println("Could not clear " + WelcomeStore.key(channel, externalId));
                    return 1;
                }
                System.out.println("Cleared " + WelcomeStore.key(channel, externalId));
                return 0;
            }

            Optional<WelcomeRecord> record = store.find(channel, externalId);
            if (record.isPresent() && record.get().welcomed()) {
                System.out.println(WelcomeStore.key(channel, externalId) + " welcomed at " + record.get().welcomedAt());
            } else {
                System.out.println(WelcomeStore.key(channel, externalId) + " not welcomed");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Welcomed command failed: " + e.getMessage());
            return 1;
        }
    }
}
