package io.mhm.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String WELCOME_LEDGER_FILE = "welcome_tracking.json";
    public static final String IDENTITY_FILE = "identities.json";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".mhm", "config.json");
    }

    public static Path resolveDataDir(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".mhm", "data");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path welcomeLedger(Path dataDir) {
        return dataDir.resolve(WELCOME_LEDGER_FILE);
    }

    public static Path identityDirectory(Path dataDir) {
        return dataDir.resolve(IDENTITY_FILE);
    }
}
