package io.mhm.cli;

import io.mhm.core.config.ConfigPaths;
import io.mhm.core.config.ConfigService;
import io.mhm.core.config.model.MhmConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    WebhookRunner webhookRunner
) {
    public CliContext(ConfigService configService, Path configPath, Map<String, String> environment) {
        this(configService, configPath, environment, portOverride -> {
            throw new UnsupportedOperationException("webhook runner is not configured");
        });
    }

    /**
     * Config file merged over defaults, then the environment on top.
     */
    public MhmConfig loadConfig() throws IOException {
        return configService.applyEnvironment(configService.load(configPath), environment);
    }

    public Path dataDir(MhmConfig config) {
        return ConfigPaths.resolveDataDir(config.storage().dataDir());
    }
}
