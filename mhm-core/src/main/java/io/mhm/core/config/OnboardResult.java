package io.mhm.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, Path dataDir, boolean createdConfig, boolean overwrittenConfig) {
}
