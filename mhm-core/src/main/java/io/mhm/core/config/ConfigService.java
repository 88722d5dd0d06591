package io.mhm.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mhm.core.config.model.DiscordConfig;
import io.mhm.core.config.model.MhmConfig;
import io.mhm.core.config.model.StorageConfig;
import io.mhm.core.config.model.WebhookConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    public static final String ENV_PUBLIC_KEY = "DISCORD_PUBLIC_KEY";
    public static final String ENV_BOT_TOKEN = "DISCORD_BOT_TOKEN";
    public static final String ENV_PORT = "MHM_WEBHOOK_PORT";
    public static final String ENV_HOST = "MHM_WEBHOOK_HOST";
    public static final String ENV_DATA_DIR = "MHM_DATA_DIR";
    public static final String ENV_ALLOW_UNSIGNED = "MHM_ALLOW_UNSIGNED_WEBHOOKS";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MhmConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MhmConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(MhmConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, MhmConfig.class);
    }

    /**
     * Loads the file and then layers the process environment on top.
     */
    public MhmConfig loadEffective(Path configPath) throws IOException {
        return applyEnvironment(load(configPath), System.getenv());
    }

    public MhmConfig applyEnvironment(MhmConfig config, Map<String, String> env) {
        WebhookConfig webhook = config.webhook();
        DiscordConfig discord = config.discord();
        StorageConfig storage = config.storage();

        webhook = new WebhookConfig(
            value(env, ENV_HOST, webhook.host()),
            intValue(env, ENV_PORT, webhook.port()),
            value(env, ENV_PUBLIC_KEY, webhook.publicKey()),
            boolValue(env, ENV_ALLOW_UNSIGNED, webhook.allowUnsignedRequests())
        );
        discord = new DiscordConfig(
            value(env, ENV_BOT_TOKEN, discord.botToken()),
            discord.apiBase(),
            discord.settleDelayMillis()
        );
        storage = new StorageConfig(value(env, ENV_DATA_DIR, storage.dataDir()), storage.zone());
        return new MhmConfig(webhook, discord, storage);
    }

    public void save(Path configPath, MhmConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        MhmConfig config;
        if (created || overwrite) {
            config = MhmConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
        Files.createDirectories(dataDir);
        return new OnboardResult(configPath, dataDir, created, overwritten);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    private static String value(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intValue(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring {}={}: not a number", key, value);
            return fallback;
        }
    }

    private static boolean boolValue(Map<String, String> env, String key, boolean fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
    }
}
