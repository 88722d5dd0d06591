package io.mhm.core.welcome;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-file ledger. Every mutation loads the whole map, changes one key and rewrites the file
 * through a temp file and an atomic move, so a crash never leaves a half-written ledger.
 */
public final class FileWelcomeStore implements WelcomeStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileWelcomeStore.class);
    private static final DateTimeFormatter HUMAN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path path;
    private final Clock clock;
    private final ZoneId zone;
    private final ObjectMapper mapper;

    public FileWelcomeStore(Path path) {
        this(path, Clock.systemDefaultZone());
    }

    public FileWelcomeStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.zone = clock.getZone();
        this.mapper = new ObjectMapper();
    }

    @Override
    public synchronized boolean has(String channelType, String externalId) {
        WelcomeRecord record = load().get(WelcomeStore.key(channelType, externalId));
        return record != null && record.welcomed();
    }

    @Override
    public synchronized boolean mark(String channelType, String externalId) {
        Map<String, WelcomeRecord> records = new LinkedHashMap<>(load());
        Instant now = clock.instant();
        records.put(WelcomeStore.key(channelType, externalId), new WelcomeRecord(
            HUMAN_FORMAT.format(now.atZone(zone)),
            now.toString(),
            channelType,
            true
        ));
        try {
            save(records);
            LOG.debug("Marked {}:{} as welcomed", channelType, externalId);
            return true;
        } catch (IOException e) {
            LOG.error("Failed to persist welcome record for {}:{} to {}", channelType, externalId, path, e);
            return false;
        }
    }

    @Override
    public synchronized boolean clear(String channelType, String externalId) {
        Map<String, WelcomeRecord> records = new LinkedHashMap<>(load());
        if (records.remove(WelcomeStore.key(channelType, externalId)) == null) {
            return true;
        }
        try {
            save(records);
            LOG.debug("Cleared welcome record for {}:{}", channelType, externalId);
            return true;
        } catch (IOException e) {
            LOG.error("Failed to clear welcome record for {}:{} in {}", channelType, externalId, path, e);
            return false;
        }
    }

    @Override
    public synchronized Optional<WelcomeRecord> find(String channelType, String externalId) {
        return Optional.ofNullable(load().get(WelcomeStore.key(channelType, externalId)));
    }

    @Override
    public synchronized Map<String, WelcomeRecord> list() {
        return Map.copyOf(load());
    }

    private Map<String, WelcomeRecord> load() {
        if (!Files.exists(path)) {
            return Map.of();
        }
        try {
            Map<String, WelcomeRecord> records = mapper.readValue(
                Files.readString(path),
                new TypeReference<LinkedHashMap<String, WelcomeRecord>>() {
                }
            );
            return records == null ? Map.of() : records;
        } catch (Exception e) {
            LOG.warn("Welcome ledger {} is unreadable, treating it as empty: {}", path, e.getMessage());
            return Map.of();
        }
    }

    private void save(Map<String, WelcomeRecord> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
