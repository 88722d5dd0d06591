package io.mhm.core.identity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mhm.core.model.ExternalUser;
import io.mhm.core.welcome.WelcomeStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileIdentityDirectory implements IdentityDirectory {
    private static final Logger LOG = LoggerFactory.getLogger(FileIdentityDirectory.class);

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileIdentityDirectory(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Optional<String> linkedUserId(String channelType, String externalId) {
        IdentityRecord record = load().get(WelcomeStore.key(channelType, externalId));
        if (record == null || !record.linked()) {
            return Optional.empty();
        }
        return Optional.of(record.linkedUserId());
    }

    @Override
    public synchronized void recordDisplayName(ExternalUser user) throws IOException {
        if (!user.hasId() || user.displayName().isBlank()) {
            return;
        }
        Map<String, IdentityRecord> records = new LinkedHashMap<>(load());
        String key = WelcomeStore.key(user.channelType(), user.externalId());
        IdentityRecord current = records.get(key);
        if (current != null && user.displayName().equals(current.displayName())) {
            return;
        }
        records.put(key, new IdentityRecord(
            user.channelType(),
            user.externalId(),
            user.displayName(),
            current == null ? null : current.linkedUserId(),
            clock.instant()
        ));
        save(records);
    }

    private Map<String, IdentityRecord> load() {
        if (!Files.exists(path)) {
            return Map.of();
        }
        try {
            Map<String, IdentityRecord> records = mapper.readValue(
                Files.readString(path),
                new TypeReference<LinkedHashMap<String, IdentityRecord>>() {
                }
            );
            return records == null ? Map.of() : records;
        } catch (Exception e) {
            LOG.warn("Identity directory {} is unreadable, treating it as empty: {}", path, e.getMessage());
            return Map.of();
        }
    }

    private void save(Map<String, IdentityRecord> records) throws IOException {
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
