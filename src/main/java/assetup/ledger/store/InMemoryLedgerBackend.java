package assetup.ledger.store;

import assetup.ledger.config.LedgerProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Committed ledger state held in memory.
 *
 * Storage modes:
 *
 * MODE 1 - In-Memory (default, ledger.persistence.enabled=false):
 *   - State is lost on restart
 *   - Good for: development, testing
 *
 * MODE 2 - Snapshot file (ledger.persistence.enabled=true):
 *   - Whole state rewritten as JSON after every committed call
 *   - Values are serialized before a commit is applied; an unserializable value fails the commit
 *   - Snapshot writes are best-effort: an IO failure is logged and the in-memory state stands
 *   - Reloaded on startup
 *   - Configure: ledger.persistence.file-path (default: ./data/ledger-snapshot.json)
 */
@Component
@Slf4j
public class InMemoryLedgerBackend implements LedgerBackend {

    private final Map<LedgerKey<?>, Object> entries = new ConcurrentHashMap<>();
    private final Map<LedgerKey<?>, JsonNode> serialized = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LedgerProperties properties;

    public InMemoryLedgerBackend(LedgerProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void loadSnapshot() {
        if (!properties.getPersistence().isEnabled()) {
            return;
        }
        Path path = Path.of(properties.getPersistence().getFilePath());
        if (!Files.exists(path)) {
            log.info("Ledger snapshot does not exist yet: {}", path);
            return;
        }
        try {
            List<SnapshotEntry> stored = objectMapper.readValue(path.toFile(), new TypeReference<>() {});
            for (SnapshotEntry entry : stored) {
                Object value = objectMapper.convertValue(
                    entry.value(), entry.key().valueType(objectMapper.getTypeFactory()));
                entries.put(entry.key(), value);
                serialized.put(entry.key(), entry.value());
            }
            log.info("Loaded {} ledger entries from {}", entries.size(), path);
        } catch (IOException | IllegalArgumentException ex) {
            throw new IllegalStateException("Unable to load ledger snapshot from " + path, ex);
        }
    }

    @Override
    public Optional<Object> read(LedgerKey<?> key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void commit(Map<LedgerKey<?>, Optional<Object>> changes) {
        if (changes.isEmpty()) {
            return;
        }
        boolean persistent = properties.getPersistence().isEnabled();
        Map<LedgerKey<?>, JsonNode> trees = new HashMap<>();
        if (persistent) {
            changes.forEach((key, value) -> value.ifPresent(v -> trees.put(key, objectMapper.valueToTree(v))));
        }
        changes.forEach((key, value) -> {
            if (value.isPresent()) {
                entries.put(key, value.get());
            } else {
                entries.remove(key);
                serialized.remove(key);
            }
        });
        if (persistent) {
            serialized.putAll(trees);
            writeSnapshot();
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    private void writeSnapshot() {
        Path path = Path.of(properties.getPersistence().getFilePath());
        List<SnapshotEntry> snapshot = new ArrayList<>(serialized.size());
        serialized.forEach((key, value) -> snapshot.add(new SnapshotEntry(key, value)));
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            log.error("Failed to write ledger snapshot to {}", path, ex);
        }
    }

    record SnapshotEntry(LedgerKey<?> key, JsonNode value) {
    }
}
