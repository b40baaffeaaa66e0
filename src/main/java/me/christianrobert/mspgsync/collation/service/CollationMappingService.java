package me.christianrobert.mspgsync.collation.service;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.exception.ConfigCorruptException;
import me.christianrobert.mspgsync.core.tools.JsonFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owner of the collation candidate lists. Same snapshot and persistence rules as the
 * type mapping table.
 */
@ApplicationScoped
public class CollationMappingService {

    private static final Logger log = LoggerFactory.getLogger(CollationMappingService.class);

    static final String ROOT_KEY = "collations";

    @Inject
    ConfigService configService;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Path path;
    private CollationMappingTable current;

    public CollationMappingTable load(Path mappingFile) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, List<String>> entries;
            if (Files.exists(mappingFile)) {
                entries = parse(mappingFile);
            } else {
                log.info("Collation file {} not found, creating it with {} default entries",
                        mappingFile, DefaultCollationMappings.get().size());
                entries = DefaultCollationMappings.get();
                JsonFileStore.writeAtomically(mappingFile, Map.of(ROOT_KEY, entries));
            }

            long version = current == null ? 1 : current.getVersion() + 1;
            this.path = mappingFile;
            this.current = new CollationMappingTable(version, entries);
            log.info("Loaded {} collation mappings from {} (version {})", current.size(), mappingFile, version);
            return current;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public CollationMappingTable reload() throws IOException {
        return load(getPath());
    }

    public CollationMappingTable snapshot() {
        lock.readLock().lock();
        try {
            if (current != null) {
                return current;
            }
        } finally {
            lock.readLock().unlock();
        }

        try {
            return load(getPath());
        } catch (IOException e) {
            throw new ConfigCorruptException(getPath(), e.getMessage(), e);
        }
    }

    public CollationMappingTable save(Map<String, List<String>> mappings) throws IOException {
        lock.writeLock().lock();
        try {
            Path target = getPath();
            CollationMappingTable next = new CollationMappingTable(
                    current == null ? 1 : current.getVersion() + 1, mappings);
            JsonFileStore.writeAtomically(target, Map.of(ROOT_KEY, next.getEntries()));
            current = next;
            log.info("Saved {} collation mappings to {} (version {})", next.size(), target, next.getVersion());
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public CollationMappingTable resetToDefaults() throws IOException {
        return save(DefaultCollationMappings.get());
    }

    private Path getPath() {
        if (path != null) {
            return path;
        }
        return Path.of(configService.getConfigValueAsString(ConfigService.PATH_COLLATIONS));
    }

    private Map<String, List<String>> parse(Path mappingFile) {
        JsonNode root = JsonFileStore.read(mappingFile);
        if (!root.isObject()) {
            throw new ConfigCorruptException(mappingFile, "expected a JSON object", null);
        }

        JsonNode table = root.has(ROOT_KEY) ? root.get(ROOT_KEY) : root;
        if (!table.isObject()) {
            throw new ConfigCorruptException(mappingFile, "'" + ROOT_KEY + "' must be an object", null);
        }

        Map<String, List<String>> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            // "_comment" style keys are documentation
            if (field.getKey().startsWith("_")) {
                continue;
            }
            JsonNode value = field.getValue();
            List<String> candidates = new ArrayList<>();
            if (value.isTextual()) {
                candidates.add(value.asText());
            } else if (value.isArray()) {
                for (JsonNode candidate : value) {
                    if (!candidate.isTextual()) {
                        throw new ConfigCorruptException(mappingFile,
                                "candidates of '" + field.getKey() + "' must be strings", null);
                    }
                    candidates.add(candidate.asText());
                }
            } else {
                throw new ConfigCorruptException(mappingFile,
                        "entry '" + field.getKey() + "' must be a string or a list of strings", null);
            }
            entries.put(field.getKey(), candidates);
        }
        return entries;
    }
}
