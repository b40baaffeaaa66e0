package me.christianrobert.mspgsync.typemapping.service;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.exception.ConfigCorruptException;
import me.christianrobert.mspgsync.core.tools.JsonFileStore;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owner of the type mapping table.
 *
 * <p>Readers take an immutable {@link TypeMappingTable} snapshot and keep using it for the
 * whole step, so edits become visible to the next migration only. Writers are serialized
 * and each write produces a new snapshot with an incremented version. The persisted file is
 * refreshed atomically; changes on disk are picked up by an explicit {@link #reload()}.</p>
 */
@ApplicationScoped
public class TypeMappingService {

    private static final Logger log = LoggerFactory.getLogger(TypeMappingService.class);

    static final String ROOT_KEY = "type_mappings";

    @Inject
    ConfigService configService;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Path path;
    private TypeMappingTable current;

    /**
     * Loads the table from the given file, creating it with the default catalog if absent.
     *
     * @throws ConfigCorruptException if the file exists but is malformed
     */
    public TypeMappingTable load(Path mappingFile) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, String> entries;
            if (Files.exists(mappingFile)) {
                entries = parse(mappingFile);
                if (entries.isEmpty()) {
                    log.warn("Type mapping file {} has no entries, using the default catalog", mappingFile);
                    entries = DefaultTypeMappings.get();
                }
            } else {
                log.info("Type mapping file {} not found, creating it with {} default entries",
                        mappingFile, DefaultTypeMappings.get().size());
                entries = DefaultTypeMappings.get();
                JsonFileStore.writeAtomically(mappingFile, Map.of(ROOT_KEY, entries));
            }

            long version = current == null ? 1 : current.getVersion() + 1;
            this.path = mappingFile;
            this.current = new TypeMappingTable(version, entries);
            log.info("Loaded {} type mappings from {} (version {})", current.size(), mappingFile, version);
            return current;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Re-reads the persisted file.
     */
    public TypeMappingTable reload() throws IOException {
        return load(getPath());
    }

    /**
     * Current snapshot. Loads the configured file on first use.
     */
    public TypeMappingTable snapshot() {
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

    /**
     * Resolves against the current snapshot. Callers processing many columns should take
     * one {@link #snapshot()} and resolve against it instead.
     */
    public String resolve(String sourceType, Integer precision, Integer scale, Integer length) {
        return snapshot().resolve(sourceType, precision, scale, length);
    }

    /**
     * Replaces the whole table, persisting it before it becomes visible.
     */
    public TypeMappingTable save(Map<String, String> mappings) throws IOException {
        lock.writeLock().lock();
        try {
            Path target = getPath();
            TypeMappingTable next = new TypeMappingTable(
                    current == null ? 1 : current.getVersion() + 1, mappings);
            JsonFileStore.writeAtomically(target, Map.of(ROOT_KEY, next.getEntries()));
            current = next;
            log.info("Saved {} type mappings to {} (version {})", next.size(), target, next.getVersion());
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public TypeMappingTable putMapping(String sourceSignature, String targetExpression) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, String> entries = new LinkedHashMap<>(snapshot().getEntries());
            entries.put(TypeMappingTable.normalizeSignature(sourceSignature), targetExpression);
            return save(entries);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public TypeMappingTable removeMapping(String sourceSignature) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, String> entries = new LinkedHashMap<>(snapshot().getEntries());
            entries.remove(TypeMappingTable.normalizeSignature(sourceSignature));
            return save(entries);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public TypeMappingTable resetToDefaults() throws IOException {
        return save(DefaultTypeMappings.get());
    }

    private Path getPath() {
        if (path != null) {
            return path;
        }
        return Path.of(configService.getConfigValueAsString(ConfigService.PATH_TYPE_MAPPINGS));
    }

    private Map<String, String> parse(Path mappingFile) {
        JsonNode root = JsonFileStore.read(mappingFile);
        if (!root.isObject()) {
            throw new ConfigCorruptException(mappingFile, "expected a JSON object", null);
        }

        JsonNode table = root.has(ROOT_KEY) ? root.get(ROOT_KEY) : root;
        if (!table.isObject()) {
            throw new ConfigCorruptException(mappingFile, "'" + ROOT_KEY + "' must be an object", null);
        }

        Map<String, String> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual() || field.getValue().asText().isBlank()) {
                throw new ConfigCorruptException(mappingFile,
                        "mapping for '" + field.getKey() + "' must be a non-empty string", null);
            }
            entries.put(field.getKey(), field.getValue().asText());
        }
        return entries;
    }
}
