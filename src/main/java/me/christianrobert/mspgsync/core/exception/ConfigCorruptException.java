package me.christianrobert.mspgsync.core.exception;

import java.nio.file.Path;

/**
 * A persisted mapping file is unreadable or malformed. Fatal at load time;
 * deleting the file regenerates the defaults on next load.
 */
public class ConfigCorruptException extends MigrationException {

    private final Path path;

    public ConfigCorruptException(Path path, String message, Throwable cause) {
        super(String.format("Configuration file %s is corrupt: %s", path, message), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
