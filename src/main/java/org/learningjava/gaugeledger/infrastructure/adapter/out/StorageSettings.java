package org.learningjava.gaugeledger.infrastructure.adapter.out;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/** Which backend to build and, for SQLite, where its file lives. */
public record StorageSettings(Type type, Path sqlitePath) {

    public static final Path DEFAULT_SQLITE_PATH = Path.of("results", "gaugeledger.db");

    public enum Type {
        SQLITE, MEMORY;

        public static Type parse(String value) {
            if (value == null || value.isBlank()) {
                return SQLITE;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown storage type: " + value + " (expected sqlite or memory)", e);
            }
        }
    }

    public StorageSettings {
        Objects.requireNonNull(type, "type");
        if (sqlitePath == null) {
            sqlitePath = DEFAULT_SQLITE_PATH;
        }
    }

    public static StorageSettings sqlite(Path path) {
        return new StorageSettings(Type.SQLITE, path);
    }

    public static StorageSettings memory() {
        return new StorageSettings(Type.MEMORY, null);
    }
}
