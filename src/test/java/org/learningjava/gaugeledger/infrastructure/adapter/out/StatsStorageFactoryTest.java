package org.learningjava.gaugeledger.infrastructure.adapter.out;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.infrastructure.adapter.out.memory.InMemoryStatsStorageAdapter;
import org.learningjava.gaugeledger.infrastructure.adapter.out.sqlite.SqliteStatsStorageAdapter;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StatsStorageFactoryTest {

    @TempDir
    Path tmp;

    @Test
    void create_returnsUnopenedHandleOfRequestedType() {
        StatsStoragePort memory = StatsStorageFactory.create(StorageSettings.memory());
        assertInstanceOf(InMemoryStatsStorageAdapter.class, memory);
        assertFalse(memory.isOpen());

        StatsStoragePort sqlite = StatsStorageFactory.create(StorageSettings.sqlite(tmp.resolve("a.db")));
        assertInstanceOf(SqliteStatsStorageAdapter.class, sqlite);
        assertFalse(sqlite.isOpen());
    }

    @Test
    void open_returnsReadyHandle() {
        StatsStoragePort storage = StatsStorageFactory.open(StorageSettings.sqlite(tmp.resolve("b.db")));
        try {
            assertTrue(storage.isOpen());
            assertTrue(storage.getVariantIds().isEmpty());
        } finally {
            storage.close();
        }
    }

    @Test
    void settings_defaultSqlitePath_andTypeParsing() {
        assertEquals(StorageSettings.DEFAULT_SQLITE_PATH, new StorageSettings(StorageSettings.Type.SQLITE, null).sqlitePath());
        assertEquals(StorageSettings.Type.MEMORY, StorageSettings.Type.parse(" Memory "));
        assertEquals(StorageSettings.Type.SQLITE, StorageSettings.Type.parse(null));
        assertThrows(IllegalArgumentException.class, () -> StorageSettings.Type.parse("postgres"));
    }
}
