package org.learningjava.gaugeledger.infrastructure.adapter.out;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.infrastructure.adapter.out.memory.InMemoryStatsStorageAdapter;
import org.learningjava.gaugeledger.infrastructure.adapter.out.sqlite.SqliteStatsStorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/** Builds storage handles from explicit settings. Handles are returned unopened. */
public final class StatsStorageFactory {

    private static final Logger log = LoggerFactory.getLogger(StatsStorageFactory.class);

    private StatsStorageFactory() {
    }

    public static StatsStoragePort create(StorageSettings settings) {
        return create(settings, new ObjectMapper(), Clock.systemUTC());
    }

    public static StatsStoragePort create(StorageSettings settings, ObjectMapper om, Clock clock) {
        log.debug("Creating {} stats storage", settings.type());
        return switch (settings.type()) {
            case SQLITE -> new SqliteStatsStorageAdapter(settings.sqlitePath(), om, clock);
            case MEMORY -> new InMemoryStatsStorageAdapter(om);
        };
    }

    /** Creates and opens a handle. */
    public static StatsStoragePort open(StorageSettings settings) {
        StatsStoragePort storage = create(settings);
        storage.open();
        return storage;
    }
}
