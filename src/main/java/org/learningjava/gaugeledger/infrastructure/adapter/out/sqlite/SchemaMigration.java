package org.learningjava.gaugeledger.infrastructure.adapter.out.sqlite;

import java.util.List;

/**
 * One schema upgrade step. Applying it brings a database from {@code version - 1} to
 * {@code version}.
 */
public record SchemaMigration(int version, String description, List<String> statements) {
    public SchemaMigration {
        if (version < 2) {
            throw new IllegalArgumentException("migrations start at version 2, got " + version);
        }
        statements = List.copyOf(statements);
    }
}
