package org.dbsync.cli.service;

import java.nio.file.Path;

/**
 * Where one side's schema comes from: a JSON snapshot, or a live connection.
 */
public record SchemaSpec(String label, Path snapshot, ConnectionSettings connection) {

    public static SchemaSpec snapshot(String label, Path file) {
        return new SchemaSpec(label, file, null);
    }

    public static SchemaSpec live(String label, ConnectionSettings settings) {
        return new SchemaSpec(label, null, settings);
    }

    public boolean isSnapshot() {
        return snapshot != null;
    }
}
