package org.dbsync.migration.plan;

import java.util.List;

/**
 * Marks a table whose rows must be transferred by an external bulk export/import.
 *
 * @param approximateRows catalog estimate of the source table, for display only
 * @param columns         source columns in ordinal order
 */
public record DataSyncMarker(String table, long approximateRows, List<String> columns) {
    public DataSyncMarker {
        columns = List.copyOf(columns);
    }
}
