package org.dbsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Four disjoint, name-sorted sets of table names derived from a source and a target schema.
 * Every table of either schema appears in exactly one of them.
 */
@Value
@Builder
public class Classification {
    @Singular("newTable") Set<String> newTables;
    @Singular("removedTable") Set<String> removedTables;
    @Singular("modifiedTable") Set<String> modifiedTables;
    @Singular("identicalTable") Set<String> identicalTables;
    /** Partial-metadata and unsafe-change notices, surfaced before anything is generated. */
    @Singular List<String> warnings;

    public Optional<TableStatus> statusOf(String table) {
        if (newTables.contains(table)) return Optional.of(TableStatus.NEW);
        if (removedTables.contains(table)) return Optional.of(TableStatus.REMOVED);
        if (modifiedTables.contains(table)) return Optional.of(TableStatus.MODIFIED);
        if (identicalTables.contains(table)) return Optional.of(TableStatus.IDENTICAL);
        return Optional.empty();
    }

    public int totalChanges() {
        return newTables.size() + removedTables.size() + modifiedTables.size();
    }

    public boolean hasChanges() {
        return totalChanges() > 0;
    }
}
