package org.dbsync.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Foreign key difference keyed by constraint name, same replace rule as {@link IndexDiff}.
 */
@Value
@Builder
public class ForeignKeyDiff {
    String table;
    @Builder.Default List<ForeignKeyDef> added = List.of();
    @Builder.Default List<ForeignKeyDef> removed = List.of();

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
