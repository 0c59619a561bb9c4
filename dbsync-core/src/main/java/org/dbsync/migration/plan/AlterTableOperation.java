package org.dbsync.migration.plan;

import java.util.List;

/**
 * Column changes for a table present on both sides, already in application order.
 */
public record AlterTableOperation(String table, List<ColumnChange> changes) implements StructureOperation {
    public AlterTableOperation {
        changes = List.copyOf(changes);
    }

    public List<ColumnChange> changesOf(ColumnChange.Kind kind) {
        return changes.stream().filter(c -> c.kind() == kind).toList();
    }
}
