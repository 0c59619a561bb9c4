package org.dbsync.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Column-level difference of one table, moving the target toward the source.
 * All three lists are sorted by column name.
 */
@Value
@Builder
public class ColumnDiff {
    String table;
    /** Columns only in the source. */
    @Builder.Default List<String> added = List.of();
    /** Columns only in the target. */
    @Builder.Default List<String> removed = List.of();
    @Builder.Default List<ChangedColumn> changed = List.of();

    public record ChangedColumn(String name, List<FieldDelta> deltas) {
        public ChangedColumn {
            deltas = List.copyOf(deltas);
        }

        public boolean has(FieldDelta.Field field) {
            return deltas.stream().anyMatch(d -> d.field() == field);
        }
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }
}
