package org.dbsync.migration.plan;

import org.dbsync.model.ColumnDef;

import java.util.Objects;

/**
 * A single column clause of an ALTER TABLE.
 *
 * @param column     column name
 * @param definition source-side definition; {@code null} for {@link Kind#DROP}
 */
public record ColumnChange(Kind kind, String column, ColumnDef definition) {

    public enum Kind { ADD, DROP, MODIFY }

    public ColumnChange {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(column, "column must not be null");
        if (kind != Kind.DROP && definition == null) {
            throw new IllegalArgumentException(kind + " of column '" + column + "' requires a definition");
        }
    }

    public static ColumnChange add(ColumnDef definition) {
        return new ColumnChange(Kind.ADD, definition.getName(), definition);
    }

    public static ColumnChange drop(String column) {
        return new ColumnChange(Kind.DROP, column, null);
    }

    public static ColumnChange modify(ColumnDef definition) {
        return new ColumnChange(Kind.MODIFY, definition.getName(), definition);
    }
}
