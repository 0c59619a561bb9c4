package org.dbsync.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One column of a foreign key constraint. Composite keys appear as several rows
 * sharing {@link #constraintName}.
 */
@Value
@Builder
@Jacksonized
public class ForeignKeyDef {
    public static final String DEFAULT_RULE = "RESTRICT";

    @NonNull String constraintName;
    @NonNull String column;
    @NonNull String referencedTable;
    @NonNull String referencedColumn;
    @Builder.Default String updateRule = DEFAULT_RULE;
    @Builder.Default String deleteRule = DEFAULT_RULE;

    public String describe() {
        return constraintName + ": " + column + " -> " + referencedTable + "(" + referencedColumn + ")"
                + " ON UPDATE " + updateRule + " ON DELETE " + deleteRule;
    }
}
