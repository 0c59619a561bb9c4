package org.dbsync.migration.contributor.alter;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ColumnDef;

import java.util.List;

/**
 * Rewrites a column with its full source-side definition.
 */
public record ColumnModifyContributor(String table, ColumnDef newColumn) implements DdlContributor {
    @Override
    public int priority() {
        return 40; // Column Modify
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getModifyColumnSql(table, newColumn));
    }
}
