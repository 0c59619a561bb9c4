package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;
import org.dbsync.model.ColumnDef;

import java.util.List;

public record ColumnAddContributor(String table, ColumnDef col) implements DdlContributor {
    @Override
    public int priority() {
        return 20; // Column Add
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getAddColumnSql(table, col));
    }
}
