package org.dbsync.migration.contributor.drop;

import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;

public record ColumnDropContributor(String table, String column) implements DdlContributor {
    @Override
    public int priority() {
        return 30; // Column Drop
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getDropColumnSql(table, column));
    }
}
