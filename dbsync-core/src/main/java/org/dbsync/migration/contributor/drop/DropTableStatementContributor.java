package org.dbsync.migration.contributor.drop;

import org.dbsync.migration.contributor.TableContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;

public record DropTableStatementContributor(String tableName) implements TableContributor {
    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getCommentSql("Removing table " + tableName));
        statements.add(dialect.getDropTableSql(tableName));
    }
}
