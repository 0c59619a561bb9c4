package org.dbsync.migration.contributor.create;

import org.dbsync.migration.contributor.TableContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;

public record CreateTableStatementContributor(String tableName, String createStatement) implements TableContributor {
    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getCommentSql("Creating table " + tableName));
        statements.add(dialect.getCreateTableSql(createStatement));
    }
}
