package org.dbsync.migration;

import org.dbsync.migration.contributor.SqlContributor;
import org.dbsync.migration.contributor.TableContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assembles table-level blocks: drop, verbatim create, truncate plus export notice.
 */
public class TableStatementBuilder {
    private final DdlDialect dialect;
    private final List<TableContributor> contributors = new ArrayList<>();

    public TableStatementBuilder(DdlDialect dialect) {
        this.dialect = dialect;
    }

    public TableStatementBuilder add(TableContributor c) {
        contributors.add(c);
        return this;
    }

    public List<String> build() {
        List<String> statements = new ArrayList<>();
        contributors.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> c.contribute(statements, dialect));
        return statements;
    }
}
