package org.dbsync.migration;

import lombok.Getter;
import org.dbsync.migration.contributor.DdlContributor;
import org.dbsync.migration.contributor.SqlContributor;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class AlterTableBuilder {
    @Getter
    private final String tableName;
    @Getter
    private final DdlDialect dialect;
    @Getter
    private final List<DdlContributor> units = new ArrayList<>();

    public AlterTableBuilder(String tableName, DdlDialect dialect) {
        this.tableName = tableName;
        this.dialect = dialect;
    }

    public AlterTableBuilder add(DdlContributor unit) {
        units.add(unit);
        return this;
    }

    /**
     * One statement per unit, preceded by a comment naming the table.
     */
    public List<String> build() {
        List<String> statements = new ArrayList<>();
        if (units.isEmpty()) return statements;
        statements.add(dialect.getCommentSql("Modifying table structure " + tableName));
        units.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> c.contribute(statements, dialect));
        return statements;
    }
}
