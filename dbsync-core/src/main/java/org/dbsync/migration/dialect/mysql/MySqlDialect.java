package org.dbsync.migration.dialect.mysql;

import org.dbsync.migration.AbstractDialect;
import org.dbsync.migration.spi.ValueTransformer;
import org.dbsync.model.ColumnDef;

import java.util.List;
import java.util.StringJoiner;
import java.util.stream.Collectors;

public class MySqlDialect extends AbstractDialect {

    public MySqlDialect() {
        super();
    }

    @Override
    protected ValueTransformer initializeValueTransformer() {
        return new MySqlValueTransformer();
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "`" + raw.replace("`", "``") + "`";
    }

    @Override
    public String getUseDatabaseSql(String database) {
        return "USE " + quoteIdentifier(database) + ";";
    }

    @Override
    public String getForeignKeyChecksSql(boolean enabled) {
        return "SET FOREIGN_KEY_CHECKS = " + (enabled ? 1 : 0) + ";";
    }

    @Override
    public String getCreateTableSql(String createStatement) {
        String ddl = createStatement.trim();
        return ddl.endsWith(";") ? ddl : ddl + ";";
    }

    @Override
    public String getDropTableSql(String table) {
        return "DROP TABLE IF EXISTS " + quoteIdentifier(table) + ";";
    }

    @Override
    public String getTruncateTableSql(String table) {
        return "TRUNCATE TABLE " + quoteIdentifier(table) + ";";
    }

    @Override
    public String getColumnDefinitionSql(ColumnDef column) {
        StringJoiner sj = new StringJoiner(" ");
        sj.add(quoteIdentifier(column.getName()));
        sj.add(column.getType().trim());
        sj.add(column.nullabilityKeyword());
        if (column.hasDefault()) {
            sj.add("DEFAULT " + valueTransformer.renderDefault(column));
        }
        String extra = MySqlUtil.normalizeExtra(column.getExtra());
        if (!extra.isEmpty()) {
            sj.add(extra);
        }
        return sj.toString();
    }

    @Override
    public String getAddColumnSql(String table, ColumnDef column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + getColumnDefinitionSql(column) + ";";
    }

    @Override
    public String getDropColumnSql(String table, String column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP COLUMN " + quoteIdentifier(column) + ";";
    }

    @Override
    public String getModifyColumnSql(String table, ColumnDef column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " MODIFY COLUMN " + getColumnDefinitionSql(column) + ";";
    }

    @Override
    public String getInsertColumnsHeader(String table, List<String> columns) {
        String cols = columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        return "INSERT INTO " + quoteIdentifier(table) + " (" + cols + ") VALUES";
    }
}
