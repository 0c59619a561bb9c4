package org.dbsync.migration.spi.dialect;

import org.dbsync.model.ColumnDef;

import java.util.List;

public interface DdlDialect extends BaseDialect {
    // Session
    String getUseDatabaseSql(String database);
    String getForeignKeyChecksSql(boolean enabled);

    // Table
    String getCreateTableSql(String createStatement);
    String getDropTableSql(String table);
    String getTruncateTableSql(String table);

    // Column
    String getColumnDefinitionSql(ColumnDef column);
    String getAddColumnSql(String table, ColumnDef column);
    String getDropColumnSql(String table, String column);
    String getModifyColumnSql(String table, ColumnDef column);

    // Data
    String getInsertColumnsHeader(String table, List<String> columns);
}
