package org.dbsync.extract;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MetadataSource} for MySQL and MariaDB over a plain JDBC connection.
 * The connection is owned by the caller and is never closed here.
 */
public class JdbcMetadataSource implements MetadataSource {

    static final String CURRENT_DATABASE_SQL = "SELECT DATABASE() AS current_db";

    static final String TABLES_SQL = """
            SELECT TABLE_NAME, ENGINE, TABLE_COLLATION, TABLE_ROWS, DATA_LENGTH, TABLE_COMMENT
            FROM INFORMATION_SCHEMA.TABLES
            WHERE TABLE_SCHEMA = ?
              AND TABLE_TYPE = 'BASE TABLE'
            ORDER BY TABLE_NAME""";

    static final String COLUMNS_SQL = """
            SELECT COLUMN_NAME, COLUMN_TYPE, IS_NULLABLE, COLUMN_DEFAULT, EXTRA,
                   COLUMN_COMMENT, ORDINAL_POSITION, COLUMN_KEY
            FROM INFORMATION_SCHEMA.COLUMNS
            WHERE TABLE_SCHEMA = ?
              AND TABLE_NAME = ?
            ORDER BY ORDINAL_POSITION""";

    static final String FOREIGN_KEYS_SQL = """
            SELECT kcu.CONSTRAINT_NAME, kcu.COLUMN_NAME,
                   kcu.REFERENCED_TABLE_NAME, kcu.REFERENCED_COLUMN_NAME,
                   COALESCE(rc.UPDATE_RULE, 'RESTRICT') AS UPDATE_RULE,
                   COALESCE(rc.DELETE_RULE, 'RESTRICT') AS DELETE_RULE
            FROM INFORMATION_SCHEMA.KEY_COLUMN_USAGE kcu
            LEFT JOIN INFORMATION_SCHEMA.REFERENTIAL_CONSTRAINTS rc
                   ON kcu.CONSTRAINT_NAME = rc.CONSTRAINT_NAME
                  AND kcu.TABLE_SCHEMA = rc.CONSTRAINT_SCHEMA
            WHERE kcu.TABLE_SCHEMA = ?
              AND kcu.TABLE_NAME = ?
              AND kcu.REFERENCED_TABLE_NAME IS NOT NULL
            ORDER BY kcu.CONSTRAINT_NAME, kcu.ORDINAL_POSITION""";

    static final String FOREIGN_KEYS_WITHOUT_RULES_SQL = """
            SELECT CONSTRAINT_NAME, COLUMN_NAME, REFERENCED_TABLE_NAME, REFERENCED_COLUMN_NAME,
                   'RESTRICT' AS UPDATE_RULE, 'RESTRICT' AS DELETE_RULE
            FROM INFORMATION_SCHEMA.KEY_COLUMN_USAGE
            WHERE TABLE_SCHEMA = ?
              AND TABLE_NAME = ?
              AND REFERENCED_TABLE_NAME IS NOT NULL
            ORDER BY CONSTRAINT_NAME, ORDINAL_POSITION""";

    private final Connection connection;

    public JdbcMetadataSource(Connection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<String> currentDatabase() throws SQLException {
        List<MetadataRow> rows = query(CURRENT_DATABASE_SQL);
        if (rows.isEmpty()) return Optional.empty();
        return Optional.ofNullable(rows.get(0).getString("current_db"));
    }

    @Override
    public List<MetadataRow> listBaseTables(String database) throws SQLException {
        return query(TABLES_SQL, database);
    }

    @Override
    public String showCreateTable(String table) throws SQLException {
        List<MetadataRow> rows = execute("SHOW CREATE TABLE " + quote(table));
        if (rows.isEmpty()) {
            throw new SQLException("SHOW CREATE TABLE returned no rows for " + table);
        }
        String ddl = rows.get(0).getString("Create Table");
        if (ddl == null) {
            throw new SQLException("SHOW CREATE TABLE returned no statement for " + table);
        }
        return ddl;
    }

    @Override
    public List<MetadataRow> listColumns(String database, String table) throws SQLException {
        return query(COLUMNS_SQL, database, table);
    }

    @Override
    public List<MetadataRow> listIndexes(String table) throws SQLException {
        return execute("SHOW INDEX FROM " + quote(table));
    }

    @Override
    public List<MetadataRow> listForeignKeys(String database, String table) throws SQLException {
        return query(FOREIGN_KEYS_SQL, database, table);
    }

    @Override
    public List<MetadataRow> listForeignKeysWithoutRules(String database, String table) throws SQLException {
        return query(FOREIGN_KEYS_WITHOUT_RULES_SQL, database, table);
    }

    private List<MetadataRow> query(String sql, Object... params) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return readAll(rs);
            }
        }
    }

    private List<MetadataRow> execute(String sql) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return readAll(rs);
        }
    }

    static List<MetadataRow> readAll(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<MetadataRow> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                values.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(new MetadataRow(values));
        }
        return rows;
    }

    private static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
