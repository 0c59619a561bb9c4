package org.dbsync.testing;

import org.dbsync.extract.MetadataRow;
import org.dbsync.extract.MetadataSource;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory catalog. Individual calls can be made to fail with {@link #failOn(String, String)}.
 */
public class FakeMetadataSource implements MetadataSource {

    public static final String CREATE = "create";
    public static final String COLUMNS = "columns";
    public static final String INDEXES = "indexes";
    public static final String FOREIGN_KEYS = "fks";
    public static final String FOREIGN_KEYS_FALLBACK = "fks-fallback";

    private final String currentDatabase;
    private final Map<String, MetadataRow> tables = new LinkedHashMap<>();
    private final Map<String, String> createStatements = new HashMap<>();
    private final Map<String, List<MetadataRow>> columns = new HashMap<>();
    private final Map<String, List<MetadataRow>> indexes = new HashMap<>();
    private final Map<String, List<MetadataRow>> foreignKeys = new HashMap<>();
    private final Set<String> failures = new HashSet<>();
    private boolean failTableListing;
    private final List<String> queriedDatabases = new ArrayList<>();

    public FakeMetadataSource(String currentDatabase) {
        this.currentDatabase = currentDatabase;
    }

    public FakeMetadataSource table(String name, long rows, String createStatement) {
        tables.put(name, MetadataRow.of("TABLE_NAME", name, "ENGINE", "InnoDB",
                "TABLE_COLLATION", "utf8mb4_general_ci", "TABLE_ROWS", rows));
        createStatements.put(name, createStatement);
        return this;
    }

    public FakeMetadataSource column(String table, String name, String type, String nullable,
                                     String defaultValue, String extra, int ordinal, String key) {
        columns.computeIfAbsent(table, k -> new ArrayList<>()).add(MetadataRow.of(
                "COLUMN_NAME", name, "COLUMN_TYPE", type, "IS_NULLABLE", nullable,
                "COLUMN_DEFAULT", defaultValue, "EXTRA", extra, "ORDINAL_POSITION", ordinal, "COLUMN_KEY", key));
        return this;
    }

    public FakeMetadataSource index(String table, String keyName, int seq, String column) {
        indexes.computeIfAbsent(table, k -> new ArrayList<>()).add(MetadataRow.of(
                "Table", table, "Key_name", keyName, "Seq_in_index", seq, "Column_name", column));
        return this;
    }

    public FakeMetadataSource foreignKey(String table, String constraint, String column,
                                         String refTable, String refColumn, String updateRule, String deleteRule) {
        foreignKeys.computeIfAbsent(table, k -> new ArrayList<>()).add(MetadataRow.of(
                "CONSTRAINT_NAME", constraint, "COLUMN_NAME", column,
                "REFERENCED_TABLE_NAME", refTable, "REFERENCED_COLUMN_NAME", refColumn,
                "UPDATE_RULE", updateRule, "DELETE_RULE", deleteRule));
        return this;
    }

    /**
     * @param part one of the constants of this class
     */
    public FakeMetadataSource failOn(String table, String part) {
        failures.add(table + "/" + part);
        return this;
    }

    public FakeMetadataSource failTableListing() {
        this.failTableListing = true;
        return this;
    }

    public List<String> queriedDatabases() {
        return queriedDatabases;
    }

    @Override
    public Optional<String> currentDatabase() {
        return Optional.ofNullable(currentDatabase);
    }

    @Override
    public List<MetadataRow> listBaseTables(String database) throws SQLException {
        queriedDatabases.add(database);
        if (failTableListing) throw new SQLException("catalog unreachable");
        return new ArrayList<>(tables.values());
    }

    @Override
    public String showCreateTable(String table) throws SQLException {
        check(table, CREATE);
        return createStatements.get(table);
    }

    @Override
    public List<MetadataRow> listColumns(String database, String table) throws SQLException {
        check(table, COLUMNS);
        return columns.getOrDefault(table, List.of());
    }

    @Override
    public List<MetadataRow> listIndexes(String table) throws SQLException {
        check(table, INDEXES);
        return indexes.getOrDefault(table, List.of());
    }

    @Override
    public List<MetadataRow> listForeignKeys(String database, String table) throws SQLException {
        check(table, FOREIGN_KEYS);
        return foreignKeys.getOrDefault(table, List.of());
    }

    @Override
    public List<MetadataRow> listForeignKeysWithoutRules(String database, String table) throws SQLException {
        check(table, FOREIGN_KEYS_FALLBACK);
        List<MetadataRow> rows = new ArrayList<>();
        for (MetadataRow r : foreignKeys.getOrDefault(table, List.of())) {
            Map<String, Object> copy = new LinkedHashMap<>(r.asMap());
            copy.put("UPDATE_RULE", "RESTRICT");
            copy.put("DELETE_RULE", "RESTRICT");
            rows.add(new MetadataRow(copy));
        }
        return rows;
    }

    private void check(String table, String part) throws SQLException {
        if (failures.contains(table + "/" + part)) {
            throw new SQLException(part + " unavailable for " + table);
        }
    }
}
