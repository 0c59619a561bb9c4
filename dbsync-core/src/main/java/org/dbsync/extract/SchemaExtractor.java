package org.dbsync.extract;

import org.dbsync.model.ColumnDef;
import org.dbsync.model.ForeignKeyDef;
import org.dbsync.model.IndexDef;
import org.dbsync.model.KeyRole;
import org.dbsync.model.MetadataPart;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.TableModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link SchemaModel} for one database from raw catalog rows.
 *
 * <p>Failure policy:
 * <ul>
 *   <li>no database context, or the table list cannot be read: {@link ExtractionException}</li>
 *   <li>one table's create statement, columns or indexes cannot be read, or a catalog row lacks a
 *       name or type: the table is kept,
 *       the part is recorded as missing and a {@link PartialMetadataWarning} is returned</li>
 *   <li>foreign key rules unavailable: falls back to RESTRICT rules with a warning;
 *       only when the fallback fails too is the part recorded as missing</li>
 * </ul>
 */
public class SchemaExtractor {

    private static final Logger log = LoggerFactory.getLogger(SchemaExtractor.class);

    public ExtractionResult extract(MetadataSource source) throws ExtractionException {
        return extract(source, null);
    }

    /**
     * @param source           catalog access for the database
     * @param explicitDatabase database to analyze; when {@code null} the session's current database is used
     */
    public ExtractionResult extract(MetadataSource source, String explicitDatabase) throws ExtractionException {
        Objects.requireNonNull(source, "source must not be null");
        String database = resolveDatabase(source, explicitDatabase);
        log.info("Analyzing database: {}", database);

        List<MetadataRow> tableRows;
        try {
            tableRows = source.listBaseTables(database);
        } catch (SQLException e) {
            throw new ExtractionException("Failed to list tables of database '" + database + "'", e);
        }
        log.info("Found {} tables in {}", tableRows.size(), database);

        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder().database(database);
        SchemaModel.SchemaModelBuilder schema = SchemaModel.builder().database(database);

        for (MetadataRow row : tableRows) {
            String tableName = row.getString("TABLE_NAME");
            if (tableName == null) {
                log.warn("Skipping catalog row without TABLE_NAME: {}", row);
                continue;
            }
            List<PartialMetadataWarning> warnings = new ArrayList<>();
            TableModel table = extractTable(source, database, tableName, row, warnings);
            warnings.forEach(w -> log.warn("{}", w));
            result.warnings(warnings);
            schema.table(tableName, table);
        }

        return result.schema(schema.build()).build();
    }

    private String resolveDatabase(MetadataSource source, String explicitDatabase) throws ExtractionException {
        if (explicitDatabase != null && !explicitDatabase.isBlank()) {
            return explicitDatabase;
        }
        try {
            return source.currentDatabase()
                    .filter(db -> !db.isBlank())
                    .orElseThrow(() -> new ExtractionException("No database selected and none was supplied"));
        } catch (SQLException e) {
            throw new ExtractionException("Unable to determine the current database", e);
        }
    }

    private TableModel extractTable(MetadataSource source, String database, String tableName,
                                    MetadataRow tableRow, List<PartialMetadataWarning> warnings) {
        TableModel.TableModelBuilder table = TableModel.builder()
                .name(tableName)
                .engine(tableRow.getString("ENGINE"))
                .collation(tableRow.getString("TABLE_COLLATION"))
                .approximateRows(Math.max(0L, tableRow.getLong("TABLE_ROWS", 0L)));

        try {
            table.createStatement(source.showCreateTable(tableName));
        } catch (SQLException e) {
            table.missingPart(MetadataPart.CREATE_STATEMENT);
            warnings.add(new PartialMetadataWarning(tableName, MetadataPart.CREATE_STATEMENT, e.getMessage()));
        }

        try {
            table.columns(toColumns(source.listColumns(database, tableName)));
        } catch (SQLException e) {
            table.missingPart(MetadataPart.COLUMNS);
            warnings.add(new PartialMetadataWarning(tableName, MetadataPart.COLUMNS, e.getMessage()));
        }

        try {
            table.indexes(toIndexes(source.listIndexes(tableName)));
        } catch (SQLException e) {
            table.missingPart(MetadataPart.INDEXES);
            warnings.add(new PartialMetadataWarning(tableName, MetadataPart.INDEXES, e.getMessage()));
        }

        try {
            table.foreignKeys(toForeignKeys(source.listForeignKeys(database, tableName)));
        } catch (SQLException detailed) {
            warnings.add(new PartialMetadataWarning(tableName, MetadataPart.FOREIGN_KEYS,
                    "referential rules unavailable, assuming " + ForeignKeyDef.DEFAULT_RULE + ": " + detailed.getMessage()));
            try {
                table.foreignKeys(toForeignKeys(source.listForeignKeysWithoutRules(database, tableName)));
            } catch (SQLException fallback) {
                table.missingPart(MetadataPart.FOREIGN_KEYS);
                warnings.add(new PartialMetadataWarning(tableName, MetadataPart.FOREIGN_KEYS, fallback.getMessage()));
            }
        }

        return table.build();
    }

    List<ColumnDef> toColumns(List<MetadataRow> rows) throws SQLDataException {
        List<ColumnDef> columns = new ArrayList<>();
        for (MetadataRow r : rows) {
            columns.add(ColumnDef.builder()
                    .name(required(r, "COLUMN_NAME"))
                    .type(required(r, "COLUMN_TYPE"))
                    .nullable("YES".equalsIgnoreCase(r.getString("IS_NULLABLE")))
                    .defaultValue(r.getString("COLUMN_DEFAULT"))
                    .extra(r.getString("EXTRA", ""))
                    .ordinalPosition((int) r.getLong("ORDINAL_POSITION", columns.size() + 1))
                    .keyRole(KeyRole.fromCatalogCode(r.getString("COLUMN_KEY")))
                    .build());
        }
        columns.sort(Comparator.comparingInt(ColumnDef::getOrdinalPosition));
        return columns;
    }

    List<IndexDef> toIndexes(List<MetadataRow> rows) throws SQLDataException {
        // Key_name -> (Seq_in_index, Column_name), grouped in first-seen order
        Map<String, List<MetadataRow>> grouped = new LinkedHashMap<>();
        for (MetadataRow r : rows) {
            grouped.computeIfAbsent(required(r, "Key_name"), k -> new ArrayList<>()).add(r);
        }

        List<IndexDef> indexes = new ArrayList<>();
        grouped.forEach((name, members) -> {
            List<MetadataRow> ordered = new ArrayList<>(members);
            if (ordered.stream().allMatch(m -> m.has("Seq_in_index"))) {
                ordered.sort(Comparator.comparingLong(m -> m.getLong("Seq_in_index", 0L)));
            }
            IndexDef.IndexDefBuilder idx = IndexDef.builder().name(name);
            ordered.forEach(m -> idx.column(m.getString("Column_name")));
            indexes.add(idx.build());
        });
        return indexes;
    }

    private static String required(MetadataRow row, String label) throws SQLDataException {
        String value = row.getString(label);
        if (value == null) {
            throw new SQLDataException("catalog row without " + label + ": " + row);
        }
        return value;
    }

    List<ForeignKeyDef> toForeignKeys(List<MetadataRow> rows) {
        return rows.stream()
                .map(r -> ForeignKeyDef.builder()
                        .constraintName(r.getString("CONSTRAINT_NAME"))
                        .column(r.getString("COLUMN_NAME"))
                        .referencedTable(r.getString("REFERENCED_TABLE_NAME"))
                        .referencedColumn(r.getString("REFERENCED_COLUMN_NAME"))
                        .updateRule(r.getString("UPDATE_RULE", ForeignKeyDef.DEFAULT_RULE))
                        .deleteRule(r.getString("DELETE_RULE", ForeignKeyDef.DEFAULT_RULE))
                        .build())
                .toList();
    }
}
