package org.dbsync.extract;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only catalog access for one database. Implementations run the catalog queries
 * and hand rows back untyped; {@link SchemaExtractor} turns them into the schema model.
 *
 * <p>Row labels follow MySQL/MariaDB catalog naming:
 * <ul>
 *   <li>{@link #listBaseTables}: TABLE_NAME, ENGINE, TABLE_COLLATION, TABLE_ROWS</li>
 *   <li>{@link #listColumns}: COLUMN_NAME, COLUMN_TYPE, IS_NULLABLE, COLUMN_DEFAULT, EXTRA,
 *       ORDINAL_POSITION, COLUMN_KEY</li>
 *   <li>{@link #listIndexes}: Key_name, Column_name, Seq_in_index</li>
 *   <li>{@link #listForeignKeys}/{@link #listForeignKeysWithoutRules}: CONSTRAINT_NAME, COLUMN_NAME,
 *       REFERENCED_TABLE_NAME, REFERENCED_COLUMN_NAME, UPDATE_RULE, DELETE_RULE</li>
 * </ul>
 */
public interface MetadataSource {

    /**
     * Database selected on the underlying session, if any.
     */
    Optional<String> currentDatabase() throws SQLException;

    /**
     * Base tables only (no views), ordered by name.
     */
    List<MetadataRow> listBaseTables(String database) throws SQLException;

    String showCreateTable(String table) throws SQLException;

    /**
     * Columns ordered by ordinal position.
     */
    List<MetadataRow> listColumns(String database, String table) throws SQLException;

    List<MetadataRow> listIndexes(String table) throws SQLException;

    /**
     * Foreign key columns joined with their referential rules.
     */
    List<MetadataRow> listForeignKeys(String database, String table) throws SQLException;

    /**
     * Foreign key columns without the rule catalog, for servers where it is unavailable.
     */
    List<MetadataRow> listForeignKeysWithoutRules(String database, String table) throws SQLException;
}
