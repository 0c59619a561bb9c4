package org.dbsync.migration.plan;

/**
 * Creates a table from the source's captured statement, verbatim.
 */
public record CreateTableOperation(String table, String createStatement) implements StructureOperation {
}
