package org.dbsync.migration.plan;

/**
 * One logical schema change against a single target table.
 */
public sealed interface StructureOperation permits DropTableOperation, CreateTableOperation, AlterTableOperation {
    String table();
}
