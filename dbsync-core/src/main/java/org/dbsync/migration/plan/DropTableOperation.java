package org.dbsync.migration.plan;

public record DropTableOperation(String table) implements StructureOperation {
}
