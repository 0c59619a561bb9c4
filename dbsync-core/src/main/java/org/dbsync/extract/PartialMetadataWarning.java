package org.dbsync.extract;

import org.dbsync.model.MetadataPart;

/**
 * One table's metadata part could not be read. The table is kept with whatever was retrieved.
 */
public record PartialMetadataWarning(String table, MetadataPart part, String message) {

    @Override
    public String toString() {
        return "[PARTIAL-METADATA] table '" + table + "' " + part + ": " + message;
    }
}
