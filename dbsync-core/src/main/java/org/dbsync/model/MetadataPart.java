package org.dbsync.model;

/**
 * Per-table metadata fetched by a separate catalog query. A part that could not be
 * read is recorded on the {@link TableModel} so the differ can force a manual review.
 */
public enum MetadataPart {
    CREATE_STATEMENT, COLUMNS, INDEXES, FOREIGN_KEYS
}
