package org.dbsync.model;

/**
 * Bucket a table name falls into when two schemas are compared.
 */
public enum TableStatus {
    /** Present only in the source. */
    NEW,
    /** Present only in the target. */
    REMOVED,
    /** Present in both with a detected column difference or incomplete metadata. */
    MODIFIED,
    /** Present in both with no detected difference. */
    IDENTICAL
}
