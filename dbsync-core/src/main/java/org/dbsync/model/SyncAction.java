package org.dbsync.model;

/**
 * Operator choice for one table.
 */
public enum SyncAction {
    STRUCTURE_ONLY, STRUCTURE_AND_DATA, SKIP, DROP;

    public boolean syncsStructure() {
        return this == STRUCTURE_ONLY || this == STRUCTURE_AND_DATA;
    }

    /**
     * Whether this action may be chosen for a table in the given bucket.
     * {@link #SKIP} is always allowed.
     */
    public boolean allowedFor(TableStatus status) {
        return switch (this) {
            case SKIP -> true;
            case STRUCTURE_ONLY, STRUCTURE_AND_DATA -> status == TableStatus.NEW || status == TableStatus.MODIFIED;
            case DROP -> status == TableStatus.REMOVED;
        };
    }
}
