package org.dbsync.migration.plan;

import org.dbsync.model.SyncAction;

/**
 * A selected action that could not be honored and was ignored.
 */
public record InvalidSelectionWarning(String table, SyncAction action, String reason) {
    @Override
    public String toString() {
        return "[INVALID-SELECTION] " + action + " for '" + table + "' ignored: " + reason;
    }
}
