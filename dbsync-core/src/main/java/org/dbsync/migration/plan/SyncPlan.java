package org.dbsync.migration.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered logical operations for one run. Built once, rendered once.
 */
@Value
@Builder
public class SyncPlan {
    @Singular List<DropTableOperation> dropTables;
    /** Creates and alters, in selection order. */
    @Singular List<StructureOperation> structureOperations;
    @Singular List<DataSyncMarker> dataSyncMarkers;
    @Singular List<InvalidSelectionWarning> warnings;

    /**
     * Drops followed by creates and alters.
     */
    public List<StructureOperation> orderedOperations() {
        List<StructureOperation> all = new ArrayList<>(dropTables);
        all.addAll(structureOperations);
        return List.copyOf(all);
    }

    public boolean hasStructureChanges() {
        return !dropTables.isEmpty() || !structureOperations.isEmpty();
    }

    public boolean isEmpty() {
        return !hasStructureChanges() && dataSyncMarkers.isEmpty();
    }
}
