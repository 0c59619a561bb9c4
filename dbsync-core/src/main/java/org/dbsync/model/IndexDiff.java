package org.dbsync.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Index difference keyed by index name. A same-named index with different members
 * shows up in both lists; there is no in-place "modified" state.
 */
@Value
@Builder
public class IndexDiff {
    String table;
    @Builder.Default List<IndexDef> added = List.of();
    @Builder.Default List<IndexDef> removed = List.of();

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
