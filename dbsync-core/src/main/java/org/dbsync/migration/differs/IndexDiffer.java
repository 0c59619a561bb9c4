package org.dbsync.migration.differs;

import org.dbsync.model.IndexDef;
import org.dbsync.model.IndexDiff;
import org.dbsync.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Index diff matched by name only. A name present on both sides with a different
 * member list is reported as removed (target definition) plus added (source definition).
 */
public class IndexDiffer implements TableComponentDiffer<IndexDiff> {

    @Override
    public IndexDiff diff(TableModel source, TableModel target) {
        Map<String, IndexDef> sourceByName = byName(source.getIndexes());
        Map<String, IndexDef> targetByName = byName(target.getIndexes());

        List<IndexDef> added = new ArrayList<>();
        List<IndexDef> removed = new ArrayList<>();

        sourceByName.forEach((name, idx) -> {
            IndexDef old = targetByName.get(name);
            if (old == null) {
                added.add(idx);
            } else if (!old.getColumns().equals(idx.getColumns())) {
                removed.add(old);
                added.add(idx);
            }
        });
        targetByName.forEach((name, idx) -> {
            if (!sourceByName.containsKey(name)) removed.add(idx);
        });
        removed.sort((a, b) -> a.getName().compareTo(b.getName()));

        return IndexDiff.builder()
                .table(source.getName())
                .added(added)
                .removed(removed)
                .build();
    }

    private static Map<String, IndexDef> byName(List<IndexDef> indexes) {
        Map<String, IndexDef> map = new TreeMap<>();
        indexes.forEach(i -> map.put(i.getName(), i));
        return map;
    }
}
