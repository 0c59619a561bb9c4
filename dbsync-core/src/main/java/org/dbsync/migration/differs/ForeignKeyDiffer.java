package org.dbsync.migration.differs;

import org.dbsync.model.ForeignKeyDef;
import org.dbsync.model.ForeignKeyDiff;
import org.dbsync.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Foreign key diff keyed by constraint name. All column rows of a constraint are compared
 * together; any difference replaces the whole constraint.
 */
public class ForeignKeyDiffer implements TableComponentDiffer<ForeignKeyDiff> {

    @Override
    public ForeignKeyDiff diff(TableModel source, TableModel target) {
        Map<String, List<ForeignKeyDef>> sourceByName = byConstraint(source.getForeignKeys());
        Map<String, List<ForeignKeyDef>> targetByName = byConstraint(target.getForeignKeys());

        List<ForeignKeyDef> added = new ArrayList<>();
        List<ForeignKeyDef> removed = new ArrayList<>();

        sourceByName.forEach((name, rows) -> {
            List<ForeignKeyDef> old = targetByName.get(name);
            if (old == null) {
                added.addAll(rows);
            } else if (!old.equals(rows)) {
                removed.addAll(old);
                added.addAll(rows);
            }
        });
        targetByName.forEach((name, rows) -> {
            if (!sourceByName.containsKey(name)) removed.addAll(rows);
        });

        return ForeignKeyDiff.builder()
                .table(source.getName())
                .added(added)
                .removed(removed)
                .build();
    }

    private static Map<String, List<ForeignKeyDef>> byConstraint(List<ForeignKeyDef> fks) {
        Map<String, List<ForeignKeyDef>> map = new TreeMap<>();
        fks.forEach(fk -> map.computeIfAbsent(fk.getConstraintName(), k -> new ArrayList<>()).add(fk));
        return map;
    }
}
