package org.dbsync.migration.differs;

import org.dbsync.model.ColumnDef;
import org.dbsync.model.ColumnDiff;
import org.dbsync.model.FieldDelta;
import org.dbsync.model.TableModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Column-level diff of a table present on both sides. Deltas always read target -> source.
 */
public class ColumnDiffer implements TableComponentDiffer<ColumnDiff> {

    @Override
    public ColumnDiff diff(TableModel source, TableModel target) {
        Map<String, ColumnDef> sourceCols = byName(source.getColumns());
        Map<String, ColumnDef> targetCols = byName(target.getColumns());

        List<String> added = new TreeSet<>(sourceCols.keySet()).stream()
                .filter(n -> !targetCols.containsKey(n))
                .toList();
        List<String> removed = new TreeSet<>(targetCols.keySet()).stream()
                .filter(n -> !sourceCols.containsKey(n))
                .toList();

        List<ColumnDiff.ChangedColumn> changed = new ArrayList<>();
        for (String name : new TreeSet<>(sourceCols.keySet())) {
            ColumnDef targetCol = targetCols.get(name);
            if (targetCol == null) continue;
            List<FieldDelta> deltas = fieldDeltas(sourceCols.get(name), targetCol);
            if (!deltas.isEmpty()) {
                changed.add(new ColumnDiff.ChangedColumn(name, deltas));
            }
        }

        return ColumnDiff.builder()
                .table(source.getName())
                .added(added)
                .removed(removed)
                .changed(changed)
                .build();
    }

    /**
     * Field-by-field comparison following {@link ColumnDef#sameDefinition(ColumnDef)}.
     */
    List<FieldDelta> fieldDeltas(ColumnDef source, ColumnDef target) {
        List<FieldDelta> deltas = new ArrayList<>();
        if (!source.getType().equals(target.getType())) {
            deltas.add(new FieldDelta(FieldDelta.Field.TYPE, target.getType(), source.getType()));
        }
        if (source.isNullable() != target.isNullable()) {
            deltas.add(new FieldDelta(FieldDelta.Field.NULLABLE,
                    target.nullabilityKeyword(), source.nullabilityKeyword()));
        }
        if (!source.normalizedDefault().equals(target.normalizedDefault())) {
            deltas.add(new FieldDelta(FieldDelta.Field.DEFAULT,
                    displayDefault(target), displayDefault(source)));
        }
        if (!source.normalizedExtra().equals(target.normalizedExtra())) {
            deltas.add(new FieldDelta(FieldDelta.Field.EXTRA,
                    displayExtra(target), displayExtra(source)));
        }
        return deltas;
    }

    /**
     * Changes that can fail or lose data when applied to a populated target.
     */
    public List<String> unsafeChanges(ColumnDiff diff) {
        List<String> warnings = new ArrayList<>();
        String table = diff.getTable();
        for (ColumnDiff.ChangedColumn c : diff.getChanged()) {
            for (FieldDelta d : c.deltas()) {
                if (d.field() == FieldDelta.Field.NULLABLE && "NOT NULL".equals(d.newValue())) {
                    warnings.add("[NOT-NULL] " + table + "." + c.name()
                            + " becomes NOT NULL; fails if the target holds NULL values");
                } else if (d.field() == FieldDelta.Field.TYPE) {
                    warnings.add("[TYPE-CHANGE] " + table + "." + c.name() + " " + d.oldValue() + " -> "
                            + d.newValue() + "; existing values may be converted or truncated");
                }
            }
        }
        for (String name : diff.getRemoved()) {
            warnings.add("[DROP-COLUMN] " + table + "." + name + " is dropped; its data is lost");
        }
        return warnings;
    }

    private static Map<String, ColumnDef> byName(List<ColumnDef> columns) {
        Map<String, ColumnDef> map = new LinkedHashMap<>();
        for (ColumnDef c : columns) {
            map.put(c.getName(), c);
        }
        return map;
    }

    private static String displayDefault(ColumnDef c) {
        return c.hasDefault() ? c.normalizedDefault() : "(none)";
    }

    private static String displayExtra(ColumnDef c) {
        String extra = c.normalizedExtra();
        return extra.isEmpty() ? "(none)" : extra;
    }
}
