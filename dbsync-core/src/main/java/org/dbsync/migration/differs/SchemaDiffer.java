package org.dbsync.migration.differs;

import org.dbsync.model.Classification;
import org.dbsync.model.ColumnDef;
import org.dbsync.model.ColumnDiff;
import org.dbsync.model.ForeignKeyDiff;
import org.dbsync.model.IndexDiff;
import org.dbsync.model.MetadataPart;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.TableModel;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Compares a source schema (desired state) with a target schema (state to be changed).
 *
 * <p>A table present on both sides is modified when its column name sets differ, when
 * any shared column differs in type, nullability, normalized default or extra, or when
 * either side's metadata is incomplete. Index and foreign key differences alone do not
 * make a table modified.
 */
public class SchemaDiffer {
    private final ColumnDiffer columnDiffer;
    private final IndexDiffer indexDiffer;
    private final ForeignKeyDiffer foreignKeyDiffer;

    public SchemaDiffer() {
        this(new ColumnDiffer(), new IndexDiffer(), new ForeignKeyDiffer());
    }

    public SchemaDiffer(ColumnDiffer columnDiffer, IndexDiffer indexDiffer, ForeignKeyDiffer foreignKeyDiffer) {
        this.columnDiffer = Objects.requireNonNull(columnDiffer, "columnDiffer must not be null");
        this.indexDiffer = Objects.requireNonNull(indexDiffer, "indexDiffer must not be null");
        this.foreignKeyDiffer = Objects.requireNonNull(foreignKeyDiffer, "foreignKeyDiffer must not be null");
    }

    public Classification classify(SchemaModel source, SchemaModel target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        Classification.ClassificationBuilder result = Classification.builder();
        Set<String> sourceNames = new TreeSet<>(source.getTables().keySet());
        Set<String> targetNames = new TreeSet<>(target.getTables().keySet());

        for (String name : sourceNames) {
            if (!targetNames.contains(name)) {
                result.newTable(name);
                continue;
            }
            TableModel s = source.getTables().get(name);
            TableModel t = target.getTables().get(name);

            // 메타데이터가 불완전하면 수동 검토 대상으로 본다
            if (s.isPartial() || t.isPartial()) {
                result.modifiedTable(name);
                result.warning(partialNotice(name, s, t));
                if (canCompareColumns(s, t)) {
                    result.warnings(columnDiffer.unsafeChanges(columnDiffer.diff(s, t)));
                }
                continue;
            }

            if (columnsDiffer(s, t)) {
                result.modifiedTable(name);
                result.warnings(columnDiffer.unsafeChanges(columnDiffer.diff(s, t)));
            } else {
                result.identicalTable(name);
            }
        }

        for (String name : targetNames) {
            if (!sourceNames.contains(name)) {
                result.removedTable(name);
            }
        }
        return result.build();
    }

    /**
     * Column diff of a table present in both schemas.
     *
     * @throws IllegalArgumentException if either schema lacks the table
     */
    public ColumnDiff columnDiff(String table, SchemaModel source, SchemaModel target) {
        return columnDiffer.diff(require(source, table, "source"), require(target, table, "target"));
    }

    public IndexDiff indexDiff(String table, SchemaModel source, SchemaModel target) {
        return indexDiffer.diff(require(source, table, "source"), require(target, table, "target"));
    }

    public ForeignKeyDiff foreignKeyDiff(String table, SchemaModel source, SchemaModel target) {
        return foreignKeyDiffer.diff(require(source, table, "source"), require(target, table, "target"));
    }

    private boolean columnsDiffer(TableModel source, TableModel target) {
        Set<String> sourceCols = new HashSet<>(source.getColumnNames());
        Set<String> targetCols = new HashSet<>(target.getColumnNames());
        if (!sourceCols.equals(targetCols)) {
            return true;
        }
        for (ColumnDef col : source.getColumns()) {
            ColumnDef other = target.findColumn(col.getName()).orElse(null);
            if (!col.sameDefinition(other)) {
                return true;
            }
        }
        return false;
    }

    private static boolean canCompareColumns(TableModel source, TableModel target) {
        return !source.isMissing(MetadataPart.COLUMNS) && !target.isMissing(MetadataPart.COLUMNS);
    }

    private static String partialNotice(String table, TableModel source, TableModel target) {
        Set<MetadataPart> missing = new TreeSet<>(source.getMissingParts());
        missing.addAll(target.getMissingParts());
        String parts = missing.stream().map(Enum::name).collect(Collectors.joining(", "));
        return "[PARTIAL-METADATA] " + table + " has incomplete metadata (" + parts
                + "); treated as modified, review before syncing";
    }

    private static TableModel require(SchemaModel schema, String table, String side) {
        Objects.requireNonNull(schema, side + " must not be null");
        return schema.findTable(table)
                .orElseThrow(() -> new IllegalArgumentException("Table '" + table + "' not found in " + side + " schema"));
    }
}
