package org.dbsync.cli.service;

import org.dbsync.migration.differs.SchemaDiffer;
import org.dbsync.model.Classification;
import org.dbsync.model.ColumnDef;
import org.dbsync.model.ColumnDiff;
import org.dbsync.model.ForeignKeyDiff;
import org.dbsync.model.IndexDef;
import org.dbsync.model.IndexDiff;
import org.dbsync.model.MetadataPart;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.Selection;
import org.dbsync.model.SyncAction;
import org.dbsync.model.TableModel;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Console rendering of classifications, table details and selections.
 */
public class DiffReportPrinter {
    private static final String RULE = "=".repeat(80);
    private static final int LIST_LIMIT = 10;

    private final PrintStream out;
    private final SchemaDiffer differ;

    public DiffReportPrinter(PrintStream out, SchemaDiffer differ) {
        this.out = out;
        this.differ = differ;
    }

    public void printSummary(Classification c, SchemaModel source, SchemaModel target) {
        out.println();
        out.println(RULE);
        out.println("DATABASE DIFFERENCES ANALYSIS");
        out.println(RULE);

        if (!c.getNewTables().isEmpty()) {
            out.printf("%nNEW TABLES (%d tables):%n", c.getNewTables().size());
            out.println("   (Exist only in source database)");
            c.getNewTables().forEach(t -> out.printf("   • %s (%s records)%n", t, rows(source, t)));
        }
        if (!c.getRemovedTables().isEmpty()) {
            out.printf("%nTABLES TO REMOVE (%d tables):%n", c.getRemovedTables().size());
            out.println("   (Exist only in target database)");
            c.getRemovedTables().forEach(t -> out.printf("   • %s (%s records)%n", t, rows(target, t)));
        }
        if (!c.getModifiedTables().isEmpty()) {
            out.printf("%nMODIFIED TABLES (%d tables):%n", c.getModifiedTables().size());
            out.println("   (Structural differences detected)");
            for (String t : c.getModifiedTables()) {
                out.printf("   • %s (source: %s -> target: %s records)%n", t, rows(source, t), rows(target, t));
                printColumnOverview(t, source, target);
            }
        }
        if (!c.getIdenticalTables().isEmpty()) {
            out.printf("%nIDENTICAL TABLES (%d tables):%n", c.getIdenticalTables().size());
            int i = 0;
            for (String t : c.getIdenticalTables()) {
                if (i++ == LIST_LIMIT) {
                    out.printf("   • ... and %d more tables%n", c.getIdenticalTables().size() - LIST_LIMIT);
                    break;
                }
                out.println("   • " + t);
            }
        }
        if (!c.getWarnings().isEmpty()) {
            out.printf("%nWARNINGS (%d):%n", c.getWarnings().size());
            c.getWarnings().forEach(w -> out.println("   " + w));
        }
    }

    /**
     * Full detail of a new table, or of the differences of a table on both sides.
     */
    public void printTableDetails(String table, SchemaModel source, SchemaModel target, boolean isNew) {
        out.println();
        out.println("=".repeat(60));
        out.println("TABLE DETAILS: " + table);
        out.println("=".repeat(60));

        TableModel src = source.findTable(table).orElse(null);
        if (isNew) {
            if (src == null) return;
            out.println("NEW TABLE (does not exist in target)");
            out.println("   Engine: " + (src.getEngine() == null ? "N/A" : src.getEngine()));
            out.println("   Records: " + formatRows(src.getApproximateRows()));
            out.printf("%nSTRUCTURE (%d columns):%n", src.getColumns().size());
            src.getColumns().stream().limit(LIST_LIMIT).forEach(col -> out.println("   • " + describe(col)));
            if (src.getColumns().size() > LIST_LIMIT) {
                out.printf("   ... and %d more columns%n", src.getColumns().size() - LIST_LIMIT);
            }
            return;
        }

        out.printf("RECORDS: Source %s -> Target %s%n", rows(source, table), rows(target, table));
        TableModel tgt = target.findTable(table).orElse(null);
        if (src == null || tgt == null) return;
        if (src.isMissing(MetadataPart.COLUMNS) || tgt.isMissing(MetadataPart.COLUMNS)) {
            out.println("\nColumn metadata is incomplete; differences cannot be listed.");
            return;
        }

        ColumnDiff columns = differ.columnDiff(table, source, target);
        if (!columns.getAdded().isEmpty()) {
            out.printf("%nNEW COLUMNS (%d):%n", columns.getAdded().size());
            columns.getAdded().forEach(n -> src.findColumn(n).ifPresent(col -> out.println("   • " + describe(col))));
        }
        if (!columns.getRemoved().isEmpty()) {
            out.printf("%nREMOVED COLUMNS (%d):%n", columns.getRemoved().size());
            columns.getRemoved().forEach(n -> tgt.findColumn(n)
                    .ifPresent(col -> out.println("   • " + col.getName() + ": " + col.getType())));
        }
        if (!columns.getChanged().isEmpty()) {
            out.printf("%nMODIFIED COLUMNS (%d):%n", columns.getChanged().size());
            for (ColumnDiff.ChangedColumn changed : columns.getChanged()) {
                out.println("   • " + changed.name() + ":");
                changed.deltas().forEach(d -> out.println("     - " + d.describe()));
            }
        }

        IndexDiff indexes = differ.indexDiff(table, source, target);
        if (!indexes.getAdded().isEmpty()) {
            out.printf("%nNEW INDEXES (%d):%n", indexes.getAdded().size());
            indexes.getAdded().forEach(i -> out.println("   • " + describe(i)));
        }
        if (!indexes.getRemoved().isEmpty()) {
            out.printf("%nREMOVED INDEXES (%d):%n", indexes.getRemoved().size());
            indexes.getRemoved().forEach(i -> out.println("   • " + describe(i)));
        }

        ForeignKeyDiff fks = differ.foreignKeyDiff(table, source, target);
        if (!fks.getAdded().isEmpty()) {
            out.printf("%nNEW FOREIGN KEYS (%d):%n", fks.getAdded().size());
            fks.getAdded().forEach(fk -> out.println("   • " + fk.describe()));
        }
        if (!fks.getRemoved().isEmpty()) {
            out.printf("%nREMOVED FOREIGN KEYS (%d):%n", fks.getRemoved().size());
            fks.getRemoved().forEach(fk -> out.println("   • " + fk.describe()));
        }

        if (columns.isEmpty() && indexes.isEmpty() && fks.isEmpty()) {
            out.println("\nIdentical structures (difference only in data)");
        }
    }

    /**
     * Removed-table notice: row estimate and, for small tables, the column list.
     */
    public void printRemovedTable(String table, SchemaModel target) {
        out.printf("%nTable: %s (%s records)%n", table, rows(target, table));
        target.findTable(table).ifPresent(t -> {
            out.printf("   • %d columns%n", t.getColumns().size());
            if (t.getColumns().size() <= 5) {
                t.getColumns().forEach(col -> out.println("   • " + col.getName() + ": " + col.getType()));
            }
        });
    }

    public void printSelectionSummary(Selection selection) {
        out.println();
        out.println(RULE);
        out.println("SELECTION SUMMARY");
        out.println(RULE);
        section("STRUCTURE ONLY", selection.tablesWith(SyncAction.STRUCTURE_ONLY));
        section("STRUCTURE + DATA", selection.tablesWith(SyncAction.STRUCTURE_AND_DATA));
        section("TABLES TO REMOVE", selection.tablesWith(SyncAction.DROP));
        section("SKIPPED TABLES", selection.tablesWith(SyncAction.SKIP));
    }

    private void section(String title, List<String> tables) {
        if (tables.isEmpty()) return;
        out.printf("%n%s (%d tables):%n", title, tables.size());
        tables.forEach(t -> out.println("   • " + t));
    }

    private void printColumnOverview(String table, SchemaModel source, SchemaModel target) {
        TableModel src = source.findTable(table).orElse(null);
        TableModel tgt = target.findTable(table).orElse(null);
        if (src == null || tgt == null
                || src.isMissing(MetadataPart.COLUMNS) || tgt.isMissing(MetadataPart.COLUMNS)) {
            return;
        }
        ColumnDiff diff = differ.columnDiff(table, source, target);
        if (!diff.getAdded().isEmpty()) {
            out.println("     -> New columns: " + String.join(", ", diff.getAdded()));
        }
        if (!diff.getRemoved().isEmpty()) {
            out.println("     -> Removed columns: " + String.join(", ", diff.getRemoved()));
        }
        if (!diff.getChanged().isEmpty()) {
            List<String> names = new ArrayList<>();
            diff.getChanged().forEach(c -> names.add(c.name()));
            out.println("     -> Modified columns: " + String.join(", ", names));
        }
    }

    static String describe(ColumnDef col) {
        StringBuilder sb = new StringBuilder(col.getName()).append(": ").append(col.getType())
                .append(' ').append(col.nullabilityKeyword());
        if (col.hasDefault()) sb.append(" DEFAULT ").append(col.normalizedDefault());
        if (!col.normalizedExtra().isEmpty()) sb.append(' ').append(col.normalizedExtra());
        return sb.toString();
    }

    static String describe(IndexDef idx) {
        return idx.getName() + ": (" + idx.columnList() + ")";
    }

    static String rows(SchemaModel schema, String table) {
        return schema.findTable(table).map(t -> formatRows(t.getApproximateRows())).orElse("?");
    }

    static String formatRows(long rows) {
        return String.format(Locale.US, "%,d", rows);
    }
}
