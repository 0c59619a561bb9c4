package org.dbsync.cli.service;

import org.dbsync.model.Classification;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.Selection;
import org.dbsync.model.SyncAction;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks the operator what to do with every new, modified and removed table.
 * Returns empty when the operator quits or input ends.
 */
public class SelectionPrompt {
    private final BufferedReader in;
    private final PrintStream out;
    private final DiffReportPrinter printer;

    public SelectionPrompt(BufferedReader in, PrintStream out, DiffReportPrinter printer) {
        this.in = in;
        this.out = out;
        this.printer = printer;
    }

    public Optional<Selection> prompt(Classification c, SchemaModel source, SchemaModel target) throws IOException {
        Selection.Builder selection = Selection.builder();

        out.println();
        out.println("=".repeat(80));
        out.println("INTERACTIVE SYNCHRONIZATION SELECTION");
        out.println("=".repeat(80));
        out.println("Options:");
        out.println("  1 - Structure only");
        out.println("  2 - Structure + data");
        out.println("  s - Skip this table");
        out.println("  d - View table details again");
        out.println("  q - Quit");

        if (!c.getNewTables().isEmpty()) {
            out.printf("%nNEW TABLES (%d tables)%n", c.getNewTables().size());
            for (String table : c.getNewTables()) {
                printer.printTableDetails(table, source, target, true);
                if (!chooseStructureAction(table, source, target, true, selection)) return Optional.empty();
            }
        }

        if (!c.getModifiedTables().isEmpty()) {
            out.printf("%nMODIFIED TABLES (%d tables)%n", c.getModifiedTables().size());
            for (String table : c.getModifiedTables()) {
                printer.printTableDetails(table, source, target, false);
                if (!chooseStructureAction(table, source, target, false, selection)) return Optional.empty();
            }
        }

        if (!c.getRemovedTables().isEmpty()) {
            out.printf("%nTABLES FOR REMOVAL (%d tables)%n", c.getRemovedTables().size());
            out.println("These tables exist only in target:");
            for (String table : c.getRemovedTables()) {
                printer.printRemovedTable(table, target);
                if (!chooseDrop(table, selection)) return Optional.empty();
            }
        }

        return Optional.of(selection.build());
    }

    /**
     * @return false when the operator quits
     */
    private boolean chooseStructureAction(String table, SchemaModel source, SchemaModel target,
                                          boolean isNew, Selection.Builder selection) throws IOException {
        while (true) {
            out.printf("%nWhat to do with table '%s'?%n", table);
            String choice = read("   Choose (1/2/s/d/q): ");
            if (choice == null) return false;
            switch (choice) {
                case "1" -> {
                    selection.select(table, SyncAction.STRUCTURE_ONLY);
                    out.printf("    %s: Structure only%n", table);
                    return true;
                }
                case "2" -> {
                    selection.select(table, SyncAction.STRUCTURE_AND_DATA);
                    out.printf("    %s: Structure + data (%s records)%n", table, DiffReportPrinter.rows(source, table));
                    return true;
                }
                case "s" -> {
                    selection.select(table, SyncAction.SKIP);
                    out.printf("    %s: Skipped%n", table);
                    return true;
                }
                case "d" -> printer.printTableDetails(table, source, target, isNew);
                case "q" -> {
                    out.println("Operation cancelled by user.");
                    return false;
                }
                default -> out.println("    Invalid choice. Use 1, 2, s, d, or q");
            }
        }
    }

    private boolean chooseDrop(String table, Selection.Builder selection) throws IOException {
        while (true) {
            String choice = read(String.format("%n   Remove table '%s'? (y/n/q): ", table));
            if (choice == null) return false;
            switch (choice) {
                case "y", "yes" -> {
                    selection.select(table, SyncAction.DROP);
                    out.printf("    %s: Will be removed%n", table);
                    return true;
                }
                case "n", "no" -> {
                    selection.select(table, SyncAction.SKIP);
                    out.printf("    %s: Kept%n", table);
                    return true;
                }
                case "q" -> {
                    out.println("Operation cancelled by user.");
                    return false;
                }
                default -> out.println("    Invalid choice. Use y/n/q");
            }
        }
    }

    /**
     * @return the trimmed lower-case answer, or {@code null} at end of input
     */
    private String read(String question) throws IOException {
        out.print(question);
        out.flush();
        String line = in.readLine();
        if (line == null) {
            out.println();
            out.println("Input closed, cancelling.");
            return null;
        }
        return line.trim().toLowerCase(Locale.ROOT);
    }
}
