package org.dbsync.cli;

import org.dbsync.cli.service.DiffReportPrinter;
import org.dbsync.cli.service.LoadedSchemas;
import org.dbsync.cli.service.SchemaLoadService;
import org.dbsync.extract.ExtractionException;
import org.dbsync.migration.differs.SchemaDiffer;
import org.dbsync.model.Classification;
import org.dbsync.model.SchemaModel;
import picocli.CommandLine;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Prints the differences between the source and target schemas without generating anything.
 */
@CommandLine.Command(
        name = "compare",
        mixinStandardHelpOptions = true,
        description = "기준/대상 스키마의 차이를 분석하여 출력합니다."
)
public class CompareCommand implements Callable<Integer> {

    @CommandLine.Mixin
    SchemaSourceOptions sources;

    @CommandLine.Option(names = "--details", description = "변경된 테이블의 컬럼/인덱스/FK 상세 차이를 출력합니다.")
    private boolean details;

    private final SchemaLoadService loadService;

    public CompareCommand() {
        this(new SchemaLoadService());
    }

    CompareCommand(SchemaLoadService loadService) {
        this.loadService = loadService;
    }

    @Override
    public Integer call() {
        try {
            LoadedSchemas loaded = loadService.loadBoth(sources.sourceSpec(), sources.targetSpec());
            SchemaModel source = loaded.source().getSchema();
            SchemaModel target = loaded.target().getSchema();

            System.out.printf("Analyzing differences between '%s' and '%s'...%n",
                    loaded.source().getDatabase(), loaded.target().getDatabase());
            loaded.source().getWarnings().forEach(w -> System.err.println("Warning: source " + w));
            loaded.target().getWarnings().forEach(w -> System.err.println("Warning: target " + w));

            SchemaDiffer differ = new SchemaDiffer();
            Classification classification = differ.classify(source, target);
            DiffReportPrinter printer = new DiffReportPrinter(System.out, differ);
            printer.printSummary(classification, source, target);

            if (details) {
                classification.getModifiedTables()
                        .forEach(t -> printer.printTableDetails(t, source, target, false));
            }

            if (!classification.hasChanges()) {
                System.out.println("\nDatabases are already synchronized!");
            } else {
                System.out.printf("%nTotal of %d differences found.%n", classification.totalChanges());
            }
            return 0;
        } catch (ExtractionException | IOException e) {
            System.err.println("Compare failed: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Compare failed: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
