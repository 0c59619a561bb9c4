package org.dbsync.cli;

import org.dbsync.cli.service.SchemaLoadService;
import org.dbsync.cli.service.SchemaSnapshotService;
import org.dbsync.cli.service.SchemaSpec;
import org.dbsync.extract.ExtractionException;
import org.dbsync.extract.ExtractionResult;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Extracts one side's schema and stores it as JSON for offline comparison.
 */
@CommandLine.Command(
        name = "snapshot",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "한쪽 데이터베이스의 스키마를 JSON 스냅샷으로 저장합니다."
)
public class SnapshotCommand implements Callable<Integer> {

    enum Side { SOURCE, TARGET }

    @CommandLine.Mixin
    SchemaSourceOptions sources;

    @CommandLine.Option(names = "--side", description = "스냅샷 대상 (${COMPLETION-CANDIDATES})",
            defaultValue = "SOURCE", converter = SideConverter.class)
    private Side side;

    @CommandLine.Option(names = {"-o", "--out"}, description = "저장할 JSON 파일", required = true)
    private Path outputFile;

    private final SchemaLoadService loadService;
    private final SchemaSnapshotService snapshots;

    public SnapshotCommand() {
        this(new SchemaLoadService(), new SchemaSnapshotService());
    }

    SnapshotCommand(SchemaLoadService loadService, SchemaSnapshotService snapshots) {
        this.loadService = loadService;
        this.snapshots = snapshots;
    }

    @Override
    public Integer call() {
        SchemaSpec spec = side == Side.SOURCE ? sources.sourceSpec() : sources.targetSpec();
        try {
            ExtractionResult result = loadService.load(spec);
            result.getWarnings().forEach(w -> System.err.println("Warning: " + w));
            snapshots.write(result.getSchema(), outputFile);
            System.out.printf("Snapshot of '%s' (%d tables) saved to: %s%n",
                    result.getDatabase(), result.getSchema().getTables().size(), outputFile);
            return 0;
        } catch (ExtractionException | IOException e) {
            System.err.println("Snapshot failed: " + e.getMessage());
            return 1;
        }
    }

    static class SideConverter implements CommandLine.ITypeConverter<Side> {
        @Override
        public Side convert(String value) {
            return Side.valueOf(value.trim().toUpperCase());
        }
    }
}
