package org.dbsync.cli;

import org.dbsync.cli.service.ConnectionFactory;
import org.dbsync.cli.service.ConnectionSettings;
import org.dbsync.cli.service.DiffReportPrinter;
import org.dbsync.cli.service.LoadedSchemas;
import org.dbsync.cli.service.SchemaLoadService;
import org.dbsync.cli.service.SchemaSpec;
import org.dbsync.cli.service.SelectionPrompt;
import org.dbsync.extract.ExtractionException;
import org.dbsync.migration.MigrationGenerator;
import org.dbsync.migration.ScriptInfo;
import org.dbsync.migration.apply.ApplyResult;
import org.dbsync.migration.apply.StatementExecutor;
import org.dbsync.migration.dialect.mysql.MySqlDialect;
import org.dbsync.migration.differs.SchemaDiffer;
import org.dbsync.migration.output.RenderedScripts;
import org.dbsync.migration.output.SqlScriptHandler;
import org.dbsync.migration.plan.PlanBuilder;
import org.dbsync.migration.plan.SyncPlan;
import org.dbsync.model.Classification;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.Selection;
import org.dbsync.model.SyncAction;
import org.dbsync.options.DbSyncOptions;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Compares the schemas, collects per-table choices and generates the synchronization scripts.
 */
@CommandLine.Command(
        name = "sync",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "테이블별 선택에 따라 구조/데이터 동기화 SQL을 생성하고 선택적으로 적용합니다."
)
public class SyncCommand implements Callable<Integer> {

    private static final int PREVIEW_LINES = 10;

    @CommandLine.Mixin
    SchemaSourceOptions sources;

    @CommandLine.Option(names = "--structure-only", split = ",", paramLabel = "TABLE",
            description = "구조만 동기화할 테이블 (지정 시 대화형 선택을 건너뜀)")
    private List<String> structureOnly = new ArrayList<>();
    @CommandLine.Option(names = "--structure-and-data", split = ",", paramLabel = "TABLE",
            description = "구조와 데이터를 동기화할 테이블")
    private List<String> structureAndData = new ArrayList<>();
    @CommandLine.Option(names = "--drop", split = ",", paramLabel = "TABLE",
            description = "대상에서 삭제할 테이블")
    private List<String> drop = new ArrayList<>();

    @CommandLine.Option(names = "--out", description = "SQL 파일 저장 위치 (기본: 설정 또는 현재 디렉터리)")
    private Path outputDir;
    @CommandLine.Option(names = "--base-filename", description = "SQL 파일 이름 접두어 (기본: 설정 또는 sync_database)")
    private String baseFilename;
    @CommandLine.Option(names = "--no-files", description = "SQL 파일을 저장하지 않습니다.")
    private boolean noFiles;
    @CommandLine.Option(names = "--apply", description = "생성된 구조 SQL을 대상 DB에 적용합니다.")
    private boolean apply;

    private final SchemaLoadService loadService;
    private final ConnectionFactory connectionFactory;
    private final InputStream input;
    private final Clock clock;

    public SyncCommand() {
        this(new SchemaLoadService(), ConnectionFactory.driverManager(), System.in, Clock.systemDefaultZone());
    }

    SyncCommand(SchemaLoadService loadService, ConnectionFactory connectionFactory, InputStream input, Clock clock) {
        this.loadService = loadService;
        this.connectionFactory = connectionFactory;
        this.input = input;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        try {
            SchemaSpec sourceSpec = sources.sourceSpec();
            SchemaSpec targetSpec = sources.targetSpec();
            if (apply && targetSpec.isSnapshot()) {
                System.err.println("--apply requires a live target connection, not a snapshot.");
                return 1;
            }

            LoadedSchemas loaded = loadService.loadBoth(sourceSpec, targetSpec);
            SchemaModel source = loaded.source().getSchema();
            SchemaModel target = loaded.target().getSchema();
            String sourceDb = loaded.source().getDatabase();
            String targetDb = loaded.target().getDatabase();

            System.out.printf("Analyzing differences between '%s' and '%s'...%n", sourceDb, targetDb);
            loaded.source().getWarnings().forEach(w -> System.err.println("Warning: source " + w));
            loaded.target().getWarnings().forEach(w -> System.err.println("Warning: target " + w));

            SchemaDiffer differ = new SchemaDiffer();
            Classification classification = differ.classify(source, target);
            DiffReportPrinter printer = new DiffReportPrinter(System.out, differ);
            printer.printSummary(classification, source, target);

            if (!classification.hasChanges()) {
                System.out.println("\nDatabases are already synchronized!");
                return 0;
            }
            System.out.printf("%nTotal of %d differences found.%n", classification.totalChanges());

            Optional<Selection> selection = hasExplicitSelection()
                    ? Optional.of(explicitSelection())
                    : new SelectionPrompt(reader(), System.out, printer).prompt(classification, source, target);
            if (selection.isEmpty()) {
                // 중단 시 계획을 만들지 않는다
                return 0;
            }
            printer.printSelectionSummary(selection.get());

            System.out.println("\nGenerating SQL commands...");
            SyncPlan plan = new PlanBuilder(differ).build(classification, selection.get(), source, target);
            plan.getWarnings().forEach(w -> System.err.println("Warning: " + w));

            ScriptInfo info = scriptInfo(sourceSpec, sourceDb, targetDb);
            MigrationGenerator generator = new MigrationGenerator(new MySqlDialect());
            RenderedScripts scripts = new RenderedScripts(
                    generator.renderStructure(plan, info),
                    generator.renderData(plan, info));

            if (!noFiles) {
                saveFiles(scripts);
            }
            preview(scripts.structure());

            if (!apply) {
                System.out.println("\nChanges not applied. SQL files were generated for manual review.");
                return 0;
            }
            return applyStructure(targetSpec.connection(), targetDb, scripts);

        } catch (ExtractionException | IOException e) {
            System.err.println("Sync failed: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Sync failed: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private boolean hasExplicitSelection() {
        return !structureOnly.isEmpty() || !structureAndData.isEmpty() || !drop.isEmpty();
    }

    private Selection explicitSelection() {
        return Selection.builder()
                .selectAll(trimmed(structureOnly), SyncAction.STRUCTURE_ONLY)
                .selectAll(trimmed(structureAndData), SyncAction.STRUCTURE_AND_DATA)
                .selectAll(trimmed(drop), SyncAction.DROP)
                .build();
    }

    private static List<String> trimmed(List<String> tables) {
        return tables.stream().map(String::trim).filter(t -> !t.isEmpty()).toList();
    }

    private BufferedReader reader() {
        return new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    private ScriptInfo scriptInfo(SchemaSpec sourceSpec, String sourceDb, String targetDb) {
        ScriptInfo.ScriptInfoBuilder info = ScriptInfo.builder()
                .sourceDatabase(sourceDb)
                .targetDatabase(targetDb)
                .generatedAt(LocalDateTime.now(clock));
        if (!sourceSpec.isSnapshot()) {
            info.sourceHost(sourceSpec.connection().getHost())
                .sourceUser(sourceSpec.connection().getUsername());
        }
        return info.build();
    }

    private void saveFiles(RenderedScripts scripts) throws IOException {
        var config = sources.configuration();
        Path dir = outputDir != null
                ? outputDir
                : Path.of(config.getOrDefault(DbSyncOptions.Output.DIRECTORY_KEY, DbSyncOptions.Output.DIRECTORY_DEFAULT));
        String base = baseFilename != null
                ? baseFilename
                : config.getOrDefault(DbSyncOptions.Output.BASE_FILENAME_KEY, DbSyncOptions.Output.BASE_FILENAME_DEFAULT);

        List<Path> written = new SqlScriptHandler().handle(scripts, dir, base);
        for (Path p : written) {
            String kind = p.getFileName().toString().endsWith(DbSyncOptions.Output.DATA_SUFFIX) ? "Data" : "Structure";
            System.out.println(kind + " SQL saved to: " + p);
        }
    }

    private void preview(List<String> structure) {
        if (structure.isEmpty()) return;
        System.out.printf("%nStructure SQL preview (%d commands):%n", structure.size());
        System.out.println("-".repeat(60));
        structure.stream().limit(PREVIEW_LINES).forEach(System.out::println);
        if (structure.size() > PREVIEW_LINES) {
            System.out.printf("... and %d more commands%n", structure.size() - PREVIEW_LINES);
        }
    }

    private int applyStructure(ConnectionSettings settings, String targetDb, RenderedScripts scripts) throws SQLException {
        System.out.println("\nApplying structural changes to '" + targetDb + "'...");
        ApplyResult result;
        try (Connection connection = connectionFactory.open(settings)) {
            result = new StatementExecutor().apply(connection, scripts.structure());
        }
        result.getFailures().forEach(f -> System.err.println("   Error: " + f.getMessage()));

        if (!result.successful()) {
            System.err.printf("%nSynchronization finished with %d failed statements (%d applied).%n",
                    result.getFailures().size(), result.getExecuted());
            return 1;
        }
        System.out.printf("%nSynchronization completed successfully! (%d statements applied)%n", result.getExecuted());
        if (!scripts.data().isEmpty()) {
            System.out.println("\nWARNING: For tables with data, you need to execute");
            System.out.println("   the data synchronization commands separately.");
            System.out.println("   Check the generated *_data.sql file.");
        }
        return 0;
    }
}
