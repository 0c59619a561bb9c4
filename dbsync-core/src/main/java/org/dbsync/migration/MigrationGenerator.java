package org.dbsync.migration;

import org.dbsync.migration.contributor.alter.ColumnModifyContributor;
import org.dbsync.migration.contributor.create.ColumnAddContributor;
import org.dbsync.migration.contributor.create.CreateTableStatementContributor;
import org.dbsync.migration.contributor.data.DeferredExportContributor;
import org.dbsync.migration.contributor.data.TruncateTableContributor;
import org.dbsync.migration.contributor.drop.ColumnDropContributor;
import org.dbsync.migration.contributor.drop.DropTableStatementContributor;
import org.dbsync.migration.plan.AlterTableOperation;
import org.dbsync.migration.plan.ColumnChange;
import org.dbsync.migration.plan.CreateTableOperation;
import org.dbsync.migration.plan.DataSyncMarker;
import org.dbsync.migration.plan.DropTableOperation;
import org.dbsync.migration.plan.StructureOperation;
import org.dbsync.migration.plan.SyncPlan;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link SyncPlan} into ordered statement lists. Entries may be comments or blank
 * lines; joined with newlines they form the script files.
 */
public class MigrationGenerator {
    private final DdlDialect dialect;

    public MigrationGenerator(DdlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public List<String> renderStructure(SyncPlan plan, ScriptInfo info) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(info, "info must not be null");

        List<String> out = new ArrayList<>();
        header(out, "Structure Synchronization Script", info);
        open(out, info);

        // 1) 테이블 삭제가 항상 먼저
        for (DropTableOperation drop : plan.getDropTables()) {
            out.addAll(new TableStatementBuilder(dialect)
                    .add(new DropTableStatementContributor(drop.table()))
                    .build());
            out.add("");
        }

        // 2) 생성/변경 (선택 순서)
        for (StructureOperation op : plan.getStructureOperations()) {
            List<String> block = render(op);
            if (block.isEmpty()) continue;
            out.addAll(block);
            out.add("");
        }

        out.add(dialect.getForeignKeyChecksSql(true));
        return List.copyOf(out);
    }

    /**
     * @return an empty list when no table is marked for data sync
     */
    public List<String> renderData(SyncPlan plan, ScriptInfo info) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(info, "info must not be null");
        if (plan.getDataSyncMarkers().isEmpty()) {
            return List.of();
        }

        List<String> out = new ArrayList<>();
        header(out, "Data Synchronization Script", info);
        open(out, info);

        for (DataSyncMarker marker : plan.getDataSyncMarkers()) {
            out.addAll(new TableStatementBuilder(dialect)
                    .add(new TruncateTableContributor(marker))
                    .add(new DeferredExportContributor(marker, info))
                    .build());
            out.add("");
        }

        out.add(dialect.getForeignKeyChecksSql(true));
        return List.copyOf(out);
    }

    private List<String> render(StructureOperation op) {
        if (op instanceof CreateTableOperation create) {
            return new TableStatementBuilder(dialect)
                    .add(new CreateTableStatementContributor(create.table(), create.createStatement()))
                    .build();
        }
        AlterTableOperation alter = (AlterTableOperation) op;
        AlterTableBuilder builder = new AlterTableBuilder(alter.table(), dialect);
        for (ColumnChange change : alter.changes()) {
            switch (change.kind()) {
                case ADD -> builder.add(new ColumnAddContributor(alter.table(), change.definition()));
                case DROP -> builder.add(new ColumnDropContributor(alter.table(), change.column()));
                case MODIFY -> builder.add(new ColumnModifyContributor(alter.table(), change.definition()));
            }
        }
        return builder.build();
    }

    private void header(List<String> out, String title, ScriptInfo info) {
        out.add(dialect.getCommentSql(title));
        out.add(dialect.getCommentSql("Generated on: " + info.formattedTimestamp()));
        out.add(dialect.getCommentSql("Source: " + info.getSourceDatabase() + " -> Target: " + info.getTargetDatabase()));
        out.add("");
    }

    private void open(List<String> out, ScriptInfo info) {
        out.add(dialect.getUseDatabaseSql(info.getTargetDatabase()));
        out.add(dialect.getForeignKeyChecksSql(false));
        out.add("");
    }
}
