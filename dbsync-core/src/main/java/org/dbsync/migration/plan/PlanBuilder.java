package org.dbsync.migration.plan;

import org.dbsync.migration.differs.SchemaDiffer;
import org.dbsync.model.Classification;
import org.dbsync.model.ColumnDef;
import org.dbsync.model.ColumnDiff;
import org.dbsync.model.MetadataPart;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.Selection;
import org.dbsync.model.SyncAction;
import org.dbsync.model.TableModel;
import org.dbsync.model.TableStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a classification and the operator's selection into a {@link SyncPlan}.
 *
 * <p>Ordering:
 * <ol>
 *   <li>drops, in selection order</li>
 *   <li>creates and alters for {@code STRUCTURE_ONLY} tables, then {@code STRUCTURE_AND_DATA} tables,
 *       each in selection order</li>
 *   <li>within an alter: added columns, dropped columns, modified columns, each sorted by name</li>
 * </ol>
 * Selections that cannot be honored are skipped and reported as {@link InvalidSelectionWarning}.
 * A table whose structure change is refused gets no data marker either. Generated columns
 * cannot be rebuilt from catalog metadata; their ADD and MODIFY are left out with a warning.
 */
public class PlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    private final SchemaDiffer differ;

    public PlanBuilder() {
        this(new SchemaDiffer());
    }

    public PlanBuilder(SchemaDiffer differ) {
        this.differ = Objects.requireNonNull(differ, "differ must not be null");
    }

    public SyncPlan build(Classification classification, Selection selection,
                          SchemaModel source, SchemaModel target) {
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(selection, "selection must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        SyncPlan.SyncPlanBuilder plan = SyncPlan.builder();
        List<InvalidSelectionWarning> warnings = new ArrayList<>();

        // 허용되지 않는 조합은 먼저 걸러낸다
        Set<String> accepted = new LinkedHashSet<>();
        selection.asMap().forEach((table, action) -> {
            if (action == SyncAction.SKIP) return;
            Optional<TableStatus> status = classification.statusOf(table);
            if (status.isEmpty()) {
                warnings.add(new InvalidSelectionWarning(table, action, "table is unknown to both schemas"));
            } else if (!action.allowedFor(status.get())) {
                warnings.add(new InvalidSelectionWarning(table, action,
                        "not allowed for a " + status.get().name().toLowerCase() + " table"));
            } else {
                accepted.add(table);
            }
        });

        for (String table : selection.tablesWith(SyncAction.DROP)) {
            if (accepted.contains(table)) {
                plan.dropTable(new DropTableOperation(table));
            }
        }

        List<String> structureTables = new ArrayList<>(selection.tablesWith(SyncAction.STRUCTURE_ONLY));
        structureTables.addAll(selection.tablesWith(SyncAction.STRUCTURE_AND_DATA));

        for (String table : structureTables) {
            if (!accepted.contains(table)) continue;
            Optional<TableModel> sourceTable = source.findTable(table);
            if (sourceTable.isEmpty()) continue;
            SyncAction action = selection.actionFor(table);

            if (classification.getNewTables().contains(table)) {
                String ddl = sourceTable.get().getCreateStatement();
                if (ddl == null || ddl.isBlank()) {
                    warnings.add(new InvalidSelectionWarning(table, action,
                            "create statement of the source table was not captured"));
                    accepted.remove(table);
                    continue;
                }
                plan.structureOperation(new CreateTableOperation(table, ddl));
            } else {
                TableModel targetTable = target.findTable(table).orElse(null);
                if (targetTable == null
                        || sourceTable.get().isMissing(MetadataPart.COLUMNS)
                        || targetTable.isMissing(MetadataPart.COLUMNS)) {
                    warnings.add(new InvalidSelectionWarning(table, action,
                            "column metadata is incomplete, no ALTER generated"));
                    accepted.remove(table);
                    continue;
                }
                alterFor(table, action, sourceTable.get(), source, target, warnings)
                        .ifPresentOrElse(plan::structureOperation,
                                () -> log.info("No column changes for {}, nothing to alter", table));
            }
        }

        // 구조 변경이 없어도 마커는 만들지만, 구조가 거부된 테이블은 제외
        for (String table : selection.tablesWith(SyncAction.STRUCTURE_AND_DATA)) {
            if (!accepted.contains(table)) continue;
            source.findTable(table).ifPresent(t ->
                    plan.dataSyncMarker(new DataSyncMarker(table, t.getApproximateRows(), t.getColumnNames())));
        }

        warnings.forEach(w -> log.warn("{}", w));
        return plan.warnings(warnings).build();
    }

    private Optional<AlterTableOperation> alterFor(String table, SyncAction action, TableModel sourceTable,
                                                   SchemaModel source, SchemaModel target,
                                                   List<InvalidSelectionWarning> warnings) {
        ColumnDiff diff = differ.columnDiff(table, source, target);
        if (diff.isEmpty()) return Optional.empty();

        List<ColumnChange> changes = new ArrayList<>();
        for (String name : diff.getAdded()) {
            sourceTable.findColumn(name)
                    .filter(c -> rebuildable(table, action, c, warnings))
                    .ifPresent(c -> changes.add(ColumnChange.add(c)));
        }
        for (String name : diff.getRemoved()) {
            changes.add(ColumnChange.drop(name));
        }
        for (ColumnDiff.ChangedColumn changed : diff.getChanged()) {
            sourceTable.findColumn(changed.name())
                    .filter(c -> rebuildable(table, action, c, warnings))
                    .ifPresent(c -> changes.add(ColumnChange.modify(c)));
        }
        if (changes.isEmpty()) return Optional.empty();
        return Optional.of(new AlterTableOperation(table, changes));
    }

    private boolean rebuildable(String table, SyncAction action, ColumnDef column,
                                List<InvalidSelectionWarning> warnings) {
        if (!column.isGenerated()) return true;
        warnings.add(new InvalidSelectionWarning(table, action,
                "generated column '" + column.getName() + "' has no expression in the catalog, change left out"));
        return false;
    }
}
