package org.dbsync.migration.contributor;

import org.dbsync.migration.ScriptInfo;
import org.dbsync.migration.contributor.alter.ColumnModifyContributor;
import org.dbsync.migration.contributor.create.ColumnAddContributor;
import org.dbsync.migration.contributor.create.CreateTableStatementContributor;
import org.dbsync.migration.contributor.data.DeferredExportContributor;
import org.dbsync.migration.contributor.data.TruncateTableContributor;
import org.dbsync.migration.contributor.drop.ColumnDropContributor;
import org.dbsync.migration.contributor.drop.DropTableStatementContributor;
import org.dbsync.migration.dialect.mysql.MySqlDialect;
import org.dbsync.migration.plan.DataSyncMarker;
import org.dbsync.model.ColumnDef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContributorsTest {

    private final MySqlDialect dialect = new MySqlDialect();

    private List<String> render(SqlContributor c) {
        List<String> out = new ArrayList<>();
        if (c instanceof DdlContributor ddl) ddl.contribute(out, dialect);
        else ((TableContributor) c).contribute(out, dialect);
        return out;
    }

    @Test
    @DisplayName("컬럼 변경 우선순위: ADD < DROP < MODIFY")
    void columnPriorities() {
        ColumnDef c = ColumnDef.builder().name("c").type("int").build();
        assertThat(new ColumnAddContributor("t", c).priority())
                .isLessThan(new ColumnDropContributor("t", "c").priority());
        assertThat(new ColumnDropContributor("t", "c").priority())
                .isLessThan(new ColumnModifyContributor("t", c).priority());
    }

    @Test
    void tableBlocks() {
        assertThat(render(new DropTableStatementContributor("legacy_logs")))
                .containsExactly("-- Removing table legacy_logs", "DROP TABLE IF EXISTS `legacy_logs`;");
        assertThat(render(new CreateTableStatementContributor("users", "CREATE TABLE `users` (`id` int)")))
                .containsExactly("-- Creating table users", "CREATE TABLE `users` (`id` int);");
    }

    @Test
    @DisplayName("데이터 블록은 TRUNCATE와 외부 export 안내만 담고 행 값은 넣지 않는다")
    void dataBlocks() {
        DataSyncMarker marker = new DataSyncMarker("products", 5000, List.of("id", "name"));
        ScriptInfo info = ScriptInfo.builder()
                .sourceDatabase("app").targetDatabase("app_copy")
                .sourceHost("db1").generatedAt(LocalDateTime.of(2024, 1, 1, 0, 0))
                .build();

        assertThat(render(new TruncateTableContributor(marker))).containsExactly(
                "-- Synchronizing data for table products (~5,000 records)",
                "TRUNCATE TABLE `products`;");
        assertThat(render(new DeferredExportContributor(marker, info))).containsExactly(
                "-- INSERT INTO `products` (`id`, `name`) VALUES",
                "-- WARNING: Data for table products must be exported separately",
                "-- approximately 5,000 records in app",
                "-- Use: mysqldump -h db1 -u <user> -p app products --no-create-info");
    }
}
