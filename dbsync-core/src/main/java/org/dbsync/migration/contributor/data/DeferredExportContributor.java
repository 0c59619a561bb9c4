package org.dbsync.migration.contributor.data;

import org.dbsync.migration.ScriptInfo;
import org.dbsync.migration.contributor.TableContributor;
import org.dbsync.migration.plan.DataSyncMarker;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;
import java.util.Locale;

/**
 * Rows are never inlined. The block names the target columns and points at an external export.
 */
public record DeferredExportContributor(DataSyncMarker marker, ScriptInfo info) implements TableContributor {
    @Override
    public int priority() {
        return 20;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        String table = marker.table();
        // 실행 가능한 INSERT가 아니므로 주석으로 남긴다
        statements.add(dialect.getCommentSql(dialect.getInsertColumnsHeader(table, marker.columns())));
        statements.add(dialect.getCommentSql("WARNING: Data for table " + table + " must be exported separately"));
        statements.add(dialect.getCommentSql(String.format(Locale.US,
                "approximately %,d records in %s", marker.approximateRows(), info.getSourceDatabase())));
        statements.add(dialect.getCommentSql("Use: mysqldump"
                + " -h " + orPlaceholder(info.getSourceHost(), "<host>")
                + " -u " + orPlaceholder(info.getSourceUser(), "<user>")
                + " -p " + info.getSourceDatabase() + " " + table + " --no-create-info"));
    }

    private static String orPlaceholder(String value, String placeholder) {
        return value == null || value.isBlank() ? placeholder : value;
    }
}
