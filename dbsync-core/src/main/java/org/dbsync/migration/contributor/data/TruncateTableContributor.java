package org.dbsync.migration.contributor.data;

import org.dbsync.migration.contributor.TableContributor;
import org.dbsync.migration.plan.DataSyncMarker;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;
import java.util.Locale;

public record TruncateTableContributor(DataSyncMarker marker) implements TableContributor {
    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getCommentSql(String.format(Locale.US,
                "Synchronizing data for table %s (~%,d records)", marker.table(), marker.approximateRows())));
        statements.add(dialect.getTruncateTableSql(marker.table()));
    }
}
