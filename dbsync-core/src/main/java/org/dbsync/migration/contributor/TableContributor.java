package org.dbsync.migration.contributor;

import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;

public interface TableContributor extends SqlContributor {
    void contribute(List<String> statements, DdlDialect dialect);
}
