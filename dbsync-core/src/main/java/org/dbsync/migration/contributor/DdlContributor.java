package org.dbsync.migration.contributor;

import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;

/**
 * One clause of an ALTER TABLE, rendered as a complete statement.
 */
public interface DdlContributor extends SqlContributor {
    void contribute(List<String> statements, DdlDialect dialect);
}
