package org.dbsync.migration;

import org.dbsync.migration.spi.ValueTransformer;
import org.dbsync.migration.spi.dialect.DdlDialect;

public abstract class AbstractDialect implements DdlDialect {
    protected ValueTransformer valueTransformer;

    protected AbstractDialect() {
        this.valueTransformer = initializeValueTransformer();
    }

    protected abstract ValueTransformer initializeValueTransformer();
    public abstract String quoteIdentifier(String identifier);

    @Override
    public ValueTransformer getValueTransformer() {
        return this.valueTransformer;
    }

    @Override
    public String getCommentSql(String text) {
        return "-- " + text;
    }
}
