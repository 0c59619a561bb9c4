package org.dbsync.migration.spi.dialect;

import org.dbsync.migration.spi.ValueTransformer;

public interface BaseDialect {
    String quoteIdentifier(String raw);
    ValueTransformer getValueTransformer();
    String getCommentSql(String text);
}
