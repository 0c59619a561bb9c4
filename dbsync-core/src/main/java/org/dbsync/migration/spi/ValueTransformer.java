package org.dbsync.migration.spi;

import org.dbsync.model.ColumnDef;

/**
 * Renders a catalog default value as a SQL literal or expression.
 */
public interface ValueTransformer {
    /**
     * @param column column whose default is rendered; its type and extra decide quoting,
     *               its default is never blank
     */
    String renderDefault(ColumnDef column);
}
