package org.dbsync.migration.differs;

import org.dbsync.model.TableModel;

/**
 * Compares one aspect of a table present in both schemas.
 *
 * @param <R> diff type produced
 */
public interface TableComponentDiffer<R> {
    R diff(TableModel source, TableModel target);
}
