package org.dbsync.migration.contributor;

/**
 * Lower priority values are rendered first; equal priorities keep insertion order.
 */
public interface SqlContributor {
    int priority();
}
