package org.dbsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tables of exactly one database captured at one point in time, keyed by table name.
 * Built once by the extractor and never mutated afterwards.
 */
@Value
@Builder
@Jacksonized
public class SchemaModel {
    String database;
    @Singular Map<String, TableModel> tables;

    public static SchemaModel empty(String database) {
        return SchemaModel.builder().database(database).build();
    }

    public Optional<TableModel> findTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    public boolean contains(String tableName) {
        return tables.containsKey(tableName);
    }

    @JsonIgnore
    public Set<String> getTableNames() {
        return tables.keySet();
    }
}
