package org.dbsync.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Index with its member columns in index order. Equality is name plus ordered columns.
 */
@Value
@Builder
@Jacksonized
public class IndexDef {
    @NonNull String name;
    @Singular List<String> columns;

    public String columnList() {
        return String.join(", ", columns);
    }
}
