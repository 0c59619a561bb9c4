package org.dbsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A base table of one schema. Columns are kept in ordinal order.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableModel {
    @NonNull String name;
    /** Verbatim {@code SHOW CREATE TABLE} text, used only when the table is created on the target. */
    String createStatement;
    String engine;
    String collation;
    /** Catalog estimate, possibly stale. Never treat it as an exact count. */
    @Builder.Default long approximateRows = 0L;
    @Singular List<ColumnDef> columns;
    @Singular("index") List<IndexDef> indexes;
    @Singular List<ForeignKeyDef> foreignKeys;
    @Singular("missingPart") Set<MetadataPart> missingParts;

    public Optional<ColumnDef> findColumn(String columnName) {
        return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
    }

    @JsonIgnore
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDef::getName).toList();
    }

    @JsonIgnore
    public boolean isPartial() {
        return !missingParts.isEmpty();
    }

    public boolean isMissing(MetadataPart part) {
        return missingParts.contains(part);
    }
}
