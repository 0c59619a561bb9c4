package org.dbsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One column of a table as read from the catalog.
 *
 * <p>Identity is the column name. Two columns with the same name have the same
 * definition when {@link #sameDefinition(ColumnDef)} holds; ordinal position and
 * key role are carried for display only.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ColumnDef {
    private static final Pattern GENERATED_EXTRA =
            Pattern.compile("(?i)\\b(VIRTUAL|STORED|PERSISTENT)\\s+GENERATED\\b");

    @NonNull String name;
    @NonNull String type;
    @Builder.Default boolean nullable = true;
    /** Raw catalog default. {@code null} means no default; the string {@code NULL} is a real default. */
    String defaultValue;
    @Builder.Default String extra = "";
    @Builder.Default int ordinalPosition = 0;
    @Builder.Default KeyRole keyRole = KeyRole.NONE;

    /**
     * Compares type, nullability, normalized default and extra.
     */
    public boolean sameDefinition(ColumnDef other) {
        if (other == null) return false;
        return type.equals(other.type)
                && nullable == other.nullable
                && normalizedDefault().equals(other.normalizedDefault())
                && normalizedExtra().equals(other.normalizedExtra());
    }

    /**
     * Default value as compared by the differ: trimmed, with absent and blank collapsed to "".
     */
    public String normalizedDefault() {
        return defaultValue == null ? "" : defaultValue.trim();
    }

    public String normalizedExtra() {
        return extra == null ? "" : extra.trim();
    }

    /**
     * {@code VIRTUAL GENERATED}, {@code STORED GENERATED} or MariaDB's {@code PERSISTENT GENERATED}.
     * The catalog's EXTRA carries no generation expression for these.
     */
    @JsonIgnore
    public boolean isGenerated() {
        return GENERATED_EXTRA.matcher(normalizedExtra()).find();
    }

    public boolean hasDefault() {
        return !normalizedDefault().isEmpty();
    }

    public String nullabilityKeyword() {
        return nullable ? "NULL" : "NOT NULL";
    }

    public boolean sameName(ColumnDef other) {
        return other != null && Objects.equals(name, other.name);
    }
}
