package org.dbsync.migration.dialect.mysql;

import org.dbsync.migration.spi.ValueTransformer;
import org.dbsync.model.ColumnDef;

/**
 * Quotes defaults according to the column type.
 *
 * <ul>
 *   <li>{@code NULL} and already quoted literals pass through</li>
 *   <li>temporal columns keep {@code CURRENT_TIMESTAMP} and friends bare</li>
 *   <li>{@code DEFAULT_GENERATED} expressions are wrapped in parentheses</li>
 *   <li>numeric columns keep numeric and bit/hex literals bare</li>
 *   <li>everything else is a string literal</li>
 * </ul>
 */
public class MySqlValueTransformer implements ValueTransformer {
    @Override
    public String renderDefault(ColumnDef column) {
        String value = column.normalizedDefault();
        if (value.equalsIgnoreCase("NULL") || MySqlUtil.isQuotedLiteral(value)) {
            return value;
        }
        if (MySqlUtil.isTemporalType(column.getType()) && MySqlUtil.isTemporalDefault(value)) {
            return value;
        }
        if (MySqlUtil.isDefaultGenerated(column.getExtra())) {
            return "(" + value + ")";
        }
        if (MySqlUtil.isNumericType(column.getType())) {
            // MariaDB reports expression defaults without DEFAULT_GENERATED
            if (MySqlUtil.isNumericLiteral(value)
                    || MySqlUtil.isBitOrHexLiteral(value)
                    || value.contains("(")) {
                return value;
            }
        }
        return quote(value);
    }

    public String quote(String value) {
        if (value == null) return "NULL";
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }
}
