package org.dbsync.migration.dialect.mysql;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MySQL/MariaDB 카탈로그 값 정규화 유틸리티.
 */
public final class MySqlUtil {

    private MySqlUtil() {}

    // 괄호 없이 쓰이는 시간 함수 기본값
    private static final Set<String> TEMPORAL_KEYWORDS = Set.of(
            "CURRENT_TIMESTAMP", "CURRENT_DATE", "CURRENT_TIME",
            "LOCALTIME", "LOCALTIMESTAMP", "NOW", "UTC_TIMESTAMP", "UTC_DATE", "UTC_TIME"
    );

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "tinyint", "smallint", "mediumint", "int", "integer", "bigint",
            "decimal", "dec", "numeric", "fixed", "float", "double", "real",
            "bit", "bool", "boolean", "year"
    );

    private static final Set<String> TEMPORAL_TYPES = Set.of("timestamp", "datetime", "date", "time");

    // CURRENT_TIMESTAMP, current_timestamp(), CURRENT_TIMESTAMP(3)
    private static final Pattern TEMPORAL_CALL = Pattern.compile("([A-Za-z_]+)(\\(\\s*\\d*\\s*\\))?");
    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern BIT_OR_HEX = Pattern.compile("(?i)(b'[01]*'|x'[0-9a-f]*'|0x[0-9a-f]+)");
    private static final String DEFAULT_GENERATED = "DEFAULT_GENERATED";

    /**
     * MySQL 8 reports {@code DEFAULT_GENERATED} in EXTRA for expression defaults.
     * It is informational only and is not valid in a column definition.
     */
    public static String normalizeExtra(String extra) {
        if (extra == null) return "";
        String cleaned = extra.replaceAll("(?i)\\b" + DEFAULT_GENERATED + "\\b", " ");
        return cleaned.trim().replaceAll("\\s+", " ");
    }

    public static boolean isNumericLiteral(String value) {
        return NUMERIC.matcher(value).matches();
    }

    public static boolean isBitOrHexLiteral(String value) {
        return BIT_OR_HEX.matcher(value).matches();
    }

    public static boolean isQuotedLiteral(String value) {
        return value.length() >= 2 && value.startsWith("'") && value.endsWith("'");
    }

    public static boolean isTemporalDefault(String value) {
        Matcher m = TEMPORAL_CALL.matcher(value);
        return m.matches() && TEMPORAL_KEYWORDS.contains(m.group(1).toUpperCase(Locale.ROOT));
    }

    public static boolean isDefaultGenerated(String extra) {
        return extra != null && extra.toUpperCase(Locale.ROOT).contains(DEFAULT_GENERATED);
    }

    /**
     * @param columnType full catalog type such as {@code int(11) unsigned} or {@code decimal(10,2)}
     */
    public static boolean isNumericType(String columnType) {
        return NUMERIC_TYPES.contains(baseType(columnType));
    }

    public static boolean isTemporalType(String columnType) {
        return TEMPORAL_TYPES.contains(baseType(columnType));
    }

    private static String baseType(String columnType) {
        if (columnType == null) return "";
        return columnType.trim().toLowerCase(Locale.ROOT).split("[\\s(]", 2)[0];
    }
}
