package org.dbsync.model;

/**
 * Key participation of a column as reported by the catalog ({@code COLUMN_KEY}).
 */
public enum KeyRole {
    PRIMARY, UNIQUE, NONE;

    /**
     * Maps the catalog code ({@code PRI}, {@code UNI}, {@code MUL}, empty) to a role.
     * Anything that is not a primary or unique key marker is {@link #NONE}.
     */
    public static KeyRole fromCatalogCode(String code) {
        if (code == null) return NONE;
        return switch (code.trim().toUpperCase()) {
            case "PRI" -> PRIMARY;
            case "UNI" -> UNIQUE;
            default -> NONE;
        };
    }
}
