package org.dbsync.model;

/**
 * One differing attribute of a column present on both sides.
 * {@code oldValue} is the target value, {@code newValue} the source value.
 */
public record FieldDelta(Field field, String oldValue, String newValue) {

    public enum Field {
        TYPE("Type"), NULLABLE("Nullable"), DEFAULT("Default"), EXTRA("Extra");

        private final String label;

        Field(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public String describe() {
        return field.label() + ": " + oldValue + " -> " + newValue;
    }
}
