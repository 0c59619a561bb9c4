package org.dbsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operator choices keyed by table name, in the order they were made.
 * A table missing from the selection is skipped.
 */
public final class Selection {
    private static final Selection EMPTY = new Selection(Map.of());

    private final Map<String, SyncAction> actions;

    private Selection(Map<String, SyncAction> actions) {
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public static Selection empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SyncAction actionFor(String table) {
        return actions.getOrDefault(table, SyncAction.SKIP);
    }

    public Map<String, SyncAction> asMap() {
        return actions;
    }

    /**
     * Tables with the given action, in selection order.
     */
    public List<String> tablesWith(SyncAction action) {
        return actions.entrySet().stream()
                .filter(e -> e.getValue() == action)
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean isEmpty() {
        return actions.values().stream().allMatch(a -> a == SyncAction.SKIP);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selection other)) return false;
        return actions.equals(other.actions);
    }

    @Override
    public int hashCode() {
        return actions.hashCode();
    }

    @Override
    public String toString() {
        return "Selection" + actions;
    }

    public static final class Builder {
        private final Map<String, SyncAction> actions = new LinkedHashMap<>();

        /**
         * Records a choice. Choosing again for the same table replaces the action but keeps its position.
         */
        public Builder select(String table, SyncAction action) {
            actions.put(Objects.requireNonNull(table, "table must not be null"),
                    Objects.requireNonNull(action, "action must not be null"));
            return this;
        }

        public Builder selectAll(List<String> tables, SyncAction action) {
            tables.forEach(t -> select(t, action));
            return this;
        }

        public Selection build() {
            return new Selection(actions);
        }
    }
}
