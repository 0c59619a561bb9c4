package org.dbsync.migration.output;

import java.util.List;

/**
 * Rendered statement lists of one run. Either list may be empty.
 */
public record RenderedScripts(List<String> structure, List<String> data) {
    public RenderedScripts {
        structure = List.copyOf(structure);
        data = List.copyOf(data);
    }

    /**
     * Newline-terminated script text, one entry per line.
     */
    public static String join(List<String> statements) {
        StringBuilder sb = new StringBuilder();
        statements.forEach(s -> sb.append(s).append('\n'));
        return sb.toString();
    }
}
