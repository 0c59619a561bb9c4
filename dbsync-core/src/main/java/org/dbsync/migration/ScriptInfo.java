package org.dbsync.migration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Run information for SQL script headers.
 */
@Value
@Builder
public class ScriptInfo {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @NonNull String sourceDatabase;
    @NonNull String targetDatabase;
    /** Used for the external export hint; may be {@code null}. */
    String sourceHost;
    String sourceUser;
    @NonNull LocalDateTime generatedAt;

    public String formattedTimestamp() {
        return TIMESTAMP.format(generatedAt);
    }
}
