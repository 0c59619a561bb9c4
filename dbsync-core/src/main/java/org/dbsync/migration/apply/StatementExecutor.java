package org.dbsync.migration.apply;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * Applies a rendered script to the target connection in one transaction.
 *
 * <p>A failing statement is logged and recorded; execution continues with the next one and
 * whatever succeeded is committed. Comment and blank entries are not sent to the server.
 */
public class StatementExecutor {
    private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

    public ApplyResult apply(Connection connection, List<String> statements) throws SQLException {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(statements, "statements must not be null");

        boolean previousAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        ApplyResult.ApplyResultBuilder result = ApplyResult.builder();
        int executed = 0;

        try (Statement stmt = connection.createStatement()) {
            for (int i = 0; i < statements.size(); i++) {
                String sql = statements.get(i);
                if (!isExecutable(sql)) continue;
                try {
                    stmt.execute(sql.trim());
                    executed++;
                } catch (SQLException e) {
                    StatementApplyException failure = new StatementApplyException(sql, i, e);
                    log.error("Error executing: {} ({})", abbreviate(sql), e.getMessage());
                    result.failure(failure);
                }
            }
            connection.commit();
        } catch (SQLException e) {
            rollbackQuietly(connection, e);
            throw e;
        } finally {
            restoreAutoCommit(connection, previousAutoCommit);
        }

        ApplyResult applied = result.executed(executed).build();
        log.info("Applied {} statements, {} failed", applied.getExecuted(), applied.getFailures().size());
        return applied;
    }

    static boolean isExecutable(String sql) {
        if (sql == null) return false;
        String trimmed = sql.trim();
        return !trimmed.isEmpty() && !trimmed.startsWith("--");
    }

    private static void rollbackQuietly(Connection connection, SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private static void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit: {}", e.getMessage());
        }
    }

    private static String abbreviate(String sql) {
        String s = sql.trim();
        return s.length() <= 100 ? s : s.substring(0, 100) + "...";
    }
}
