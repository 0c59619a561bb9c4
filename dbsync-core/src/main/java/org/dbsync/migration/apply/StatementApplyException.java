package org.dbsync.migration.apply;

import java.sql.SQLException;

/**
 * One statement that failed while applying a script.
 */
public class StatementApplyException extends Exception {
    private final String statement;
    private final int index;

    public StatementApplyException(String statement, int index, SQLException cause) {
        super("Statement #" + index + " failed: " + cause.getMessage(), cause);
        this.statement = statement;
        this.index = index;
    }

    public String getStatement() {
        return statement;
    }

    /**
     * Position of the statement in the submitted list, starting at 0.
     */
    public int getIndex() {
        return index;
    }
}
