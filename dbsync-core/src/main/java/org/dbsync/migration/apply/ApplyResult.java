package org.dbsync.migration.apply;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ApplyResult {
    /** Statements that ran without error. */
    int executed;
    @Singular List<StatementApplyException> failures;

    public boolean successful() {
        return failures.isEmpty();
    }
}
