package org.dbsync.extract;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.dbsync.model.SchemaModel;

import java.util.List;

@Value
@Builder
public class ExtractionResult {
    String database;
    SchemaModel schema;
    @Singular List<PartialMetadataWarning> warnings;

    public boolean isComplete() {
        return warnings.isEmpty();
    }
}
