package org.dbsync.cli.service;

import org.dbsync.extract.ExtractionException;
import org.dbsync.extract.ExtractionResult;
import org.dbsync.extract.JdbcMetadataSource;
import org.dbsync.extract.SchemaExtractor;
import org.dbsync.model.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Produces the source and target schema models, from snapshots or live databases.
 * Both sides are loaded concurrently; each side uses its own connection.
 */
public class SchemaLoadService {
    private static final Logger log = LoggerFactory.getLogger(SchemaLoadService.class);

    private final ConnectionFactory connectionFactory;
    private final SchemaSnapshotService snapshots;
    private final SchemaExtractor extractor;

    public SchemaLoadService() {
        this(ConnectionFactory.driverManager(), new SchemaSnapshotService(), new SchemaExtractor());
    }

    public SchemaLoadService(ConnectionFactory connectionFactory, SchemaSnapshotService snapshots,
                             SchemaExtractor extractor) {
        this.connectionFactory = connectionFactory;
        this.snapshots = snapshots;
        this.extractor = extractor;
    }

    public ExtractionResult load(SchemaSpec spec) throws ExtractionException, IOException {
        if (spec.isSnapshot()) {
            SchemaModel schema = snapshots.read(spec.snapshot());
            log.info("Loaded {} schema '{}' from {}", spec.label(), schema.getDatabase(), spec.snapshot());
            return ExtractionResult.builder()
                    .database(schema.getDatabase())
                    .schema(schema)
                    .build();
        }

        ConnectionSettings settings = spec.connection();
        try (Connection connection = connectionFactory.open(settings)) {
            log.info("Connected to {} database {}", spec.label(), settings.describe());
            return extractor.extract(new JdbcMetadataSource(connection), settings.getDatabase());
        } catch (SQLException e) {
            throw new ExtractionException("Connection to " + spec.label() + " database failed: " + e.getMessage(), e);
        }
    }

    /**
     * Loads both sides in parallel. Waits for both before reporting the first failure.
     */
    public LoadedSchemas loadBoth(SchemaSpec source, SchemaSpec target) throws ExtractionException, IOException {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ExtractionResult> sourceFuture = executor.submit(() -> load(source));
            Future<ExtractionResult> targetFuture = executor.submit(() -> load(target));
            Outcome s = await(sourceFuture);
            Outcome t = await(targetFuture);
            return new LoadedSchemas(s.get(), t.get());
        } finally {
            executor.shutdownNow();
        }
    }

    private static Outcome await(Future<ExtractionResult> future) {
        try {
            return new Outcome(future.get(), null);
        } catch (ExecutionException e) {
            return new Outcome(null, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Outcome(null, new ExtractionException("Interrupted while loading schemas", e));
        }
    }

    private record Outcome(ExtractionResult result, Throwable failure) {
        ExtractionResult get() throws ExtractionException, IOException {
            if (failure == null) return result;
            if (failure instanceof ExtractionException e) throw e;
            if (failure instanceof IOException e) throw e;
            if (failure instanceof RuntimeException e) throw e;
            throw new ExtractionException("Schema load failed: " + failure.getMessage(), failure);
        }
    }
}
