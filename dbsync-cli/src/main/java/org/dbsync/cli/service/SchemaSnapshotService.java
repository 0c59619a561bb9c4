package org.dbsync.cli.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dbsync.model.SchemaModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes schema models as JSON files.
 */
public class SchemaSnapshotService {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    /**
     * @throws IOException if the file is missing or is not a schema snapshot
     */
    public SchemaModel read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Snapshot file not found: " + file);
        }
        return objectMapper.readValue(file.toFile(), SchemaModel.class);
    }

    public void write(SchemaModel schema, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), schema);
    }
}
