package org.dbsync.migration.output;

import org.dbsync.options.DbSyncOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@code <base>_structure.sql} and {@code <base>_data.sql}. An empty statement list
 * produces no file.
 */
public class SqlScriptHandler implements OutputHandler {
    private static final Logger log = LoggerFactory.getLogger(SqlScriptHandler.class);

    @Override
    public List<Path> handle(RenderedScripts scripts, Path outputDir, String baseFilename) throws IOException {
        String base = (baseFilename == null || baseFilename.isBlank())
                ? DbSyncOptions.Output.BASE_FILENAME_DEFAULT
                : baseFilename;

        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();

        if (!scripts.structure().isEmpty()) {
            written.add(write(outputDir.resolve(base + DbSyncOptions.Output.STRUCTURE_SUFFIX), scripts.structure()));
        }
        if (!scripts.data().isEmpty()) {
            written.add(write(outputDir.resolve(base + DbSyncOptions.Output.DATA_SUFFIX), scripts.data()));
        }
        return written;
    }

    private Path write(Path file, List<String> statements) throws IOException {
        Files.writeString(file, RenderedScripts.join(statements), StandardCharsets.UTF_8);
        log.info("Wrote {} ({} lines)", file, statements.size());
        return file;
    }
}
