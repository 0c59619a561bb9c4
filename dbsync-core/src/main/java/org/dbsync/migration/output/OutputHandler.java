package org.dbsync.migration.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface OutputHandler {
    /**
     * @return the files written, structure first
     */
    List<Path> handle(RenderedScripts scripts, Path outputDir, String baseFilename) throws IOException;
}
