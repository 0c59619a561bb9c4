package org.dbsync.cli.service;

import org.dbsync.extract.ExtractionResult;

public record LoadedSchemas(ExtractionResult source, ExtractionResult target) {
}
