package org.dbsync.extract;

/**
 * Fatal failure extracting one side's schema: no database context, or the catalog is unreachable.
 * The other side's extraction is unaffected.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
