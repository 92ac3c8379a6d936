package dev.aparikh.mailindex.indexing;

/**
 * An index update failed after the message was already stored. The engine that raised it
 * refuses all further work.
 */
public class IndexInvariantViolationException extends IllegalStateException {

    public IndexInvariantViolationException(String message) {
        super(message);
    }

    public IndexInvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
