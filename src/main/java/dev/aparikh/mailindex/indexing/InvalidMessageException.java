package dev.aparikh.mailindex.indexing;

/**
 * Rejected input at message creation. No identifier is consumed when this is thrown.
 */
public class InvalidMessageException extends IllegalArgumentException {

    public InvalidMessageException(String message) {
        super(message);
    }
}
