package de.mirkosertic.sitesearch;

public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(final String message) {
        super(message);
    }
}
