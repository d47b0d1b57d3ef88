package de.t14d3.jotter.exceptions;

/**
 * Building a registry generation from the persisted store failed. The generation that was
 * serving before the attempt, if any, is still in place.
 */
public class LoadFailureException extends JotterException {
    public LoadFailureException(String message) {
        super(message);
    }

    public LoadFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
