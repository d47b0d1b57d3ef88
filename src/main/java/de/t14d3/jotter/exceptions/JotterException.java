package de.t14d3.jotter.exceptions;

/**
 * Base type of every exception Jotter throws on its own behalf.
 */
public class JotterException extends RuntimeException {
    public JotterException(String message) {
        super(message);
    }

    public JotterException(String message, Throwable cause) {
        super(message, cause);
    }
}
