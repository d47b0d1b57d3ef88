package de.t14d3.jotter.exceptions;

/**
 * A statement against the persisted store failed. The cause is normally the driver's
 * {@link java.sql.SQLException}.
 */
public class StoreException extends JotterException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
