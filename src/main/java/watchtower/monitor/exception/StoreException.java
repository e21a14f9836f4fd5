package watchtower.monitor.exception;

/**
 * Wraps a JDBC failure raised while reading or writing monitoring state.
 */
public class StoreException extends WatchtowerException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
