package watchtower.monitor.exception;

/**
 * Base exception for all monitoring-core errors.
 * Domain exceptions extend this class so callers can contain them at one boundary.
 */
public class WatchtowerException extends RuntimeException {

    public WatchtowerException(String message) {
        super(message);
    }

    public WatchtowerException(String message, Throwable cause) {
        super(message, cause);
    }

    public WatchtowerException(Throwable cause) {
        super(cause);
    }
}
