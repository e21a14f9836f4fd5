package watchtower.monitor.exception;

/**
 * Thrown by a delivery target when an alert could not be delivered.
 */
public class SendException extends WatchtowerException {

    private final String targetId;

    public SendException(String targetId, String message) {
        super(message);
        this.targetId = targetId;
    }

    public SendException(String targetId, String message, Throwable cause) {
        super(message, cause);
        this.targetId = targetId;
    }

    public String getTargetId() {
        return targetId;
    }
}
