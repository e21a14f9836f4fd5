package watchtower.monitor.alert;

/**
 * What a delivery target reported back after accepting an alert.
 *
 * @param reference transport-side id of the delivered message, if any
 * @param detail    free-form diagnostic
 */
public record SendResult(String reference, String detail) {

    public static SendResult of(String reference) {
        return new SendResult(reference, null);
    }
}
