package watchtower.monitor.alert;

import watchtower.monitor.exception.SendException;
import watchtower.monitor.model.AlertTarget;

/**
 * Delivery capability of one transport (email, pager, webhook, ...).
 * Implementations should bound their own I/O time; any exception is recorded as a failed send.
 */
public interface AlertSender {

    /**
     * Deliver a message to a target.
     *
     * @param target  the configured target
     * @param message the alert
     * @return what the transport reported
     * @throws SendException if delivery failed
     */
    SendResult send(AlertTarget target, AlertMessage message) throws SendException;
}
