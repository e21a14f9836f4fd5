package watchtower.monitor.alert;

import watchtower.monitor.exception.SendException;
import watchtower.monitor.model.AlertTarget;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps transport names to senders.
 */
public final class AlertSenderRegistry {

    private final Map<String, AlertSender> senders = new ConcurrentHashMap<>();

    public AlertSenderRegistry register(String transport, AlertSender sender) {
        senders.put(transport, sender);
        return this;
    }

    /**
     * @throws SendException if no sender is registered for the target's transport
     */
    public AlertSender senderFor(AlertTarget target) {
        AlertSender sender = senders.get(target.transport());
        if (sender == null) {
            throw new SendException(target.id(), "No sender registered for transport '" + target.transport() + "'");
        }
        return sender;
    }
}
