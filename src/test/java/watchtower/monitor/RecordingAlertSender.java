package watchtower.monitor;

import watchtower.monitor.alert.AlertMessage;
import watchtower.monitor.alert.AlertSender;
import watchtower.monitor.alert.SendResult;
import watchtower.monitor.exception.SendException;
import watchtower.monitor.model.AlertTarget;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sender that keeps every delivered message and can be told to fail for chosen targets.
 */
public final class RecordingAlertSender implements AlertSender {

    public static final String TRANSPORT = "recording";

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private final Set<String> failingTargets = ConcurrentHashMap.newKeySet();

    public record Delivery(String targetId, AlertMessage message) {
    }

    public void failFor(String targetId) {
        failingTargets.add(targetId);
    }

    @Override
    public SendResult send(AlertTarget target, AlertMessage message) {
        if (failingTargets.contains(target.id())) {
            throw new SendException(target.id(), "Connection refused by " + target.id());
        }
        deliveries.add(new Delivery(target.id(), message));
        return new SendResult("ref-" + deliveries.size(), "accepted");
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public List<AlertMessage> messages() {
        return deliveries.stream().map(Delivery::message).toList();
    }

    public List<AlertMessage> messagesTo(String targetId) {
        return deliveries.stream()
                .filter(d -> d.targetId().equals(targetId))
                .map(Delivery::message)
                .toList();
    }
}
