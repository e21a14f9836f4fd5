package watchtower.monitor.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.model.AlertTarget;

import java.util.UUID;

/**
 * Sender for the {@code log} transport: writes the alert to the application log.
 */
public class LoggingAlertSender implements AlertSender {

    public static final String TRANSPORT = "log";

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSender.class);

    @Override
    public SendResult send(AlertTarget target, AlertMessage message) {
        String reference = UUID.randomUUID().toString();
        log.warn("[{}] {} {} ({}): {} details={}",
                target.name() != null ? target.name() : target.id(),
                message.severity(),
                message.resolution() ? "RESOLVED" : "ALERT",
                message.groupingKey(),
                message.summary(),
                message.details());
        return SendResult.of(reference);
    }
}
