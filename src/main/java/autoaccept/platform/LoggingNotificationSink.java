package autoaccept.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default sink used when the host does not supply one: writes to the log. */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notify(String message) {
        log.info("Notification: {}", message);
    }
}
