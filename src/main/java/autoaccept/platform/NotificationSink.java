package autoaccept.platform;

/**
 * Receives short human-readable confirmations ("Connection accepted") for the
 * host to show. Informational only; failures are never reported here.
 */
@FunctionalInterface
public interface NotificationSink {

    void notify(String message);
}
