package autoaccept.platform;

/**
 * The external UI platform: source of tree snapshots and sink of the event
 * subscription. Implemented by the host (an accessibility service on device,
 * an in-memory tree in tests).
 */
public interface UiPlatform {

    /**
     * Root of the active window's tree as a new handle, or null when no window
     * is available. The caller owns the handle.
     */
    UiNode rootInActiveWindow();

    /** Applies the notification subscription; called once on service connect. */
    void configure(EventSubscription subscription);
}
