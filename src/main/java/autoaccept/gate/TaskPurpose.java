package autoaccept.gate;

/** Logical slot of a deferred task; one pending task per purpose. */
public enum TaskPurpose {
    /** Cycle scheduled after a notification, once the UI has settled. */
    SETTLE,
    /** Follow-up cycle requested by the state machine. */
    RETRY
}
