package autoaccept.platform;

/** Actions the platform can perform on a node on our behalf. */
public enum NodeAction {
    CLICK,
    LONG_CLICK,
    /** Input focus. */
    FOCUS,
    /** Accessibility focus (the cursor assistive tools move). */
    ACCESSIBILITY_FOCUS
}
