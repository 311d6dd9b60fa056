package autoaccept.model;

/**
 * Steps of the accept-and-share flow, in the order they are walked.
 */
public enum FlowStep {

    /** Waiting for an incoming connection request in the source application. */
    IDLE(0, "incoming-connection"),

    /** Connection accepted; waiting for the OS screen-share permission dialog. */
    AWAITING_SHARE_DIALOG(1, "share-dialog"),

    /** Share-mode selector opened; waiting for the mode chooser. */
    AWAITING_CHOOSER(2, "share-chooser"),

    /** "Entire screen" picked; waiting to confirm the share. */
    AWAITING_SHARE_CONFIRM(3, "share-confirm");

    private final int ordinalCode;
    private final String shapeName;

    FlowStep(int ordinalCode, String shapeName) {
        this.ordinalCode = ordinalCode;
        this.shapeName   = shapeName;
    }

    /** Numeric step code used in log lines (0..3). */
    public int code() { return ordinalCode; }

    /** Name of the dialog shape that must be confirmed while at this step. */
    public String shapeName() { return shapeName; }
}
