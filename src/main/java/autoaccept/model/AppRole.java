package autoaccept.model;

/** Which of the two monitored applications a notification came from. */
public enum AppRole {
    /** The remote-desktop client that raises the incoming connection request. */
    SOURCE,
    /** The system UI that hosts the screen-share permission dialogs. */
    COMPANION
}
