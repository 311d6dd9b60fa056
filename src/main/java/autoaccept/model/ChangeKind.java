package autoaccept.model;

/** Kinds of UI change notification delivered by the platform. */
public enum ChangeKind {
    WINDOW_STATE_CHANGED,
    WINDOW_CONTENT_CHANGED,
    VIEW_CLICKED,
    VIEW_FOCUSED
}
