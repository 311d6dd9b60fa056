package autoaccept.model;

import java.util.Objects;

/**
 * A single change notification: the application package that produced it and
 * what kind of change happened. The tree itself is pulled on demand, never
 * carried by the event.
 */
public record ChangeEvent(String sourceApplicationId, ChangeKind kind) {

    public ChangeEvent {
        Objects.requireNonNull(kind, "kind");
    }

    public static ChangeEvent windowChanged(String sourceApplicationId) {
        return new ChangeEvent(sourceApplicationId, ChangeKind.WINDOW_STATE_CHANGED);
    }
}
