package autoaccept.platform;

import autoaccept.model.Bounds;

import java.util.List;

/**
 * Handle to one element of the external UI tree.
 *
 * <p>The tree belongs to the platform. Every handle returned by {@link #child},
 * {@link #parent}, {@link #findByViewId} or {@link #findByText} is a new handle
 * that must be released exactly once, even when it points at an element some
 * other handle already refers to. Application code never calls
 * {@link #release()} directly; {@link Snapshot} does it.
 */
public interface UiNode {

    /** Widget class name, e.g. {@code android.widget.Button}; may be null. */
    String className();

    /** Text content; may be null. */
    String text();

    /** Stable resource identifier, e.g. {@code android:id/button1}; may be null. */
    String viewId();

    boolean isClickable();

    boolean isEnabled();

    boolean isVisible();

    /** Screen rectangle. Never null. */
    Bounds bounds();

    int childCount();

    /** New handle to the child at {@code index}, or null if it vanished. */
    UiNode child(int index);

    /** New handle to the parent, or null at the root. */
    UiNode parent();

    /** Descendants (including this node) with the exact view id. */
    List<UiNode> findByViewId(String viewId);

    /** Descendants (including this node) whose text contains {@code text}, ignoring case. */
    List<UiNode> findByText(String text);

    /**
     * Asks the platform to perform an action.
     *
     * @return whether the platform accepted the action
     */
    boolean performAction(NodeAction action);

    /**
     * Returns the handle to the platform. May throw if the handle is already
     * invalid; {@link Snapshot#release(UiNode)} absorbs that.
     */
    void release();
}
