package autoaccept.platform;

import autoaccept.model.Bounds;
import autoaccept.model.MatcherSpec;
import autoaccept.model.MatcherSpec.Kind;

import java.util.List;
import java.util.Locale;

/**
 * Stateless predicate used by {@link Snapshot#query(MatchCriteria)}.
 *
 * <p>The {@link Kind} decides how candidates are gathered: {@code ID} and
 * {@code TEXT} use the platform's indexed lookups, {@code STRUCTURE} and
 * {@code BOUNDS} walk the tree breadth-first. Every kind then applies the same
 * attribute filters in {@link #matches(Snapshot, UiNode)}.
 */
public final class MatchCriteria {

    private final Kind kind;
    private final String key;
    private final List<String> captions;
    private final List<String> phrases;
    private final String classFragment;
    private final Boolean clickable;
    private final Boolean enabled;
    private final Integer childCount;
    private final String childText;
    private final Bounds bounds;

    private MatchCriteria(Kind kind, String key, List<String> captions, List<String> phrases,
                          String classFragment, Boolean clickable, Boolean enabled,
                          Integer childCount, String childText, Bounds bounds) {
        this.kind          = kind;
        this.key           = key;
        this.captions      = captions == null ? List.of() : List.copyOf(captions);
        this.phrases       = phrases == null ? List.of() : List.copyOf(phrases);
        this.classFragment = classFragment;
        this.clickable     = clickable;
        this.enabled       = enabled;
        this.childCount    = childCount;
        this.childText     = childText;
        this.bounds        = bounds;
    }

    // ── Factories ────────────────────────────────────────────────────────

    public static MatchCriteria viewId(String viewId) {
        return new MatchCriteria(Kind.ID, viewId, null, null, null, null, null, null, null, null);
    }

    public static MatchCriteria text(String literal) {
        return new MatchCriteria(Kind.TEXT, literal, null, null, null, null, null, null, null, null);
    }

    public static MatchCriteria structure(String classFragment, Boolean clickable, Boolean enabled) {
        return new MatchCriteria(Kind.STRUCTURE, null, null, null, classFragment, clickable, enabled,
                null, null, null);
    }

    public static MatchCriteria bounds(Bounds bounds) {
        return new MatchCriteria(Kind.BOUNDS, null, null, null, null, null, null, null, null, bounds);
    }

    /** Builds the runtime predicate for one catalog matcher. */
    public static MatchCriteria from(MatcherSpec spec) {
        if (spec.getKind() == null) {
            throw new IllegalArgumentException("Matcher has no kind: " + spec);
        }
        return new MatchCriteria(spec.getKind(), spec.getValue(), spec.getCaptions(), spec.getPhrases(),
                spec.getClassName(), spec.getClickable(), spec.getEnabled(),
                spec.getChildCount(), spec.getChildText(), spec.getBounds());
    }

    // ── Accessors ────────────────────────────────────────────────────────

    public Kind kind() { return kind; }

    /** View id for {@code ID}, literal for {@code TEXT}, null otherwise. */
    public String key() { return key; }

    /** True when candidates come from a tree walk instead of an indexed lookup. */
    public boolean needsTraversal() {
        return kind == Kind.STRUCTURE || kind == Kind.BOUNDS;
    }

    // ── Predicate ────────────────────────────────────────────────────────

    /**
     * Applies every attribute filter to a candidate. Child handles opened to
     * check {@code childText} are released before returning.
     */
    public boolean matches(Snapshot snapshot, UiNode node) {
        if (clickable != null && node.isClickable() != clickable) return false;
        if (enabled != null && node.isEnabled() != enabled) return false;
        if (classFragment != null && !containsIgnoreCase(node.className(), classFragment)) return false;
        if (kind == Kind.BOUNDS && (bounds == null || !bounds.equals(node.bounds()))) return false;
        if (childCount != null && node.childCount() != childCount) return false;
        if (!captions.isEmpty() && !captionMatches(node.text())) return false;
        if (!phrases.isEmpty() && !phraseMatches(snapshot.displayText(node))) return false;
        if (childText != null && !anyChildContains(snapshot, node, childText)) return false;
        return true;
    }

    private boolean captionMatches(String text) {
        if (text == null) return false;
        String trimmed = text.trim();
        return captions.stream().anyMatch(trimmed::equalsIgnoreCase);
    }

    private boolean phraseMatches(String text) {
        return phrases.stream().anyMatch(p -> containsIgnoreCase(text, p));
    }

    private static boolean anyChildContains(Snapshot snapshot, UiNode node, String fragment) {
        for (int i = 0; i < node.childCount(); i++) {
            UiNode child = snapshot.child(node, i).orElse(null);
            if (child == null) continue;
            boolean hit = containsIgnoreCase(child.text(), fragment);
            snapshot.release(child);
            if (hit) return true;
        }
        return false;
    }

    static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) return false;
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ID        -> "ID='" + key + "'";
            case TEXT      -> "TEXT='" + key + "'";
            case STRUCTURE -> "STRUCTURE{class~'" + classFragment + "', clickable=" + clickable
                    + ", enabled=" + enabled + "}";
            case BOUNDS    -> "BOUNDS" + bounds;
        };
    }
}
