package autoaccept.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of an ordered matcher chain: how to find a node and which
 * attributes a candidate must carry to be accepted.
 *
 * <p>Example JSON:
 * <pre>{@code
 * { "kind": "ID", "value": "android:id/button1",
 *   "captions": ["ACCEPT", "ALLOW", "OK"], "clickable": true, "enabled": true }
 * }</pre>
 *
 * <p>Null flags mean "don't care". {@code captions} are compared with
 * {@code equalsIgnoreCase} against the node text; {@code phrases} are
 * case-insensitive substrings of the node's display text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatcherSpec {

    public enum Kind { ID, TEXT, STRUCTURE, BOUNDS }

    @JsonProperty("kind")
    private Kind kind;

    /** View id for {@code ID}, literal text for {@code TEXT}; unused otherwise. */
    @JsonProperty("value")
    private String value;

    @JsonProperty("captions")
    private List<String> captions = new ArrayList<>();

    @JsonProperty("phrases")
    private List<String> phrases = new ArrayList<>();

    /** Case-insensitive fragment of the node class name. */
    @JsonProperty("className")
    private String className;

    @JsonProperty("clickable")
    private Boolean clickable;

    @JsonProperty("enabled")
    private Boolean enabled;

    /** TEXT only: climb to the nearest clickable ancestor of a non-clickable hit. */
    @JsonProperty("walkUp")
    private boolean walkUp;

    /** STRUCTURE only: exact number of children. */
    @JsonProperty("childCount")
    private Integer childCount;

    /** STRUCTURE only: some direct child's text contains this (ignore case). */
    @JsonProperty("childText")
    private String childText;

    /** BOUNDS only: the exact screen rectangle. */
    @JsonProperty("bounds")
    private Bounds bounds;

    public MatcherSpec() {}

    public MatcherSpec(Kind kind, String value) {
        this.kind  = kind;
        this.value = value;
    }

    // ── Factories ────────────────────────────────────────────────────────

    public static MatcherSpec byId(String viewId) {
        return new MatcherSpec(Kind.ID, viewId);
    }

    public static MatcherSpec byText(String text) {
        return new MatcherSpec(Kind.TEXT, text);
    }

    public static MatcherSpec byStructure(String classFragment) {
        MatcherSpec m = new MatcherSpec(Kind.STRUCTURE, null);
        m.setClassName(classFragment);
        return m;
    }

    public static MatcherSpec byBounds(Bounds bounds) {
        MatcherSpec m = new MatcherSpec(Kind.BOUNDS, null);
        m.setBounds(bounds);
        return m;
    }

    // ── Fluent tweaks used by tests and programmatic catalogs ─────────────

    public MatcherSpec withCaptions(String... values) {
        this.captions = new ArrayList<>(List.of(values));
        return this;
    }

    public MatcherSpec withPhrases(String... values) {
        this.phrases = new ArrayList<>(List.of(values));
        return this;
    }

    public MatcherSpec interactive() {
        this.clickable = Boolean.TRUE;
        this.enabled   = Boolean.TRUE;
        return this;
    }

    public MatcherSpec walkingUp() {
        this.walkUp = true;
        return this;
    }

    // ── Getters / setters ────────────────────────────────────────────────

    public Kind         getKind()       { return kind; }
    public String       getValue()      { return value; }
    public List<String> getCaptions()   { return captions; }
    public List<String> getPhrases()    { return phrases; }
    public String       getClassName()  { return className; }
    public Boolean      getClickable()  { return clickable; }
    public Boolean      getEnabled()    { return enabled; }
    public boolean      isWalkUp()      { return walkUp; }
    public Integer      getChildCount() { return childCount; }
    public String       getChildText()  { return childText; }
    public Bounds       getBounds()     { return bounds; }

    public void setKind(Kind kind)                   { this.kind = kind; }
    public void setValue(String value)               { this.value = value; }
    public void setCaptions(List<String> captions)   { this.captions = captions != null ? captions : new ArrayList<>(); }
    public void setPhrases(List<String> phrases)     { this.phrases = phrases != null ? phrases : new ArrayList<>(); }
    public void setClassName(String className)       { this.className = className; }
    public void setClickable(Boolean clickable)      { this.clickable = clickable; }
    public void setEnabled(Boolean enabled)          { this.enabled = enabled; }
    public void setWalkUp(boolean walkUp)            { this.walkUp = walkUp; }
    public void setChildCount(Integer childCount)    { this.childCount = childCount; }
    public void setChildText(String childText)       { this.childText = childText; }
    public void setBounds(Bounds bounds)             { this.bounds = bounds; }

    @Override
    public String toString() {
        return switch (kind == null ? Kind.ID : kind) {
            case ID        -> "ID='" + value + "'";
            case TEXT      -> "TEXT='" + value + "'";
            case STRUCTURE -> "STRUCTURE{class~'" + className + "'}";
            case BOUNDS    -> "BOUNDS" + bounds;
        };
    }
}
