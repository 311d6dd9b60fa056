package autoaccept.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog of every UI target role and dialog shape the automation knows about.
 *
 * <p>UI identifiers and captions drift between application versions, locales
 * and devices, so they live here as data instead of in code. A new variant is
 * supported by adding a matcher to the JSON file, not by adding a code path.
 *
 * <p>Default catalog: the classpath resource {@code ui-targets.json}. An
 * external file with the same layout can be merged on top of it; same-named
 * entries in the external file replace the defaults.
 *
 * <pre>{@code
 * {
 *   "schemaVersion": "1.0",
 *   "targets": { "accept-button": { "escalate": false, "matchers": [ ... ] } },
 *   "shapes":  { "incoming-connection": { "threshold": 4, "signals": [ ... ] } }
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TargetCatalog {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";
    public static final String DEFAULT_RESOURCE       = "ui-targets.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @JsonProperty("schemaVersion")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    @JsonProperty("description")
    private String description;

    @JsonProperty("targets")
    private Map<String, TargetSpec> targets = new LinkedHashMap<>();

    @JsonProperty("shapes")
    private Map<String, DialogShape> shapes = new LinkedHashMap<>();

    // ── Factory ───────────────────────────────────────────────────────────

    public static TargetCatalog empty() {
        return new TargetCatalog();
    }

    /**
     * Loads a catalog from a JSON file.
     * @throws IOException if the file cannot be read or is malformed
     */
    public static TargetCatalog load(Path path) throws IOException {
        return normalise(MAPPER.readValue(path.toFile(), TargetCatalog.class));
    }

    /**
     * Loads a catalog from a classpath resource.
     * @throws AutoAcceptException if the resource is missing or malformed
     */
    public static TargetCatalog fromClasspath(String resource) {
        try (InputStream in = TargetCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new AutoAcceptException("Classpath resource not found: " + resource);
            }
            return normalise(MAPPER.readValue(in, TargetCatalog.class));
        } catch (IOException e) {
            throw new AutoAcceptException("Cannot parse target catalog " + resource, e);
        }
    }

    /** Map keys are authoritative; copy them into entries that omit a name. */
    private static TargetCatalog normalise(TargetCatalog catalog) {
        catalog.targets.forEach((key, spec) -> { if (spec.getName() == null) spec.setName(key); });
        catalog.shapes.forEach((key, shape) -> { if (shape.getName() == null) shape.setName(key); });
        return catalog;
    }

    // ── Lookup ────────────────────────────────────────────────────────────

    /**
     * Returns the named target role.
     * @throws AutoAcceptException if the role is not in the catalog
     */
    public TargetSpec target(String role) {
        TargetSpec spec = targets.get(role);
        if (spec == null) {
            throw new AutoAcceptException("Unknown target role: '" + role + "'. Known: " + targets.keySet());
        }
        return spec;
    }

    /**
     * Returns the named dialog shape.
     * @throws AutoAcceptException if the shape is not in the catalog
     */
    public DialogShape shape(String name) {
        DialogShape shape = shapes.get(name);
        if (shape == null) {
            throw new AutoAcceptException("Unknown dialog shape: '" + name + "'. Known: " + shapes.keySet());
        }
        return shape;
    }

    public boolean hasTarget(String role) {
        return targets.containsKey(role);
    }

    public void addTarget(TargetSpec spec) {
        targets.put(spec.getName(), spec);
    }

    public void addShape(DialogShape shape) {
        shapes.put(shape.getName(), shape);
    }

    /**
     * Merges another catalog into this one; entries in {@code other} replace
     * same-named entries here.
     *
     * @return number of entries added or replaced
     */
    public int merge(TargetCatalog other) {
        int count = 0;
        for (TargetSpec spec : other.targets.values()) {
            targets.put(spec.getName(), spec);
            count++;
        }
        for (DialogShape shape : other.shapes.values()) {
            shapes.put(shape.getName(), shape);
            count++;
        }
        return count;
    }

    /**
     * Checks that every entry can be evaluated and that detection is safe.
     *
     * <ul>
     *   <li>every target has at least one matcher;</li>
     *   <li>every matcher has a kind and the field that kind needs
     *       ({@code value} for ID and TEXT, {@code bounds} for BOUNDS, a class,
     *       child text or child count for STRUCTURE);</li>
     *   <li>every signal has matchers or targets, and its targets are known roles;</li>
     *   <li>no single signal may reach a shape's threshold on its own;</li>
     *   <li>every flow step has its shape.</li>
     * </ul>
     *
     * @return this catalog, for chaining
     * @throws AutoAcceptException on the first violation found
     */
    public TargetCatalog validate() {
        for (TargetSpec target : targets.values()) {
            List<MatcherSpec> matchers = target.getMatchers();
            if (matchers == null || matchers.isEmpty()) {
                throw new AutoAcceptException("Target '" + target.getName() + "' has no matchers");
            }
            checkMatchers("target '" + target.getName() + "'", matchers);
        }
        for (DialogShape shape : shapes.values()) {
            if (shape.getSignals() == null || shape.getSignals().isEmpty()) {
                throw new AutoAcceptException("Shape '" + shape.getName() + "' has no signals");
            }
            if (shape.getThreshold() <= shape.maxSingleWeight()) {
                throw new AutoAcceptException(String.format(
                        "Shape '%s' can be confirmed by a single signal (threshold %d, max weight %d)",
                        shape.getName(), shape.getThreshold(), shape.maxSingleWeight()));
            }
            for (SignalSpec signal : shape.getSignals()) {
                String owner = String.format("signal '%s' of shape '%s'", signal.getName(), shape.getName());
                if (signal.getMatchers().isEmpty() && signal.getTargets().isEmpty()) {
                    throw new AutoAcceptException("Empty " + owner + ": it needs matchers or targets");
                }
                checkMatchers(owner, signal.getMatchers());
                for (String role : signal.getTargets()) {
                    if (!targets.containsKey(role)) {
                        throw new AutoAcceptException(String.format(
                                "Signal '%s' of shape '%s' references unknown target '%s'",
                                signal.getName(), shape.getName(), role));
                    }
                }
            }
        }
        for (FlowStep step : FlowStep.values()) {
            if (!shapes.containsKey(step.shapeName())) {
                throw new AutoAcceptException(String.format(
                        "No shape '%s' for flow step %s", step.shapeName(), step));
            }
        }
        return this;
    }

    private static void checkMatchers(String owner, List<MatcherSpec> matchers) {
        for (int i = 0; i < matchers.size(); i++) {
            MatcherSpec m = matchers.get(i);
            String problem = problemWith(m);
            if (problem != null) {
                throw new AutoAcceptException(String.format("Matcher %d of %s %s: %s", i, owner, problem, m));
            }
        }
    }

    private static String problemWith(MatcherSpec m) {
        if (m == null || m.getKind() == null) {
            return "has no kind";
        }
        return switch (m.getKind()) {
            case ID, TEXT  -> m.getValue() == null || m.getValue().isBlank() ? "needs a value" : null;
            case BOUNDS    -> m.getBounds() == null ? "needs bounds" : null;
            case STRUCTURE -> m.getClassName() == null && m.getChildText() == null && m.getChildCount() == null
                    ? "needs a className, childText or childCount" : null;
        };
    }

    @JsonIgnore
    public int size() {
        return targets.size() + shapes.size();
    }

    // ── Getters / Setters ─────────────────────────────────────────────────

    public String                   getSchemaVersion()  { return schemaVersion; }
    public void                     setSchemaVersion(String v) { this.schemaVersion = v; }
    public String                   getDescription()    { return description; }
    public void                     setDescription(String d) { this.description = d; }
    public Map<String, TargetSpec>  getTargets()        { return targets; }
    public void                     setTargets(Map<String, TargetSpec> t) { this.targets = t; }
    public Map<String, DialogShape> getShapes()         { return shapes; }
    public void                     setShapes(Map<String, DialogShape> s) { this.shapes = s; }
}
