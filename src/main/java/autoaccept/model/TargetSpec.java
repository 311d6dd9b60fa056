package autoaccept.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A named interactive role (for example {@code "accept-button"}) with the
 * ordered matcher chain used to find it. First matcher that yields a node wins.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TargetSpec {

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    /** Whether the click may escalate to long-press, focus and parent delegation. */
    @JsonProperty("escalate")
    private boolean escalate;

    @JsonProperty("matchers")
    private List<MatcherSpec> matchers = new ArrayList<>();

    public TargetSpec() {}

    public TargetSpec(String name, boolean escalate, MatcherSpec... matchers) {
        this.name     = name;
        this.escalate = escalate;
        this.matchers = new ArrayList<>(List.of(matchers));
    }

    public String            getName()        { return name; }
    public String            getDescription() { return description; }
    public boolean           isEscalate()     { return escalate; }
    public List<MatcherSpec> getMatchers()    { return matchers; }

    public void setName(String name)                      { this.name = name; }
    public void setDescription(String description)        { this.description = description; }
    public void setEscalate(boolean escalate)             { this.escalate = escalate; }
    public void setMatchers(List<MatcherSpec> matchers)   { this.matchers = matchers; }

    @Override
    public String toString() {
        return String.format("TargetSpec{name='%s', matchers=%d}", name, matchers.size());
    }
}
