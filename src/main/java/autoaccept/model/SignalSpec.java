package autoaccept.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One independently observable fact about a dialog, with its weight.
 *
 * <p>The signal holds when any of its {@code matchers} finds a node (first match
 * wins) or, if {@code targets} is set, when every named target role can be
 * located in the same snapshot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalSpec {

    @JsonProperty("name")
    private String name;

    @JsonProperty("weight")
    private int weight;

    @JsonProperty("matchers")
    private List<MatcherSpec> matchers = new ArrayList<>();

    @JsonProperty("targets")
    private List<String> targets = new ArrayList<>();

    public SignalSpec() {}

    public SignalSpec(String name, int weight) {
        this.name   = name;
        this.weight = weight;
    }

    public static SignalSpec anyOf(String name, int weight, MatcherSpec... matchers) {
        SignalSpec s = new SignalSpec(name, weight);
        s.setMatchers(new ArrayList<>(List.of(matchers)));
        return s;
    }

    public static SignalSpec allTargets(String name, int weight, String... roles) {
        SignalSpec s = new SignalSpec(name, weight);
        s.setTargets(new ArrayList<>(List.of(roles)));
        return s;
    }

    public String            getName()     { return name; }
    public int               getWeight()   { return weight; }
    public List<MatcherSpec> getMatchers() { return matchers; }
    public List<String>      getTargets()  { return targets; }

    public void setName(String name)                    { this.name = name; }
    public void setWeight(int weight)                   { this.weight = weight; }
    public void setMatchers(List<MatcherSpec> matchers) { this.matchers = matchers != null ? matchers : new ArrayList<>(); }
    public void setTargets(List<String> targets)        { this.targets = targets != null ? targets : new ArrayList<>(); }

    @Override
    public String toString() {
        return "SignalSpec{" + name + " +" + weight + "}";
    }
}
