package autoaccept.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * The evidence profile of one known dialog: weighted signals plus the score a
 * snapshot needs to reach before the dialog counts as present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DialogShape {

    @JsonProperty("name")
    private String name;

    @JsonProperty("threshold")
    private int threshold;

    @JsonProperty("signals")
    private List<SignalSpec> signals = new ArrayList<>();

    public DialogShape() {}

    public DialogShape(String name, int threshold, SignalSpec... signals) {
        this.name      = name;
        this.threshold = threshold;
        this.signals   = new ArrayList<>(List.of(signals));
    }

    public String           getName()      { return name; }
    public int              getThreshold() { return threshold; }
    public List<SignalSpec> getSignals()   { return signals; }

    public void setName(String name)                  { this.name = name; }
    public void setThreshold(int threshold)           { this.threshold = threshold; }
    public void setSignals(List<SignalSpec> signals)  { this.signals = signals; }

    /** Highest weight carried by a single signal. */
    public int maxSingleWeight() {
        return signals.stream().mapToInt(SignalSpec::getWeight).max().orElse(0);
    }

    @Override
    public String toString() {
        return String.format("DialogShape{name='%s', threshold=%d, signals=%d}",
                name, threshold, signals.size());
    }
}
