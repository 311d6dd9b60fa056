package autoaccept.model;

import java.util.List;

/**
 * Result of classifying one snapshot against one {@link DialogShape}.
 * Transient: consumed by the flow state machine in the same cycle.
 *
 * @param shape     name of the shape that was scored
 * @param score     sum of the weights of the signals that held
 * @param threshold score needed for {@link #isConfirmed()}
 * @param signals   names of the signals that held, in evaluation order
 */
public record EvidenceReport(String shape, int score, int threshold, List<String> signals) {

    public EvidenceReport {
        signals = List.copyOf(signals);
    }

    public boolean isConfirmed() {
        return score >= threshold;
    }

    public boolean has(String signal) {
        return signals.contains(signal);
    }

    @Override
    public String toString() {
        return String.format("EvidenceReport{%s score=%d/%d %s}", shape, score, threshold, signals);
    }
}
