package finder.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/** Aggregate outcome of one check run. */
public record RunReport(
        int totalPairs,
        int checked,
        int skipped,
        int found,
        int noneFound,
        int failed,
        List<CheckFailure> failures,
        Duration elapsed
) {
    public RunReport {
        failures = List.copyOf(failures);
    }

    /** Number of distinct legs that have at least one date which could not be checked. */
    @JsonProperty
    public long getIncompleteLegs() {
        return failures.stream().map(f -> f.key().legHash()).distinct().count();
    }

    @JsonProperty
    public boolean isComplete() {
        return failed == 0;
    }
}
