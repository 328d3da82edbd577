package finder.model;

import java.util.List;

/** What a single availability check answered. */
public sealed interface CheckResult permits CheckResult.Occurrences, CheckResult.NoneFound, CheckResult.TransientFailure {

    static CheckResult of(List<CheckedOccurrence> occurrences) {
        return occurrences == null || occurrences.isEmpty() ? new NoneFound() : new Occurrences(occurrences);
    }

    record Occurrences(List<CheckedOccurrence> occurrences) implements CheckResult {
        public Occurrences {
            occurrences = List.copyOf(occurrences);
        }
    }

    record NoneFound() implements CheckResult {
    }

    record TransientFailure(String reason) implements CheckResult {
    }
}
