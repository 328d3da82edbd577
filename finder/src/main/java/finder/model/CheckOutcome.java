package finder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * The stored value for a (leg, date) pair. {@link Status#NONE_FOUND} means the checker answered and nothing flies;
 * {@link Status#FAILED} means the pair could not be checked and is kept apart for diagnostics.
 */
public record CheckOutcome(Status status, List<CheckedOccurrence> occurrences, String failureReason) {
    public enum Status {
        FOUND,
        NONE_FOUND,
        FAILED
    }

    public CheckOutcome {
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        if (status == Status.FOUND && occurrences.isEmpty()) {
            throw new IllegalArgumentException("FOUND outcome requires at least one occurrence");
        }
    }

    public static CheckOutcome found(List<CheckedOccurrence> occurrences) {
        return occurrences.isEmpty() ? noneFound() : new CheckOutcome(Status.FOUND, occurrences, null);
    }

    public static CheckOutcome noneFound() {
        return new CheckOutcome(Status.NONE_FOUND, List.of(), null);
    }

    public static CheckOutcome failed(String reason) {
        return new CheckOutcome(Status.FAILED, List.of(), reason);
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
