package finder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A checked itinerary ready for reporting. For {@link TripType#ROUND_TRIP} {@code firstLeg} holds the outward
 * flight and {@code secondLeg} the return flight; {@code secondLeg} is null when there is none.
 */
public record AvailableItinerary(
        TripType type,
        List<CheckedOccurrence> firstLeg,
        List<CheckedOccurrence> secondLeg
) implements Comparable<AvailableItinerary> {
    public AvailableItinerary {
        Objects.requireNonNull(type, "type");
        firstLeg = List.copyOf(firstLeg);
        secondLeg = secondLeg == null ? null : List.copyOf(secondLeg);
    }

    public static AvailableItinerary of(TripType type, CheckedOccurrence first, CheckedOccurrence second) {
        return new AvailableItinerary(type, List.of(first), second == null ? null : List.of(second));
    }

    @JsonIgnore
    public List<CheckedOccurrence> outward() {
        return firstLeg;
    }

    @JsonIgnore
    public List<CheckedOccurrence> inbound() {
        return secondLeg;
    }

    @JsonIgnore
    public Instant departureInstant() {
        return firstLeg.get(0).departureInstant();
    }

    /** Wait between arriving on the first leg and departing on the second, or null for single-leg itineraries. */
    @JsonProperty
    public Duration getLayover() {
        if (secondLeg == null) {
            return null;
        }
        return Duration.between(firstLeg.get(firstLeg.size() - 1).arrivalInstant(), secondLeg.get(0).departureInstant());
    }

    /** Door-to-door time for one-way trips; for round trips only the outward journey counts. */
    @JsonProperty
    public Duration getTravelTime() {
        List<CheckedOccurrence> last = secondLeg == null || type == TripType.ROUND_TRIP ? firstLeg : secondLeg;
        return Duration.between(departureInstant(), last.get(last.size() - 1).arrivalInstant());
    }

    @Override
    public int compareTo(AvailableItinerary o) {
        return departureInstant().compareTo(o.departureInstant());
    }
}
