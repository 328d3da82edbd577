package finder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * An enumerated, not yet verified trip. For {@link TripType#ROUND_TRIP} the first leg is the outward flight and
 * the second leg the return flight, which may be absent.
 */
public record CandidateItinerary(TripType type, Leg first, Leg second) {
    public CandidateItinerary {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(first, "first");
        if (type == TripType.DIRECT && second != null) {
            throw new IllegalArgumentException("Direct itinerary cannot have a second leg: " + second);
        }
        if (second != null && !first.connectsTo(second)) {
            throw new IllegalArgumentException("Leg " + first + " does not connect to " + second);
        }
    }

    public static CandidateItinerary direct(Leg leg) {
        return new CandidateItinerary(TripType.DIRECT, leg, null);
    }

    public static CandidateItinerary oneStop(Leg first, Leg second) {
        return new CandidateItinerary(TripType.ONE_STOP, first, second);
    }

    public static CandidateItinerary roundTrip(Leg outward, Leg inbound) {
        return new CandidateItinerary(TripType.ROUND_TRIP, outward, inbound);
    }

    @JsonIgnore
    public Stream<Leg> legs() {
        return second == null ? Stream.of(first) : Stream.of(first, second);
    }
}
