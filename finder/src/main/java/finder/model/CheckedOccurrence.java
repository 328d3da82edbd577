package finder.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A concrete scheduled flight found for a leg on a specific date. {@code date} is the departure date; the arrival
 * day is derived from {@code duration}.
 */
public record CheckedOccurrence(
        LocalDate date,
        FlightEndpoint departure,
        FlightEndpoint arrival,
        Duration duration,
        String carrier,
        String flightCode,
        String price
) {
    public Instant departureInstant() {
        return date.atTime(departure.time()).atOffset(departure.utcOffset()).toInstant();
    }

    /**
     * The arrival clock time on the day closest to {@code departure + duration}, never before the departure. The
     * arrival day may be earlier than {@code date} when the flight crosses the date line westwards.
     */
    public Instant arrivalInstant() {
        Instant departs = departureInstant();
        if (duration == null) {
            LocalDate arrivalDate = date;
            Instant arrives = arrivalAt(arrivalDate);
            while (arrives.isBefore(departs)) {
                arrivalDate = arrivalDate.plusDays(1);
                arrives = arrivalAt(arrivalDate);
            }
            return arrives;
        }

        Instant expected = departs.plus(duration);
        LocalDate expectedDate = expected.atOffset(arrival.utcOffset()).toLocalDate();
        Instant best = null;
        for (LocalDate day = expectedDate.minusDays(1); !day.isAfter(expectedDate.plusDays(1)); day = day.plusDays(1)) {
            Instant arrives = arrivalAt(day);
            if (arrives.isBefore(departs)) {
                continue;
            }
            if (best == null || Duration.between(arrives, expected).abs().compareTo(Duration.between(best, expected).abs()) < 0) {
                best = arrives;
            }
        }
        return best;
    }

    private Instant arrivalAt(LocalDate day) {
        return day.atTime(arrival.time()).atOffset(arrival.utcOffset()).toInstant();
    }

    public boolean connectsTo(CheckedOccurrence next) {
        return !next.departureInstant().isBefore(arrivalInstant());
    }
}
