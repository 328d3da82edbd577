package finder;

import finder.model.AirportDirectory;
import finder.model.AvailableItinerary;
import finder.model.CandidateItinerary;
import finder.model.CheckOutcome;
import finder.model.CheckedOccurrence;
import finder.model.Leg;
import finder.model.TripType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Combines checked occurrences back onto candidate itineraries. Occurrences are matched to a leg by the city pair
 * they report, so every date a leg was checked on contributes options. Two-leg itineraries only keep connections
 * whose second departure is not earlier than the first arrival.
 */
public class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final AirportDirectory airports;

    public Reconciler(AirportDirectory airports) {
        this.airports = airports;
    }

    public List<AvailableItinerary> reconcile(List<CandidateItinerary> candidates, ResultStore store) {
        log.info("Processing checked flights to find available flights...");
        Map<CityPair, List<CheckedOccurrence>> occurrences = indexByCityPair(store);

        var itineraries = new LinkedHashSet<AvailableItinerary>();
        for (CandidateItinerary candidate : candidates) {
            List<CheckedOccurrence> firstMatches = matching(occurrences, candidate.first());
            if (firstMatches.isEmpty()) {
                continue;
            }
            List<CheckedOccurrence> secondMatches = candidate.second() == null
                    ? List.of()
                    : matching(occurrences, candidate.second());

            switch (candidate.type()) {
                case DIRECT -> firstMatches.forEach(first -> itineraries.add(AvailableItinerary.of(TripType.DIRECT, first, null)));
                case ONE_STOP -> {
                    if (candidate.second() == null) {
                        firstMatches.forEach(first -> itineraries.add(AvailableItinerary.of(TripType.ONE_STOP, first, null)));
                    } else {
                        addConnections(itineraries, TripType.ONE_STOP, firstMatches, secondMatches);
                    }
                }
                case ROUND_TRIP -> {
                    // An outward flight without a usable return is still reported on its own
                    for (CheckedOccurrence outward : firstMatches) {
                        if (hasValidReturn(outward, secondMatches)) {
                            addConnections(itineraries, TripType.ROUND_TRIP, List.of(outward), secondMatches);
                        } else {
                            itineraries.add(AvailableItinerary.of(TripType.ROUND_TRIP, outward, null));
                        }
                    }
                }
            }
        }

        List<AvailableItinerary> result = new ArrayList<>(itineraries);
        result.sort(null);
        log.info("Found {} available flights from {} candidates", result.size(), candidates.size());
        return result;
    }

    private static void addConnections(LinkedHashSet<AvailableItinerary> out, TripType type,
                                       List<CheckedOccurrence> firsts, List<CheckedOccurrence> seconds) {
        for (CheckedOccurrence first : firsts) {
            for (CheckedOccurrence second : seconds) {
                if (first.connectsTo(second)) {
                    out.add(AvailableItinerary.of(type, first, second));
                }
            }
        }
    }

    private static boolean hasValidReturn(CheckedOccurrence outward, List<CheckedOccurrence> returns) {
        return returns.stream().anyMatch(outward::connectsTo);
    }

    private List<CheckedOccurrence> matching(Map<CityPair, List<CheckedOccurrence>> occurrences, Leg leg) {
        var key = new CityPair(airports.cityOf(leg.origin()), airports.cityOf(leg.destination()));
        return occurrences.getOrDefault(key, List.of());
    }

    private static Map<CityPair, List<CheckedOccurrence>> indexByCityPair(ResultStore store) {
        var index = new HashMap<CityPair, List<CheckedOccurrence>>();
        for (CheckOutcome outcome : store.snapshot().values()) {
            for (CheckedOccurrence occurrence : outcome.occurrences()) {
                var key = new CityPair(occurrence.departure().city(), occurrence.arrival().city());
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(occurrence);
            }
        }
        return index;
    }

    private record CityPair(String departure, String arrival) {
    }
}
