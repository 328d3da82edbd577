package finder;

import finder.model.CandidateItinerary;
import finder.model.Leg;
import finder.model.RouteGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Enumerates the direct, one-stop and round-trip itineraries a {@link RouteGraph} makes possible. Nothing is checked
 * here; candidates only say which legs are worth asking the availability checker about.
 */
public class ItineraryEnumerator {
    private static final Logger log = LoggerFactory.getLogger(ItineraryEnumerator.class);

    private final RouteGraph graph;
    private final FinderConfig config;
    private final Map<String, Leg> legs = new HashMap<>();

    public ItineraryEnumerator(RouteGraph graph, FinderConfig config) {
        this.graph = graph;
        this.config = config;
    }

    /** Direct (and, for {@code maxStops >= 1}, one-stop) candidates from any departure to any destination airport. */
    public List<CandidateItinerary> enumerateOneStop(Collection<String> departureAirports,
                                                     Collection<String> destinationAirports,
                                                     int maxStops) {
        Set<String> departures = resolveAirports("departure", departureAirports);
        Set<String> destinations = resolveAirports("destination", destinationAirports);
        if (maxStops < 0) {
            throw new FinderConfigurationException("maxStops must not be negative (got " + maxStops + ")");
        }
        if (maxStops > 1) {
            log.warn("maxStops {} is not supported, searching with at most one stop", maxStops);
            maxStops = 1;
        }

        var candidates = new ArrayList<CandidateItinerary>();
        for (String departure : departures) {
            Set<String> visited = new HashSet<>();
            visited.add(departure);
            ArrayDeque<Hop> queue = new ArrayDeque<>();
            queue.add(new Hop(departure, 0));

            while (!queue.isEmpty()) {
                Hop hop = queue.poll();
                for (String reached : graph.destinationsOf(hop.airport())) {
                    if (hop.depth() == 0) {
                        if (reached.equals(departure)) {
                            continue;
                        }
                        if (destinations.contains(reached)) {
                            candidates.add(CandidateItinerary.direct(leg(departure, reached)));
                        }
                        if (maxStops > 0 && visited.add(reached)) {
                            queue.add(new Hop(reached, 1));
                        }
                    } else if (destinations.contains(reached) && !reached.equals(departure)
                            && !reached.equals(hop.airport())) {
                        candidates.add(CandidateItinerary.oneStop(leg(departure, hop.airport()), leg(hop.airport(), reached)));
                    }
                }
            }
        }

        log.info("Found {} possible flights (direct and one-stop) from {} departure airports with max stops {}",
                candidates.size(), departures.size(), maxStops);
        log.info("Estimated checking time: {}", Durations.format(estimateCheckingTime(candidates, config.days())));
        return candidates;
    }

    public List<CandidateItinerary> enumerateRoundTrip(Collection<String> departureAirports) {
        return enumerateRoundTrip(departureAirports, List.of());
    }

    /**
     * Round trips A -> D -> B where both legs are direct flights and B is one of the departure airports (not
     * necessarily A).
     */
    public List<CandidateItinerary> enumerateRoundTrip(Collection<String> departureAirports,
                                                       Collection<String> destinationAirports) {
        Set<String> departures = resolveAirports("departure", departureAirports);
        Set<String> destinations = resolveAirports("destination", destinationAirports);

        var candidates = new ArrayList<CandidateItinerary>();
        for (String airport : departures) {
            int before = candidates.size();
            for (String destination : graph.destinationsOf(airport)) {
                if (!destinations.contains(destination) || destination.equals(airport)) {
                    continue;
                }
                for (String back : graph.destinationsOf(destination)) {
                    if (departures.contains(back)) {
                        candidates.add(CandidateItinerary.roundTrip(leg(airport, destination), leg(destination, back)));
                    }
                }
            }
            log.debug("Found {} possible round trips from {}", candidates.size() - before, airport);
        }

        log.info("Found a total of {} possible round trips from {} departure airports", candidates.size(), departures.size());
        log.info("Estimated checking time: {}", Durations.format(estimateCheckingTime(candidates, config.days())));
        return candidates;
    }

    /** Every leg referenced by {@code candidates}, once, in the order first seen. */
    public static List<Leg> distinctLegs(Collection<CandidateItinerary> candidates) {
        var byHash = new LinkedHashMap<String, Leg>();
        for (CandidateItinerary candidate : candidates) {
            candidate.legs().forEach(leg -> byHash.putIfAbsent(leg.hash(), leg));
        }
        return List.copyOf(byHash.values());
    }

    /** Rough wall-clock estimate for checking every distinct leg on {@code days} dates. For user feedback only. */
    public Duration estimateCheckingTime(Collection<CandidateItinerary> candidates, int days) {
        int uniqueLegs = distinctLegs(candidates).size();
        return config.estimatedCheckTime().multipliedBy((long) uniqueLegs * days).plus(config.estimatedSetupTime());
    }

    private Leg leg(String origin, String destination) {
        return legs.computeIfAbsent(Leg.hashOf(origin, destination), h -> new Leg(origin, destination));
    }

    private Set<String> resolveAirports(String role, Collection<String> requested) {
        if (graph.isEmpty()) {
            throw new FinderConfigurationException("Route graph is empty");
        }
        if (requested == null || requested.isEmpty()) {
            return new TreeSet<>(graph.airports());
        }
        log.debug("Resolving {} airports {}", role, requested);
        graph.requireKnown(requested);
        return new LinkedHashSet<>(requested);
    }

    private record Hop(String airport, int depth) {
    }
}
