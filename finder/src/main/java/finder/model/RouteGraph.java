package finder.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import finder.FinderConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only adjacency map from an airport code to the airport codes reachable with a direct flight. Airports that
 * only ever appear as a destination are still part of the graph.
 */
public final class RouteGraph {
    private final Map<String, Set<String>> connections;
    private final Set<String> airports;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public RouteGraph(Map<String, ? extends Collection<String>> connections) {
        var copy = new LinkedHashMap<String, Set<String>>();
        var all = new LinkedHashSet<String>();
        connections.forEach((origin, destinations) -> {
            var reachable = new LinkedHashSet<>(destinations);
            copy.put(origin, Collections.unmodifiableSet(reachable));
            all.add(origin);
            all.addAll(reachable);
        });
        this.connections = copy;
        this.airports = all;
    }

    @JsonValue
    Map<String, List<String>> toJson() {
        var out = new LinkedHashMap<String, List<String>>();
        connections.forEach((origin, destinations) -> out.put(origin, destinations.stream().sorted().toList()));
        return out;
    }

    public Set<String> airports() {
        return Collections.unmodifiableSet(airports);
    }

    public boolean contains(String airport) {
        return airports.contains(airport);
    }

    public boolean isEmpty() {
        return connections.values().stream().allMatch(Set::isEmpty);
    }

    /** Airports reachable directly from {@code airport}; empty for unknown airports or airports without departures. */
    public Set<String> destinationsOf(String airport) {
        return connections.getOrDefault(airport, Set.of());
    }

    /** Fails with every code in {@code codes} the graph does not know, sorted. */
    public void requireKnown(Collection<String> codes) {
        var unknown = new TreeSet<String>();
        for (String code : codes) {
            if (!contains(code)) {
                unknown.add(code);
            }
        }
        if (!unknown.isEmpty()) {
            throw new FinderConfigurationException("Unknown airport(s): " + String.join(", ", unknown));
        }
    }
}
