package finder.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Airport code to the city name the availability checker reports for it. Codes without an entry stand for
 * themselves.
 */
public final class AirportDirectory {
    private static final AirportDirectory IDENTITY = new AirportDirectory(Map.of());

    private final Map<String, String> cities;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AirportDirectory(Map<String, String> cities) {
        this.cities = Map.copyOf(cities);
    }

    public static AirportDirectory identity() {
        return IDENTITY;
    }

    public String cityOf(String airport) {
        return cities.getOrDefault(airport, airport);
    }

    @JsonValue
    Map<String, String> cities() {
        return cities;
    }
}
