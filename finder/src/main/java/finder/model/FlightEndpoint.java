package finder.model;

import java.time.LocalTime;
import java.time.ZoneOffset;

/** One end of a scheduled flight: local wall-clock time and the UTC offset it is expressed in. */
public record FlightEndpoint(String city, LocalTime time, ZoneOffset utcOffset) {
}
