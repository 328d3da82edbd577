package finder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for one finder run. Every field may be omitted from the JSON file and falls back to the default noted
 * next to it.
 */
public record FinderConfig(
        TripMode mode,                  // ONE_WAY
        Integer maxStops,               // 1, anything above is clamped to 1
        List<String> departureAirports, // empty = every airport in the route graph
        List<String> destinationAirports, // empty = every airport in the route graph
        LocalDate firstDate,            // today
        Integer days,                   // 4
        ZoneId zone,                    // Europe/Berlin
        Integer workers,                // 4
        Integer maxAttempts,            // 3
        Duration retryBackoff,          // 1s, doubled on every further attempt
        Duration checkTimeout,          // 60s
        PacingScope pacingScope,        // RUN
        Integer pacingThreshold,        // 40
        Duration coolDown,              // 30s
        Duration progressInterval,      // 60s
        Duration estimatedCheckTime,    // 5s
        Duration estimatedSetupTime,    // 20s
        String checker,                 // recorded
        String recordedFlights,
        String airportCities
) {
    private static final Logger log = LoggerFactory.getLogger(FinderConfig.class);

    public FinderConfig {
        mode = mode == null ? TripMode.ONE_WAY : mode;
        maxStops = maxStops == null ? 1 : maxStops;
        departureAirports = departureAirports == null ? List.of() : List.copyOf(departureAirports);
        destinationAirports = destinationAirports == null ? List.of() : List.copyOf(destinationAirports);
        days = days == null ? 4 : days;
        zone = zone == null ? ZoneId.of("Europe/Berlin") : zone;
        workers = workers == null ? 4 : workers;
        maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        retryBackoff = retryBackoff == null ? Duration.ofSeconds(1) : retryBackoff;
        checkTimeout = checkTimeout == null ? Duration.ofSeconds(60) : checkTimeout;
        pacingScope = pacingScope == null ? PacingScope.RUN : pacingScope;
        pacingThreshold = pacingThreshold == null ? 40 : pacingThreshold;
        coolDown = coolDown == null ? Duration.ofSeconds(30) : coolDown;
        progressInterval = progressInterval == null ? Duration.ofSeconds(60) : progressInterval;
        estimatedCheckTime = estimatedCheckTime == null ? Duration.ofSeconds(5) : estimatedCheckTime;
        estimatedSetupTime = estimatedSetupTime == null ? Duration.ofSeconds(20) : estimatedSetupTime;
        checker = checker == null ? "recorded" : checker;
    }

    public static FinderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(new FinderConfig(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null));
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static FinderConfig read(File file, JsonMapper jsonMapper) {
        FinderConfig config;
        try {
            config = jsonMapper.readValue(file, FinderConfig.class);
        } catch (JacksonException e) {
            throw new FinderConfigurationException("Cannot read configuration " + file + ": " + e.getOriginalMessage(), e);
        }
        return config.validated();
    }

    /** Checks every value and clamps {@code maxStops}; throws {@link FinderConfigurationException} on the first problem. */
    public FinderConfig validated() {
        var problems = new ArrayList<String>();
        if (maxStops < 0) {
            problems.add("maxStops must not be negative (got " + maxStops + ")");
        }
        requirePositive(problems, "days", days);
        requirePositive(problems, "workers", workers);
        requirePositive(problems, "maxAttempts", maxAttempts);
        requirePositive(problems, "pacingThreshold", pacingThreshold);
        requireNonNegative(problems, "retryBackoff", retryBackoff);
        requireNonNegative(problems, "checkTimeout", checkTimeout);
        requireNonNegative(problems, "coolDown", coolDown);
        requireNonNegative(problems, "progressInterval", progressInterval);
        requireNonNegative(problems, "estimatedCheckTime", estimatedCheckTime);
        requireNonNegative(problems, "estimatedSetupTime", estimatedSetupTime);
        if (checkTimeout.isZero()) {
            problems.add("checkTimeout must be positive");
        }
        if (!problems.isEmpty()) {
            throw new FinderConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
        if (maxStops > 1) {
            log.warn("maxStops {} is not supported, searching with at most one stop", maxStops);
            return toBuilder().maxStops(1).build();
        }
        return this;
    }

    private static void requirePositive(List<String> problems, String name, int value) {
        if (value < 1) {
            problems.add(name + " must be at least 1 (got " + value + ")");
        }
    }

    private static void requireNonNegative(List<String> problems, String name, Duration value) {
        if (value.isNegative()) {
            problems.add(name + " must not be negative (got " + value + ")");
        }
    }

    /** The consecutive calendar days every leg is checked on. */
    public List<LocalDate> checkDates(Clock clock) {
        LocalDate start = firstDate != null ? firstDate : LocalDate.now(clock.withZone(zone));
        var dates = new ArrayList<LocalDate>(days);
        for (int i = 0; i < days; i++) {
            dates.add(start.plusDays(i));
        }
        return dates;
    }

    public static final class Builder {
        private TripMode mode;
        private Integer maxStops;
        private List<String> departureAirports;
        private List<String> destinationAirports;
        private LocalDate firstDate;
        private Integer days;
        private ZoneId zone;
        private Integer workers;
        private Integer maxAttempts;
        private Duration retryBackoff;
        private Duration checkTimeout;
        private PacingScope pacingScope;
        private Integer pacingThreshold;
        private Duration coolDown;
        private Duration progressInterval;
        private Duration estimatedCheckTime;
        private Duration estimatedSetupTime;
        private String checker;
        private String recordedFlights;
        private String airportCities;

        private Builder(FinderConfig c) {
            mode = c.mode;
            maxStops = c.maxStops;
            departureAirports = c.departureAirports;
            destinationAirports = c.destinationAirports;
            firstDate = c.firstDate;
            days = c.days;
            zone = c.zone;
            workers = c.workers;
            maxAttempts = c.maxAttempts;
            retryBackoff = c.retryBackoff;
            checkTimeout = c.checkTimeout;
            pacingScope = c.pacingScope;
            pacingThreshold = c.pacingThreshold;
            coolDown = c.coolDown;
            progressInterval = c.progressInterval;
            estimatedCheckTime = c.estimatedCheckTime;
            estimatedSetupTime = c.estimatedSetupTime;
            checker = c.checker;
            recordedFlights = c.recordedFlights;
            airportCities = c.airportCities;
        }

        public Builder mode(TripMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder maxStops(int maxStops) {
            this.maxStops = maxStops;
            return this;
        }

        public Builder departureAirports(List<String> departureAirports) {
            this.departureAirports = departureAirports;
            return this;
        }

        public Builder destinationAirports(List<String> destinationAirports) {
            this.destinationAirports = destinationAirports;
            return this;
        }

        public Builder firstDate(LocalDate firstDate) {
            this.firstDate = firstDate;
            return this;
        }

        public Builder days(int days) {
            this.days = days;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder checkTimeout(Duration checkTimeout) {
            this.checkTimeout = checkTimeout;
            return this;
        }

        public Builder pacing(PacingScope scope, int threshold) {
            this.pacingScope = scope;
            this.pacingThreshold = threshold;
            return this;
        }

        public Builder coolDown(Duration coolDown) {
            this.coolDown = coolDown;
            return this;
        }

        public Builder progressInterval(Duration progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder estimates(Duration perCheck, Duration setup) {
            this.estimatedCheckTime = perCheck;
            this.estimatedSetupTime = setup;
            return this;
        }

        public Builder checker(String checker) {
            this.checker = checker;
            return this;
        }

        public Builder recordedFlights(String recordedFlights) {
            this.recordedFlights = recordedFlights;
            return this;
        }

        public Builder airportCities(String airportCities) {
            this.airportCities = airportCities;
            return this;
        }

        public FinderConfig build() {
            return new FinderConfig(mode, maxStops, departureAirports, destinationAirports, firstDate, days, zone,
                    workers, maxAttempts, retryBackoff, checkTimeout, pacingScope, pacingThreshold, coolDown,
                    progressInterval, estimatedCheckTime, estimatedSetupTime, checker, recordedFlights, airportCities);
        }
    }
}
