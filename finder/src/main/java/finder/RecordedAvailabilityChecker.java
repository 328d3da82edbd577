package finder;

import finder.model.AirportDirectory;
import finder.model.CheckResult;
import finder.model.CheckedOccurrence;
import finder.model.Leg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.io.File;
import java.time.LocalDate;
import java.util.List;

/**
 * Answers checks from flights captured earlier, for offline replays of a search. A leg matches a recorded flight
 * when the departure date and both cities agree.
 */
public class RecordedAvailabilityChecker implements AvailabilityChecker {
    private static final Logger log = LoggerFactory.getLogger(RecordedAvailabilityChecker.class);

    private final List<CheckedOccurrence> flights;
    private final AirportDirectory airports;

    public RecordedAvailabilityChecker(List<CheckedOccurrence> flights, AirportDirectory airports) {
        this.flights = List.copyOf(flights);
        this.airports = airports;
    }

    @Override
    public CheckResult check(Leg leg, LocalDate date) {
        String from = airports.cityOf(leg.origin());
        String to = airports.cityOf(leg.destination());
        List<CheckedOccurrence> matches = flights.stream()
                .filter(f -> f.date().equals(date))
                .filter(f -> f.departure().city().equals(from) && f.arrival().city().equals(to))
                .toList();
        log.debug("{} recorded flights for {} on {}", matches.size(), leg, date);
        return CheckResult.of(matches);
    }

    @Override
    public void resetSession() {
        // nothing to refresh
    }

    @Override
    public void close() {
    }

    public static class Provider implements AvailabilityCheckerProvider {
        private static final JsonMapper jsonMapper = new JsonMapper();

        @Override
        public String name() {
            return "recorded";
        }

        @Override
        public CheckerFactory create(FinderConfig config, AirportDirectory airports) {
            if (config.recordedFlights() == null) {
                throw new FinderConfigurationException("The recorded checker needs 'recordedFlights' to be set");
            }
            File file = new File(config.recordedFlights());
            List<CheckedOccurrence> flights;
            try {
                flights = jsonMapper.readValue(file, new TypeReference<>() {
                });
            } catch (JacksonException e) {
                throw new FinderConfigurationException("Cannot read recorded flights " + file + ": " + e.getOriginalMessage(), e);
            }
            log.info("Read {} ({} recorded flights)", file, flights.size());
            return () -> new RecordedAvailabilityChecker(flights, airports);
        }
    }
}
