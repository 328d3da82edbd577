package finder;

import finder.model.AirportDirectory;
import finder.model.CheckResult;
import finder.model.Leg;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.json.JsonMapper;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static finder.Flights.DAY;
import static finder.Flights.flight;
import static org.junit.jupiter.api.Assertions.*;

class RecordedAvailabilityCheckerTest {
    @TempDir
    Path dir;

    private final AirportDirectory airports = new AirportDirectory(Map.of("BUD", "Budapest", "DXB", "Dubai"));

    @Test
    void answersFromRecordedFlights() {
        var morning = flight("Budapest", "08:00", "Dubai", "16:00");
        var evening = flight("Budapest", "20:00", "Dubai", "04:00");
        var otherDay = flight(DAY.plusDays(1), "Budapest", "08:00", "Dubai", "16:00");
        var subject = new RecordedAvailabilityChecker(List.of(morning, evening, otherDay), airports);

        assertEquals(new CheckResult.Occurrences(List.of(morning, evening)), subject.check(new Leg("BUD", "DXB"), DAY));
        assertEquals(new CheckResult.NoneFound(), subject.check(new Leg("DXB", "BUD"), DAY));
    }

    @Test
    void providerIsFoundByName() throws Exception {
        File file = dir.resolve("flights.json").toFile();
        var recorded = flight("Budapest", "08:00", "Dubai", "16:00");
        new JsonMapper().writeValue(file, List.of(recorded));
        var config = FinderConfig.builder().recordedFlights(file.getPath()).build();

        CheckerFactory factory = AvailabilityCheckerProvider.named("recorded").create(config, airports);

        try (AvailabilityChecker checker = factory.open()) {
            checker.resetSession();
            assertEquals(new CheckResult.Occurrences(List.of(recorded)), checker.check(new Leg("BUD", "DXB"), DAY));
        }
    }

    @Test
    void unknownProviderIsAConfigurationError() {
        assertThrows(FinderConfigurationException.class, () -> AvailabilityCheckerProvider.named("selenium"));
    }

    @Test
    void recordedProviderNeedsAFile() {
        var provider = new RecordedAvailabilityChecker.Provider();

        assertThrows(FinderConfigurationException.class, () -> provider.create(FinderConfig.defaults(), airports));
    }
}
