package finder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.json.JsonMapper;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FinderConfigTest {
    @TempDir
    Path dir;

    private final JsonMapper jsonMapper = new JsonMapper();

    @Test
    void emptyFileGivesDefaults() throws Exception {
        File file = dir.resolve("config.json").toFile();
        Files.writeString(file.toPath(), "{}");

        var config = FinderConfig.read(file, jsonMapper);

        assertEquals(TripMode.ONE_WAY, config.mode());
        assertEquals(1, config.maxStops());
        assertEquals(List.of(), config.departureAirports());
        assertEquals(4, config.days());
        assertEquals(4, config.workers());
        assertEquals(3, config.maxAttempts());
        assertEquals(PacingScope.RUN, config.pacingScope());
        assertEquals(40, config.pacingThreshold());
        assertEquals(Duration.ofSeconds(30), config.coolDown());
        assertEquals("recorded", config.checker());
    }

    @Test
    void readsEveryKindOfValue() throws Exception {
        File file = dir.resolve("config.json").toFile();
        Files.writeString(file.toPath(), """
                {
                  "mode": "ROUND_TRIP",
                  "departureAirports": ["BUD", "VIE"],
                  "firstDate": "2025-04-20",
                  "days": 2,
                  "zone": "Europe/Budapest",
                  "workers": 2,
                  "coolDown": "PT10S",
                  "pacingScope": "WORKER",
                  "pacingThreshold": 12,
                  "recordedFlights": "flights.json"
                }
                """);

        var config = FinderConfig.read(file, jsonMapper);

        assertEquals(TripMode.ROUND_TRIP, config.mode());
        assertEquals(List.of("BUD", "VIE"), config.departureAirports());
        assertEquals(ZoneId.of("Europe/Budapest"), config.zone());
        assertEquals(Duration.ofSeconds(10), config.coolDown());
        assertEquals(PacingScope.WORKER, config.pacingScope());
        assertEquals(12, config.pacingThreshold());
        assertEquals("flights.json", config.recordedFlights());
        assertEquals(List.of(LocalDate.of(2025, 4, 20), LocalDate.of(2025, 4, 21)),
                config.checkDates(Clock.systemUTC()));
    }

    @Test
    void invalidValuesAreRejected() {
        var config = FinderConfig.builder().workers(0).maxAttempts(0).retryBackoff(Duration.ofSeconds(-1)).build();

        var e = assertThrows(FinderConfigurationException.class, config::validated);
        assertTrue(e.getMessage().contains("workers"), e.getMessage());
        assertTrue(e.getMessage().contains("maxAttempts"), e.getMessage());
        assertTrue(e.getMessage().contains("retryBackoff"), e.getMessage());
    }

    @Test
    void maxStopsIsClampedToOne() {
        assertEquals(1, FinderConfig.builder().maxStops(2).build().validated().maxStops());
        assertEquals(0, FinderConfig.builder().maxStops(0).build().validated().maxStops());
    }

    @Test
    void unreadableFileIsAConfigurationError() {
        File missing = dir.resolve("missing.json").toFile();

        assertThrows(FinderConfigurationException.class, () -> FinderConfig.read(missing, jsonMapper));
    }

    @Test
    void datesStartTodayInTheConfiguredZone() {
        // 23:30 UTC is already the next day in Berlin
        Clock clock = Clock.fixed(Instant.parse("2025-04-19T23:30:00Z"), ZoneOffset.UTC);
        var config = FinderConfig.builder().days(3).build();

        assertEquals(List.of(LocalDate.of(2025, 4, 20), LocalDate.of(2025, 4, 21), LocalDate.of(2025, 4, 22)),
                config.checkDates(clock));
    }
}
