package finder;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationsTest {
    @Test
    void picksTheLargestUsefulUnits() {
        assertEquals("300ms", Durations.format(Duration.ofMillis(300)));
        assertEquals("42s", Durations.format(Duration.ofSeconds(42)));
        assertEquals("4m07s", Durations.format(Duration.ofSeconds(247)));
        assertEquals("1h05m", Durations.format(Duration.ofMinutes(65).plusSeconds(30)));
        assertEquals("26h00m", Durations.format(Duration.ofDays(1).plusHours(2)));
    }
}
