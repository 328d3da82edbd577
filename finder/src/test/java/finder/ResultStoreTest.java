package finder;

import finder.model.CheckKey;
import finder.model.CheckOutcome;
import finder.model.Leg;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static finder.Flights.DAY;
import static finder.Flights.flight;
import static org.junit.jupiter.api.Assertions.*;

class ResultStoreTest {
    private static final CheckKey KEY = CheckKey.of(new Leg("AAA", "BBB"), DAY);

    @Test
    void writingTheSameNoneFoundTwiceIsHarmless() {
        var subject = new ResultStore();

        assertTrue(subject.put(KEY, CheckOutcome.noneFound()));
        var afterFirst = subject.snapshot();
        assertFalse(subject.put(KEY, CheckOutcome.noneFound()));

        assertEquals(afterFirst, subject.snapshot());
        assertEquals(1, subject.size());
        assertEquals(CheckOutcome.noneFound(), subject.get(KEY).orElseThrow());
    }

    @Test
    void idempotentForOccurrences() {
        var subject = new ResultStore();
        var outcome = CheckOutcome.found(List.of(flight("AAA", "08:00", "BBB", "10:00")));

        subject.put(KEY, outcome);
        subject.put(KEY, CheckOutcome.found(List.of(flight("AAA", "08:00", "BBB", "10:00"))));

        assertEquals(1, subject.size());
        assertEquals(outcome, subject.get(KEY).orElseThrow());
    }

    @Test
    void failureMarkerIsStoredButNotChecked() {
        var subject = new ResultStore();

        subject.put(KEY, CheckOutcome.failed("rate limited"));

        assertTrue(subject.contains(KEY));
        assertFalse(subject.isChecked(KEY));
        assertNotEquals(CheckOutcome.noneFound(), subject.get(KEY).orElseThrow());
        assertTrue(subject.get(KEY).orElseThrow().occurrences().isEmpty());
    }

    @Test
    void absentKey() {
        var subject = new ResultStore();

        assertFalse(subject.contains(KEY));
        assertTrue(subject.get(KEY).isEmpty());
    }

    @Test
    void snapshotIsImmutableAndDetached() {
        var subject = new ResultStore();
        subject.put(KEY, CheckOutcome.noneFound());

        var snapshot = subject.snapshot();
        subject.put(CheckKey.of(new Leg("BBB", "CCC"), DAY), CheckOutcome.noneFound());

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put(KEY, CheckOutcome.noneFound()));
    }

    @Test
    void concurrentWritersLoseNothing() throws Exception {
        var subject = new ResultStore();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        // every key is written by two threads with the same value
                        var key = CheckKey.of(new Leg("A" + (thread / 2), "B" + i), LocalDate.of(2025, 1, 1));
                        subject.put(key, CheckOutcome.noneFound());
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(4 * 500, subject.size());
    }
}
