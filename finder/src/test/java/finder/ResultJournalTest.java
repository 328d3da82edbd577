package finder;

import finder.model.CheckKey;
import finder.model.CheckOutcome;
import finder.model.Leg;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static finder.Flights.DAY;
import static finder.Flights.flight;
import static org.junit.jupiter.api.Assertions.*;

class ResultJournalTest {
    @TempDir
    Path dir;

    @Test
    void reopenedJournalRestoresEveryEntry() throws Exception {
        File file = dir.resolve("out/checked.jsonl").toFile();
        var found = CheckKey.of(new Leg("AAA", "BBB"), DAY);
        var none = CheckKey.of(new Leg("BBB", "CCC"), DAY);
        var failed = CheckKey.of(new Leg("CCC", "DDD"), DAY.plusDays(1));
        var occurrences = CheckOutcome.found(List.of(flight("AAA", "08:00", "BBB", "10:00")));

        try (ResultStore store = ResultJournal.load(file)) {
            assertEquals(0, store.size());
            store.put(found, occurrences);
            store.put(none, CheckOutcome.noneFound());
            store.put(none, CheckOutcome.noneFound());
            store.put(failed, CheckOutcome.failed("Timed out"));
        }

        assertEquals(3, Files.readAllLines(file.toPath()).size());

        try (ResultStore reopened = ResultJournal.load(file)) {
            assertEquals(3, reopened.size());
            assertEquals(occurrences, reopened.get(found).orElseThrow());
            assertEquals(CheckOutcome.noneFound(), reopened.get(none).orElseThrow());
            assertEquals(CheckOutcome.failed("Timed out"), reopened.get(failed).orElseThrow());
        }
    }

    @Test
    void lastLineForAKeyWins() throws Exception {
        File file = dir.resolve("checked.jsonl").toFile();
        var key = CheckKey.of(new Leg("AAA", "BBB"), DAY);

        try (ResultStore store = ResultJournal.load(file)) {
            store.put(key, CheckOutcome.failed("Timed out"));
            store.put(key, CheckOutcome.noneFound());
        }

        try (ResultStore reopened = ResultJournal.load(file)) {
            assertEquals(CheckOutcome.noneFound(), reopened.get(key).orElseThrow());
            assertTrue(reopened.isChecked(key));
        }
    }

    @Test
    void unreadableLinesAreSkipped() throws Exception {
        File file = dir.resolve("checked.jsonl").toFile();
        var key = CheckKey.of(new Leg("AAA", "BBB"), DAY);
        try (ResultStore store = ResultJournal.load(file)) {
            store.put(key, CheckOutcome.noneFound());
        }
        Files.writeString(file.toPath(), "{\"legHash\": \n", StandardOpenOption.APPEND);

        try (ResultStore reopened = ResultJournal.load(file)) {
            assertEquals(1, reopened.size());
        }
    }

    @Test
    void cityNamesSurviveAsUtf8() throws Exception {
        File file = dir.resolve("checked.jsonl").toFile();
        var key = CheckKey.of(new Leg("MUC", "ZRH"), DAY);
        var outcome = CheckOutcome.found(List.of(flight("München", "07:15", "Zürich", "08:20")));

        try (ResultStore store = ResultJournal.load(file)) {
            store.put(key, outcome);
        }

        assertTrue(Files.readString(file.toPath(), StandardCharsets.UTF_8).contains("\"München\""));
        try (ResultStore reopened = ResultJournal.load(file)) {
            var restored = reopened.get(key).orElseThrow().occurrences().get(0);
            assertEquals("München", restored.departure().city());
            assertEquals("Zürich", restored.arrival().city());
        }
    }

    @Test
    void journalAgreesWithTheStoreUnderRacingWriters() throws Exception {
        File file = dir.resolve("checked.jsonl").toFile();
        var key = CheckKey.of(new Leg("AAA", "BBB"), DAY);
        var found = CheckOutcome.found(List.of(flight("AAA", "08:00", "BBB", "10:00")));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CheckOutcome last;
        try (ResultStore store = ResultJournal.load(file)) {
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < 8; t++) {
                CheckOutcome mine = t % 2 == 0 ? found : CheckOutcome.noneFound();
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        store.put(key, mine);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
            last = store.get(key).orElseThrow();
        } finally {
            pool.shutdownNow();
        }

        try (ResultStore reopened = ResultJournal.load(file)) {
            assertEquals(last, reopened.get(key).orElseThrow());
        }
    }
}
