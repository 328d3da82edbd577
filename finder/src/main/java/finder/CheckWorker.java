package finder;

import finder.model.CheckFailure;
import finder.model.CheckKey;
import finder.model.CheckOutcome;
import finder.model.CheckResult;
import finder.model.Leg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Checks one contiguous chunk of legs on every date, sequentially, with its own availability checker. A failure of a
 * single (leg, date) pair is recorded and never stops the worker.
 */
class CheckWorker implements Callable<WorkerSummary> {
    private static final Logger log = LoggerFactory.getLogger(CheckWorker.class);

    final String name; // Package-private for error handling in CheckOrchestrator
    private final List<Leg> legs;
    private final List<LocalDate> dates;
    private final CheckerFactory checkerFactory;
    private final ResultStore store;
    private final FinderConfig config;
    private final Pacing.Counter pacing;
    private final AtomicInteger completed = new AtomicInteger();

    private final Set<CheckKey> processed = new HashSet<>();
    private final List<CheckFailure> failures = new ArrayList<>();
    private int checked;
    private int skipped;
    private int found;
    private int noneFound;
    private CheckerSession session;

    CheckWorker(String name, List<Leg> legs, List<LocalDate> dates, CheckerFactory checkerFactory, ResultStore store,
                FinderConfig config, Pacing.Counter pacing) {
        this.name = name;
        this.legs = List.copyOf(legs);
        this.dates = List.copyOf(dates);
        this.checkerFactory = checkerFactory;
        this.store = store;
        this.config = config;
        this.pacing = pacing;
    }

    @Override
    public WorkerSummary call() {
        log.info("{} checking {} legs on {} dates", name, legs.size(), dates.size());
        Instant startTime = Instant.now();
        try {
            session = openSession();
            for (Leg leg : legs) {
                for (LocalDate date : dates) {
                    CheckKey key = CheckKey.of(leg, date);
                    if (store.isChecked(key)) {
                        log.debug("{} on {} has already been checked", leg, date);
                        skipped++;
                    } else {
                        checkPair(leg, date, key);
                    }
                    processed.add(key);
                    completed.incrementAndGet();
                }
            }
        } catch (CheckerUnavailableException e) {
            log.error("{} lost its availability checker, marking remaining pairs as failed: {}", name, e.getMessage());
            failRemaining(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("{} interrupted, marking remaining pairs as failed", name);
            failRemaining(e);
        } finally {
            closeSession();
        }
        log.info("{} finished in {} ({} checked, {} skipped, {} failed)",
                name, Durations.format(Duration.between(startTime, Instant.now())), checked, skipped, failures.size());
        return summary();
    }

    private void checkPair(Leg leg, LocalDate date, CheckKey key) throws CheckerUnavailableException, InterruptedException {
        int maxAttempts = config.maxAttempts();
        int attempt = 0;
        String lastReason = null;

        try {
            while (attempt < maxAttempts) {
                attempt++;
                if (attempt > 1) {
                    log.info("Retry attempt {} for {} on {}", attempt, leg, date);
                } else {
                    log.debug("Checking {} on {}", leg, date);
                }

                if (session.isBroken()) {
                    log.info("{} replacing a session left busy by a timed out check", name);
                    refreshSession(Duration.ZERO);
                }

                Instant startTime = Instant.now();
                CheckResult result = session.check(leg, date);

                CheckOutcome outcome;
                if (result instanceof CheckResult.Occurrences occurrences) {
                    outcome = CheckOutcome.found(occurrences.occurrences());
                } else if (result instanceof CheckResult.NoneFound) {
                    outcome = CheckOutcome.noneFound();
                } else {
                    lastReason = ((CheckResult.TransientFailure) result).reason();
                    if (attempt < maxAttempts) {
                        // Exponential backoff: 1x, 2x, 4x the configured delay
                        Duration backoff = config.retryBackoff().multipliedBy(1L << (attempt - 1));
                        log.warn("Failed {} on {} (attempt {}), resetting session and retrying in {}: {}",
                                leg, date, attempt, backoff, lastReason);
                        refreshSession(backoff);
                    }
                    continue;
                }

                store.put(key, outcome);
                checked++;
                if (outcome.status() == CheckOutcome.Status.FOUND) {
                    found++;
                    log.info("Found {} flights for {} on {} in {} (attempt {})", outcome.occurrences().size(),
                            leg, date, Duration.between(startTime, Instant.now()), attempt);
                } else {
                    noneFound++;
                    log.debug("No flights for {} on {}", leg, date);
                }

                if (pacing.recordSuccess()) {
                    log.info("{} pausing for {} to avoid rate limiting", name, config.coolDown());
                    refreshSession(config.coolDown());
                }
                return;
            }

            // All attempts failed
            log.error("Failed {} on {} after {} attempts: {}", leg, date, maxAttempts, lastReason);
            recordFailure(key, CheckFailure.from(key, leg, lastReason, maxAttempts));
        } catch (RuntimeException e) {
            log.error("Unexpected error checking {} on {}", leg, date, e);
            recordFailure(key, CheckFailure.from(key, leg, e, attempt));
        }
    }

    /** Tears the session down, waits, and acquires a fresh checker with a fresh session. */
    private void refreshSession(Duration wait) throws CheckerUnavailableException, InterruptedException {
        closeSession();
        if (!wait.isZero()) {
            Thread.sleep(wait.toMillis());
        }
        session = openSession();
    }

    private CheckerSession openSession() throws CheckerUnavailableException {
        return CheckerSession.open(checkerFactory, config.checkTimeout(), name);
    }

    private void closeSession() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    private void recordFailure(CheckKey key, CheckFailure failure) {
        failures.add(failure);
        try {
            store.put(key, CheckOutcome.failed(failure.errorMessage()));
        } catch (RuntimeException e) {
            log.error("Could not record failure for {}", key, e);
        }
    }

    /** Marks every pair of this chunk not handled yet as failed with {@code cause}. */
    WorkerSummary failRemaining(Exception cause) {
        for (Leg leg : legs) {
            for (LocalDate date : dates) {
                CheckKey key = CheckKey.of(leg, date);
                if (!processed.add(key)) {
                    continue;
                }
                if (!store.isChecked(key)) {
                    recordFailure(key, CheckFailure.from(key, leg, cause, 0));
                }
                completed.incrementAndGet();
            }
        }
        return summary();
    }

    /** Pairs of this chunk handled so far, readable from any thread. */
    int completed() {
        return completed.get();
    }

    int pairCount() {
        return legs.size() * dates.size();
    }

    private WorkerSummary summary() {
        return new WorkerSummary(checked, skipped, found, noneFound, failures);
    }
}
