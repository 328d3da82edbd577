package finder;

import finder.model.CheckFailure;
import finder.model.Leg;
import finder.model.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs availability checks for every (leg, date) pair on a fixed pool of workers. Legs are split into contiguous
 * chunks, one per worker, and every worker owns its own checker for its whole lifetime. The call blocks until all
 * workers are done; individual failures end up in the {@link RunReport}, never as exceptions.
 */
public class CheckOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CheckOrchestrator.class);

    private final CheckerFactory checkerFactory;
    private final FinderConfig config;

    public CheckOrchestrator(CheckerFactory checkerFactory, FinderConfig config) {
        this.checkerFactory = checkerFactory;
        this.config = config;
    }

    public CheckRun runChecks(List<Leg> legs, List<LocalDate> dates, int workerCount) {
        return runChecks(legs, dates, workerCount, new ResultStore());
    }

    /** Checks into an existing store; pairs it already answers are skipped. */
    public CheckRun runChecks(List<Leg> legs, List<LocalDate> dates, int workerCount, ResultStore store) {
        if (workerCount < 1) {
            throw new FinderConfigurationException("workerCount must be at least 1 (got " + workerCount + ")");
        }
        List<List<Leg>> chunks = partition(legs, workerCount);
        int total = legs.size() * dates.size();
        log.info("Checking {} legs on {} dates ({} pairs) with {} workers", legs.size(), dates.size(), total, chunks.size());

        Pacing pacing = new Pacing(config.pacingScope(), config.pacingThreshold());
        ArrayList<CheckWorker> workers = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            workers.add(new CheckWorker("check-worker-" + (i + 1), chunks.get(i), dates, checkerFactory, store,
                    config, pacing.forWorker()));
        }

        Instant startTime = Instant.now();
        List<WorkerSummary> summaries = new ArrayList<>();
        if (!workers.isEmpty()) {
            ExecutorService executor = Executors.newFixedThreadPool(workers.size());
            ScheduledExecutorService progressLog = startProgressLog(workers, total, startTime);
            try {
                List<Future<WorkerSummary>> futures = executor.invokeAll(workers);
                for (int i = 0; i < futures.size(); i++) {
                    CheckWorker worker = workers.get(i);
                    try {
                        summaries.add(futures.get(i).get());
                    } catch (ExecutionException e) {
                        // Extract the root cause
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.error("{} crashed, marking its remaining pairs as failed", worker.name, cause);
                        summaries.add(worker.failRemaining(cause instanceof Exception ex ? ex : e));
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for check workers", e);
            } finally {
                executor.shutdownNow();
                if (progressLog != null) {
                    progressLog.shutdownNow();
                }
            }
        }

        RunReport report = report(total, summaries, Duration.between(startTime, Instant.now()));
        if (report.isComplete()) {
            log.info("All done! Checked {} pairs in {} ({} found, {} without flights, {} skipped)",
                    report.checked(), Durations.format(report.elapsed()), report.found(), report.noneFound(),
                    report.skipped());
        } else {
            log.warn("{} failure(s) after retries, results may be incomplete for {} legs:",
                    report.failed(), report.getIncompleteLegs());
            for (CheckFailure failure : report.failures()) {
                log.warn("  - {} on {}: {} ({})", failure.leg(), failure.key().date(), failure.errorMessage(),
                        failure.errorType());
            }
        }
        return new CheckRun(store, report);
    }

    /** Splits {@code items} into at most {@code chunks} contiguous slices of equal size (the last may be shorter). */
    static <T> List<List<T>> partition(List<T> items, int chunks) {
        if (items.isEmpty()) {
            return List.of();
        }
        int chunkSize = (items.size() + chunks - 1) / chunks;
        var result = new ArrayList<List<T>>();
        for (int i = 0; i < items.size(); i += chunkSize) {
            result.add(List.copyOf(items.subList(i, Math.min(i + chunkSize, items.size()))));
        }
        return result;
    }

    private static RunReport report(int total, List<WorkerSummary> summaries, Duration elapsed) {
        int checked = 0;
        int skipped = 0;
        int found = 0;
        int noneFound = 0;
        var failures = new ArrayList<CheckFailure>();
        for (WorkerSummary s : summaries) {
            checked += s.checked();
            skipped += s.skipped();
            found += s.found();
            noneFound += s.noneFound();
            failures.addAll(s.failures());
        }
        return new RunReport(total, checked, skipped, found, noneFound, failures.size(), failures, elapsed);
    }

    private ScheduledExecutorService startProgressLog(List<CheckWorker> workers, int total, Instant startTime) {
        Duration interval = config.progressInterval();
        if (interval.isZero()) {
            return null;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-log");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> logProgress(workers, total, startTime),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        return scheduler;
    }

    private static void logProgress(List<CheckWorker> workers, int total, Instant startTime) {
        int completed = 0;
        var chunks = new StringJoiner(", ");
        for (CheckWorker worker : workers) {
            int done = worker.completed();
            completed += done;
            chunks.add(worker.name + " " + done + "/" + worker.pairCount());
        }
        if (completed == 0 || completed >= total) {
            return;
        }
        // Remaining pairs at the average pace so far
        Duration elapsed = Duration.between(startTime, Instant.now());
        Duration remaining = elapsed.multipliedBy(total - completed).dividedBy(completed);
        log.info("{}/{} pairs done, about {} to go [{}]", completed, total, Durations.format(remaining), chunks);
    }
}
