package finder;

import finder.model.CheckResult;
import finder.model.Leg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One acquired {@link AvailabilityChecker} together with the thread its calls run on. Calls that exceed the timeout
 * are abandoned and leave the session broken: its call thread may still be busy, so it must be closed and replaced
 * before the next check.
 */
class CheckerSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CheckerSession.class);

    private final AvailabilityChecker checker;
    private final ExecutorService callThread;
    private final Duration timeout;
    private boolean broken;

    private CheckerSession(AvailabilityChecker checker, ExecutorService callThread, Duration timeout) {
        this.checker = checker;
        this.callThread = callThread;
        this.timeout = timeout;
    }

    static CheckerSession open(CheckerFactory factory, Duration timeout, String name) throws CheckerUnavailableException {
        AvailabilityChecker checker;
        try {
            checker = factory.open();
        } catch (CheckerUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CheckerUnavailableException("Failed to open availability checker", e);
        }
        ExecutorService callThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-calls");
            t.setDaemon(true);
            return t;
        });
        var session = new CheckerSession(checker, callThread, timeout);
        try {
            session.call(() -> {
                checker.resetSession();
                return null;
            });
        } catch (InterruptedException e) {
            session.close();
            Thread.currentThread().interrupt();
            throw new CheckerUnavailableException("Interrupted while starting checker session", e);
        } catch (Exception e) {
            session.close();
            throw new CheckerUnavailableException("Failed to start checker session", e);
        }
        return session;
    }

    /** Runs the check on the session thread; a timeout or a thrown exception becomes a transient failure. */
    CheckResult check(Leg leg, LocalDate date) throws InterruptedException {
        try {
            CheckResult result = call(() -> checker.check(leg, date));
            if (result == null) {
                return new CheckResult.TransientFailure("Checker returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            broken = true;
            return new CheckResult.TransientFailure("Timed out after " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Check {} on {} threw", leg, date, cause);
            return new CheckResult.TransientFailure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    boolean isBroken() {
        return broken;
    }

    private <T> T call(Callable<T> task)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<T> future = callThread.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        callThread.shutdownNow();
        try {
            checker.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close availability checker cleanly: {}", e.toString());
        }
    }
}
