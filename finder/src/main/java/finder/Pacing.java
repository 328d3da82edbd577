package finder;

import java.util.concurrent.atomic.AtomicInteger;

/** Decides when a worker has to cool down and refresh its session to stay clear of upstream rate limits. */
class Pacing {
    private final PacingScope scope;
    private final int threshold;
    private final AtomicInteger runSuccesses = new AtomicInteger();

    Pacing(PacingScope scope, int threshold) {
        this.scope = scope;
        this.threshold = threshold;
    }

    Counter forWorker() {
        return new Counter();
    }

    /** Per-worker view; not thread-safe, each worker owns one. */
    class Counter {
        private int workerSuccesses;

        /** Records an answered check and returns true when the caller should cool down now. */
        boolean recordSuccess() {
            workerSuccesses++;
            int run = runSuccesses.incrementAndGet();
            int counted = scope == PacingScope.RUN ? run : workerSuccesses;
            return counted % threshold == 0;
        }
    }
}
