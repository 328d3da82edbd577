package finder;

import java.time.Duration;

/** Compact durations for log lines: {@code 850ms}, {@code 42s}, {@code 4m07s}, {@code 1h05m}. */
final class Durations {
    private Durations() {
    }

    static String format(Duration d) {
        if (d.compareTo(Duration.ofSeconds(1)) < 0) {
            return d.toMillis() + "ms";
        }
        long seconds = d.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return String.format("%dm%02ds", d.toMinutes(), d.toSecondsPart());
        }
        return String.format("%dh%02dm", d.toHours(), d.toMinutesPart());
    }
}
