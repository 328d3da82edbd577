package finder;

@FunctionalInterface
public interface CheckerFactory {
    /** Acquires a fresh, exclusively owned checker. */
    AvailabilityChecker open() throws CheckerUnavailableException;
}
