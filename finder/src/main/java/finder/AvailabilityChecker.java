package finder;

import finder.model.CheckResult;
import finder.model.Leg;

import java.time.LocalDate;

/**
 * The external source of flight availability (a browser session, a vendor API client, ...). Instances are stateful
 * and are never shared between threads.
 */
public interface AvailabilityChecker extends AutoCloseable {

    /**
     * Checks which flights operate {@code leg} on {@code date}. Transient problems are reported as
     * {@link CheckResult.TransientFailure}; any exception thrown is treated the same way.
     */
    CheckResult check(Leg leg, LocalDate date) throws Exception;

    /** Re-establishes tokens, cookies or connections needed for further checks. Safe to call repeatedly. */
    void resetSession() throws Exception;

    @Override
    void close();
}
