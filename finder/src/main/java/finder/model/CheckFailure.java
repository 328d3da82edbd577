package finder.model;

import java.time.Instant;

public record CheckFailure(
        CheckKey key,
        Leg leg,
        String errorMessage,
        String errorType,
        Instant timestamp,
        int attemptCount
) {
    public static CheckFailure from(CheckKey key, Leg leg, Exception e, int attempts) {
        return new CheckFailure(
                key,
                leg,
                e.getMessage(),
                e.getClass().getSimpleName(),
                Instant.now(),
                attempts
        );
    }

    public static CheckFailure from(CheckKey key, Leg leg, String reason, int attempts) {
        return new CheckFailure(key, leg, reason, "TransientFailure", Instant.now(), attempts);
    }
}
