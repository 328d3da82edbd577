package finder;

/** Which successes count towards the cool-down threshold. */
public enum PacingScope {
    /** One counter shared by every worker of a run. */
    RUN,
    /** Each worker counts its own successes. */
    WORKER
}
