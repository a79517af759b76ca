package works.nuka.soclebot.config;

/**
 * Paramètres du planificateur de tâches
 */
public final class SchedulerConfig {
    public static final int DEFAULT_MISFIRE_GRACE_SECONDS = 300;
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 1000;

    private final int misfireGraceSeconds;
    private final long pollIntervalMillis;

    public SchedulerConfig(int misfireGraceSeconds, long pollIntervalMillis) {
        this.misfireGraceSeconds = misfireGraceSeconds;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(DEFAULT_MISFIRE_GRACE_SECONDS, DEFAULT_POLL_INTERVAL_MILLIS);
    }

    public int getMisfireGraceSeconds() {
        return misfireGraceSeconds;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }
}
