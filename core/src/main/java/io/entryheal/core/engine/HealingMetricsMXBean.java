package io.entryheal.core.engine;

/**
 * JMX MXBean interface for healing metrics.
 *
 * <p>Exposes outcome counters by status, failure counters, and call latency. Registered under an
 * ObjectName such as {@code io.entryheal:type=HealingMetrics,name=<store>} via
 * {@link HealingMetrics#register}.
 *
 * @see HealingMetrics
 */
public interface HealingMetricsMXBean {

    // --- Outcomes ---

    /** Calls that returned a current, valid entry unchanged. */
    long getValidCount();

    /** Calls that returned an entry migrated from legacy data (or accepted despite a failure). */
    long getMigratedCount();

    /** Calls that returned a degraded entry. */
    long getDegradedCount();

    /** Calls that failed with a hard error. */
    long getFailedCount();

    /** Calls that failed because the attempt budget ran out. */
    long getMaxAttemptsExceededCount();

    /** Calls that reached a strategy. */
    long getStartedCount();

    /** Sum of completed and failed calls. */
    long getTotalCount();

    // --- Latency (milliseconds) ---

    /** Average call duration in milliseconds. */
    double getAverageHealingTimeMs();

    /** Max call duration since startup (or last reset). */
    long getMaxHealingTimeMs();

    /** Most recent call duration in milliseconds. */
    long getLastHealingTimeMs();

    // --- Reset ---

    /** Admin operation: zero all counters and latency stats. */
    void resetMetrics();
}
