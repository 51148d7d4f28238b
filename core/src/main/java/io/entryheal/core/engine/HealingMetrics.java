package io.entryheal.core.engine;

import io.entryheal.core.error.HealingException;
import io.entryheal.core.spi.HealingListener;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import javax.management.InstanceAlreadyExistsException;
import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lock-free {@link HealingListener} that aggregates outcomes into counters, exposed over JMX as a
 * {@link HealingMetricsMXBean}.
 *
 * <p>All counters use {@link LongAdder} for contention-free concurrent updates. Latency tracking
 * uses {@link AtomicLong} for max/last values.
 */
public final class HealingMetrics implements HealingListener, HealingMetricsMXBean {

    private static final Logger LOG = LoggerFactory.getLogger(HealingMetrics.class);

    private final LongAdder startedCount = new LongAdder();
    private final LongAdder validCount = new LongAdder();
    private final LongAdder migratedCount = new LongAdder();
    private final LongAdder degradedCount = new LongAdder();
    private final LongAdder failedCount = new LongAdder();
    private final LongAdder maxAttemptsExceededCount = new LongAdder();

    private final LongAdder totalHealingTimeMs = new LongAdder();
    private final LongAdder totalHealingCount = new LongAdder();
    private final AtomicLong maxHealingTimeMs = new AtomicLong();
    private final AtomicLong lastHealingTimeMs = new AtomicLong();

    /**
     * Registers this bean with the given server.
     *
     * @return {@code true} if registered, {@code false} if the name was already taken
     * @throws IllegalStateException if registration failed for another reason
     */
    public boolean register(MBeanServer server, ObjectName name) {
        try {
            server.registerMBean(this, name);
            LOG.info("Registered healing metrics MBean: {}", name);
            return true;
        } catch (InstanceAlreadyExistsException e) {
            LOG.warn("Healing metrics MBean already registered: {}", name);
            return false;
        } catch (JMException e) {
            throw new IllegalStateException("Failed to register healing metrics MBean " + name, e);
        }
    }

    /** Registers this bean with the platform MBean server under {@code io.entryheal:type=HealingMetrics,name=<name>}. */
    public boolean registerPlatform(String name) {
        try {
            return register(
                    ManagementFactory.getPlatformMBeanServer(),
                    new ObjectName("io.entryheal:type=HealingMetrics,name=" + ObjectName.quote(name)));
        } catch (JMException e) {
            throw new IllegalStateException("Invalid MBean name for healing metrics: " + name, e);
        }
    }

    // ── Listener callbacks ──

    @Override
    public void onHealingStarted(HealingStartedEvent event) {
        startedCount.increment();
    }

    @Override
    public void onHealingCompleted(HealingCompletedEvent event) {
        switch (event.status()) {
            case VALID -> validCount.increment();
            case MIGRATED -> migratedCount.increment();
            case DEGRADED -> degradedCount.increment();
            case FAILED -> {
                // failed calls arrive through onHealingFailed
            }
        }
        recordLatency(event.durationMs());
    }

    @Override
    public void onHealingFailed(HealingFailedEvent event) {
        failedCount.increment();
        if (event.kind() == HealingException.Kind.MAX_ATTEMPTS_EXCEEDED) {
            maxAttemptsExceededCount.increment();
        }
        recordLatency(event.durationMs());
    }

    // ── MXBean interface ──

    @Override
    public long getValidCount() {
        return validCount.sum();
    }

    @Override
    public long getMigratedCount() {
        return migratedCount.sum();
    }

    @Override
    public long getDegradedCount() {
        return degradedCount.sum();
    }

    @Override
    public long getFailedCount() {
        return failedCount.sum();
    }

    @Override
    public long getMaxAttemptsExceededCount() {
        return maxAttemptsExceededCount.sum();
    }

    @Override
    public long getStartedCount() {
        return startedCount.sum();
    }

    @Override
    public long getTotalCount() {
        return validCount.sum() + migratedCount.sum() + degradedCount.sum() + failedCount.sum();
    }

    @Override
    public double getAverageHealingTimeMs() {
        long count = totalHealingCount.sum();
        if (count == 0) {
            return 0.0;
        }
        return (double) totalHealingTimeMs.sum() / count;
    }

    @Override
    public long getMaxHealingTimeMs() {
        return maxHealingTimeMs.get();
    }

    @Override
    public long getLastHealingTimeMs() {
        return lastHealingTimeMs.get();
    }

    @Override
    public void resetMetrics() {
        startedCount.reset();
        validCount.reset();
        migratedCount.reset();
        degradedCount.reset();
        failedCount.reset();
        maxAttemptsExceededCount.reset();
        totalHealingTimeMs.reset();
        totalHealingCount.reset();
        maxHealingTimeMs.set(0);
        lastHealingTimeMs.set(0);
    }

    private void recordLatency(long durationMs) {
        totalHealingTimeMs.add(durationMs);
        totalHealingCount.increment();
        lastHealingTimeMs.set(durationMs);
        maxHealingTimeMs.accumulateAndGet(durationMs, Math::max);
    }
}
