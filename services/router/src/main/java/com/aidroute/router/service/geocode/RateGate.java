// =============================================================================
// AidRoute - Rate Gate
// =============================================================================
package com.aidroute.router.service.geocode;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Interval gate that spaces out outbound calls to a rate-limited provider.
 *
 * <p>Callers reserve the next free dispatch slot under the monitor and then
 * wait for it outside the monitor, so any number of threads may queue up but
 * at most one request is released per interval. No lock is held while the
 * caller talks to the provider.
 *
 * <p>One instance is created per provider when the application context starts
 * and lives until shutdown. Nothing is persisted; a restart begins with an
 * open gate.
 */
@Slf4j
public class RateGate {

    private final long minIntervalNanos;
    private final LongSupplier clock;
    private final Sleeper sleeper;

    private long nextSlotNanos;

    public RateGate(Duration minInterval) {
        this(minInterval, System::nanoTime, Sleeper.SYSTEM);
    }

    public RateGate(Duration minInterval, LongSupplier clock, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("Interval must not be negative: " + minInterval);
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.clock = clock;
        this.sleeper = sleeper;
        this.nextSlotNanos = clock.getAsLong();
    }

    /**
     * Blocks until the caller may dispatch one request.
     *
     * @throws InterruptedException if interrupted while waiting; the reserved
     *                              slot is not reused
     */
    public void acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            long now = clock.getAsLong();
            long slot = Math.max(now, nextSlotNanos);
            nextSlotNanos = slot + minIntervalNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            log.trace("Rate gate wait: {}ms", waitNanos / 1_000_000);
            sleeper.sleep(waitNanos);
        }
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
