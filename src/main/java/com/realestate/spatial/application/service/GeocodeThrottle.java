package com.realestate.spatial.application.service;

import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Spaces out calls to the external geocoder.
 * Shared by every enrichment path in the JVM; callers block until their
 * slot is due.
 */
@Component
public class GeocodeThrottle {

    private final long minIntervalNanos;
    private long lastCallNanos;
    private boolean called;

    public GeocodeThrottle(SpatialProperties properties) {
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(properties.getEnrichment().getMinIntervalMs());
    }

    /**
     * Block until at least the configured interval has passed since the
     * previous call.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public synchronized void awaitTurn() throws InterruptedException {
        if (called) {
            long waitNanos = lastCallNanos + minIntervalNanos - System.nanoTime();
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        }
        lastCallNanos = System.nanoTime();
        called = true;
    }
}
