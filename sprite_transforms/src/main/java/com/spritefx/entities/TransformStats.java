package com.spritefx.entities;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks statistics for image transforms.
 */
public class TransformStats {

    private final AtomicLong fastPathRotations = new AtomicLong(0);
    private final AtomicLong sampledRotations = new AtomicLong(0);
    private final AtomicLong scale2xCount = new AtomicLong(0);
    private final AtomicLong scale3xCount = new AtomicLong(0);
    private final AtomicLong rotationsThisSecond = new AtomicLong(0);
    private volatile long lastSecondTimestamp = System.currentTimeMillis();
    private volatile long rotationsPerSecond = 0;

    /**
     * Record a rotation served by index permutation (0/90/180/270 degrees).
     */
    public void recordFastPathRotation() {
        fastPathRotations.incrementAndGet();
        recordRotation();
    }

    /**
     * Record a rotation computed by sampling the supersampled image.
     */
    public void recordSampledRotation() {
        sampledRotations.incrementAndGet();
        recordRotation();
    }

    private void recordRotation() {
        rotationsThisSecond.incrementAndGet();

        long now = System.currentTimeMillis();
        if (now - lastSecondTimestamp >= 1000) {
            rotationsPerSecond = rotationsThisSecond.getAndSet(0);
            lastSecondTimestamp = now;
        }
    }

    /**
     * Record one Scale2x pass.
     */
    public void recordScale2x() {
        scale2xCount.incrementAndGet();
    }

    /**
     * Record one Scale3x pass.
     */
    public void recordScale3x() {
        scale3xCount.incrementAndGet();
    }

    public long getFastPathRotations() {
        return fastPathRotations.get();
    }

    public long getSampledRotations() {
        return sampledRotations.get();
    }

    /**
     * Get total rotations computed since startup.
     */
    public long getTotalRotations() {
        return fastPathRotations.get() + sampledRotations.get();
    }

    public long getScale2xCount() {
        return scale2xCount.get();
    }

    public long getScale3xCount() {
        return scale3xCount.get();
    }

    /**
     * Get rotations computed during the last full second.
     */
    public long getRotationsPerSecond() {
        return rotationsPerSecond;
    }

    /**
     * Reset all statistics.
     */
    public void reset() {
        fastPathRotations.set(0);
        sampledRotations.set(0);
        scale2xCount.set(0);
        scale3xCount.set(0);
        rotationsThisSecond.set(0);
        rotationsPerSecond = 0;
    }
}
