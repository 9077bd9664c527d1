package com.hdrmerge.core.pipeline;

import java.util.function.IntConsumer;

/**
 * Finished-unit counter of one batch run. Workers increment it and every change of the whole
 * percentage is passed to the listener, in increasing order, on the incrementing thread.
 * The count never decreases and never passes the total.
 */
public final class BatchProgress {

    private final int totalUnits;
    private final IntConsumer onPercent;
    private int completedUnits;
    private int lastPercent;

    public BatchProgress(int totalUnits) {
        this(totalUnits, percent -> {
        });
    }

    public BatchProgress(int totalUnits, IntConsumer onPercent) {
        if (totalUnits < 0) {
            throw new IllegalArgumentException("totalUnits must not be negative: " + totalUnits);
        }
        this.totalUnits = totalUnits;
        this.onPercent = onPercent;
    }

    public synchronized int increment() {
        completedUnits = Math.min(completedUnits + 1, totalUnits);
        int percent = percent();
        if (percent != lastPercent) {
            lastPercent = percent;
            onPercent.accept(percent);
        }
        return completedUnits;
    }

    public int totalUnits() {
        return totalUnits;
    }

    public synchronized int completedUnits() {
        return completedUnits;
    }

    public synchronized int percent() {
        if (totalUnits == 0) {
            return 0;
        }
        return (int) ((long) completedUnits * 100 / totalUnits);
    }
}
