package com.hdrmerge.core.batch;

/**
 * Callbacks from a running batch. {@link #onProgress} fires on the worker that finished a set,
 * in increasing order; the others run on the thread that called {@link BatchExecutor#execute}.
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {
    };

    default void onProgress(int percent) {
    }

    default void onLog(String message) {
    }

    default void onComplete(BatchSummary summary) {
    }
}
