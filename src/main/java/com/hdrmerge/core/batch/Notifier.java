package com.hdrmerge.core.batch;

/**
 * Tells the user a batch has finished. Failures are logged by the caller and never stop a batch.
 */
@FunctionalInterface
public interface Notifier {

    void notify(String message) throws Exception;
}
