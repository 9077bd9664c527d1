package com.hdrmerge.core.batch;

import com.hdrmerge.logging.AppLogger;

import java.util.logging.Logger;

public final class LoggingNotifier implements Notifier {
    private static final Logger LOGGER = AppLogger.get();

    @Override
    public void notify(String message) {
        LOGGER.info(message);
    }
}
