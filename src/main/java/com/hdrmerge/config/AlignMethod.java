package com.hdrmerge.config;

import java.util.Locale;

/**
 * How bracket sets are aligned before merging.
 */
public enum AlignMethod {
    /** Hugin's {@code align_image_stack}. */
    EXTERNAL,
    /** Median threshold bitmap alignment inside this process. */
    IN_PROCESS;

    public static AlignMethod parse(String value) {
        if (value == null || value.isBlank()) {
            return EXTERNAL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("OPENCV") || normalized.equals("MTB")) {
            return IN_PROCESS;
        }
        return valueOf(normalized);
    }
}
