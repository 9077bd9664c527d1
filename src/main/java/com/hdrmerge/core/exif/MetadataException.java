package com.hdrmerge.core.exif;

import java.io.IOException;

/**
 * Raised when the capture metadata an exposure needs for bracket detection is missing or unreadable.
 */
public class MetadataException extends IOException {

    public MetadataException(String message) {
        super(message);
    }

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
