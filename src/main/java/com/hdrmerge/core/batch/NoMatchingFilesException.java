package com.hdrmerge.core.batch;

import java.io.IOException;

/**
 * Raised when none of the requested folders holds a single complete bracket set.
 */
public class NoMatchingFilesException extends IOException {

    public NoMatchingFilesException(String message) {
        super(message);
    }
}
