package com.hdrmerge.core.exif;

import java.nio.file.Path;

/**
 * Reads the capture settings of a single image file.
 */
@FunctionalInterface
public interface MetadataReader {

    ImageMetadata read(Path file) throws MetadataException;
}
