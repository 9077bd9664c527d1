package com.hdrmerge.core.exif;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Extracts bracket-relevant EXIF tags with metadata-extractor.
 * <p>
 * Dimensions come from the primary image directory, falling back to the Exif sub-IFD pixel
 * dimensions. A lens without electronic contacts typically records {@code FNumber 0/0}; that
 * is reported as aperture {@code 0} instead of failing the read.
 */
public final class ExifMetadataReader implements MetadataReader {
    private static final Logger LOGGER = AppLogger.get();

    @Override
    public ImageMetadata read(Path file) throws MetadataException {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException | IOException e) {
            throw new MetadataException("Could not read EXIF data from " + file.getFileName() + ": " + e.getMessage(), e);
        }
        return fromMetadata(file, metadata);
    }

    static ImageMetadata fromMetadata(Path file, Metadata metadata) throws MetadataException {
        String name = file == null ? "<unknown>" : String.valueOf(file.getFileName());
        List<ExifDirectoryBase> exif = exifDirectories(metadata);

        String resolution = readResolution(metadata);
        if (resolution == null) {
            throw new MetadataException("Could not find image dimensions in EXIF data of " + name);
        }

        Double shutter = readRational(exif, ExifDirectoryBase.TAG_EXPOSURE_TIME);
        if (shutter == null || !(shutter > 0) || shutter.isInfinite()) {
            throw new MetadataException("Missing or invalid ExposureTime in " + name);
        }

        Double aperture = readRational(exif, ExifDirectoryBase.TAG_FNUMBER);
        if (aperture == null || aperture.isNaN() || aperture.isInfinite()) {
            aperture = 0.0;
        }

        Integer iso = readIso(exif);
        if (iso == null || iso <= 0) {
            throw new MetadataException("Missing or invalid ISOSpeedRatings in " + name);
        }

        return new ImageMetadata(resolution, shutter, aperture, iso);
    }

    /**
     * Parses {@code "1/125"}, {@code "0.008"} or {@code "8"}. A zero denominator yields
     * {@link Double#NaN} so callers can decide how to degrade.
     */
    public static double parseRational(String text) {
        if (text == null || text.isBlank()) {
            throw new NumberFormatException("empty rational");
        }
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        if (slash < 0) {
            return Double.parseDouble(trimmed);
        }
        double numerator = Double.parseDouble(trimmed.substring(0, slash).trim());
        double denominator = Double.parseDouble(trimmed.substring(slash + 1).trim());
        if (denominator == 0) {
            return Double.NaN;
        }
        return numerator / denominator;
    }

    private static List<ExifDirectoryBase> exifDirectories(Metadata metadata) {
        List<ExifDirectoryBase> result = new ArrayList<>();
        result.addAll(metadata.getDirectoriesOfType(ExifSubIFDDirectory.class));
        result.addAll(metadata.getDirectoriesOfType(ExifIFD0Directory.class));
        return result;
    }

    private static String readResolution(Metadata metadata) {
        for (ExifIFD0Directory ifd0 : metadata.getDirectoriesOfType(ExifIFD0Directory.class)) {
            String resolution = dimensions(ifd0, ExifDirectoryBase.TAG_IMAGE_WIDTH, ExifDirectoryBase.TAG_IMAGE_HEIGHT);
            if (resolution != null) {
                return resolution;
            }
        }
        for (ExifSubIFDDirectory sub : metadata.getDirectoriesOfType(ExifSubIFDDirectory.class)) {
            String resolution = dimensions(sub, ExifDirectoryBase.TAG_EXIF_IMAGE_WIDTH, ExifDirectoryBase.TAG_EXIF_IMAGE_HEIGHT);
            if (resolution != null) {
                return resolution;
            }
        }
        return null;
    }

    private static String dimensions(Directory directory, int widthTag, int heightTag) {
        if (!directory.containsTag(widthTag) || !directory.containsTag(heightTag)) {
            return null;
        }
        Integer width = directory.getInteger(widthTag);
        Integer height = directory.getInteger(heightTag);
        if (width == null || height == null) {
            return null;
        }
        return width + "x" + height;
    }

    private static Double readRational(List<ExifDirectoryBase> directories, int tag) {
        for (Directory directory : directories) {
            if (!directory.containsTag(tag)) {
                continue;
            }
            Rational rational = directory.getRational(tag);
            if (rational != null) {
                if (rational.getDenominator() == 0) {
                    return Double.NaN;
                }
                return rational.doubleValue();
            }
            String text = directory.getString(tag);
            try {
                return parseRational(text);
            } catch (NumberFormatException e) {
                LOGGER.fine(() -> "Unparsable " + directory.getTagName(tag) + " '" + text + "', trying next directory");
            }
        }
        return null;
    }

    private static Integer readIso(List<ExifDirectoryBase> directories) {
        for (Directory directory : directories) {
            if (!directory.containsTag(ExifDirectoryBase.TAG_ISO_EQUIVALENT)) {
                continue;
            }
            Integer iso = directory.getInteger(ExifDirectoryBase.TAG_ISO_EQUIVALENT);
            if (iso != null) {
                return iso;
            }
            String text = directory.getString(ExifDirectoryBase.TAG_ISO_EQUIVALENT);
            if (text == null) {
                continue;
            }
            String first = text.trim().split("\\s+")[0];
            try {
                return Integer.parseInt(first);
            } catch (NumberFormatException e) {
                LOGGER.fine(() -> "Unparsable ISO value '" + text + "', trying next directory");
            }
        }
        return null;
    }
}
