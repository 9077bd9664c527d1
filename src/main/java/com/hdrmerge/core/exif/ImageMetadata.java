package com.hdrmerge.core.exif;

import java.util.Objects;

/**
 * Capture settings of one exposure. Two exposures with equal metadata occupy the same
 * position in a bracket pattern.
 *
 * @param resolution   {@code WIDTHxHEIGHT}
 * @param shutterSpeed exposure time in seconds
 * @param aperture     f-number, {@code 0} when the lens reports none
 * @param sensitivity  ISO speed
 */
public record ImageMetadata(String resolution, double shutterSpeed, double aperture, int sensitivity) {

    public ImageMetadata {
        Objects.requireNonNull(resolution, "resolution");
        if (!(shutterSpeed > 0)) {
            throw new IllegalArgumentException("shutter speed must be positive: " + shutterSpeed);
        }
        if (sensitivity <= 0) {
            throw new IllegalArgumentException("sensitivity must be positive: " + sensitivity);
        }
        if (aperture < 0 || Double.isNaN(aperture) || Double.isInfinite(aperture)) {
            aperture = 0;
        }
    }

    public boolean hasAperture() {
        return aperture > 0;
    }

    @Override
    public String toString() {
        return "%s %ss f/%s ISO %d".formatted(resolution, shutterSpeed, aperture, sensitivity);
    }
}
