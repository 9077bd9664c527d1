package com.hdrmerge.core.exif;

/**
 * Light-value arithmetic between two exposures.
 * <p>
 * The result is positive when {@code bright} gathers more light than {@code dark}. Arguments are
 * not interchangeable: swapping them negates the shutter and ISO terms and inverts the aperture
 * ratio.
 */
public final class ExposureValueCalculator {

    /** One aperture stop multiplies the f-number by this factor, a rounded square root of two. */
    static final double STOP_FACTOR = 1.41421;

    /**
     * Far-bright exposure every real bracket is measured against so that all offsets come out
     * positive before normalisation. The ISO value does not fit an {@code int}, hence raw fields.
     */
    static final double REFERENCE_SHUTTER = 1_000_000_000d;
    static final double REFERENCE_APERTURE = 0.1;
    static final double REFERENCE_SENSITIVITY = 1_000_000_000_000d;

    private ExposureValueCalculator() {
    }

    public static double evDiff(ImageMetadata bright, ImageMetadata dark) {
        return evDiff(bright.shutterSpeed(), bright.aperture(), bright.sensitivity(),
            dark.shutterSpeed(), dark.aperture(), dark.sensitivity());
    }

    /**
     * EV of {@code exposure} relative to the synthetic reference exposure.
     */
    public static double evFromReference(ImageMetadata exposure) {
        return evDiff(REFERENCE_SHUTTER, REFERENCE_APERTURE, REFERENCE_SENSITIVITY,
            exposure.shutterSpeed(), exposure.aperture(), exposure.sensitivity());
    }

    static double evDiff(double brightShutter, double brightAperture, double brightSensitivity,
                         double darkShutter, double darkAperture, double darkSensitivity) {
        double shutterTerm = log2(brightShutter / darkShutter);
        double sensitivityTerm = log2(brightSensitivity / darkSensitivity);
        return shutterTerm + apertureTerm(brightAperture, darkAperture) + sensitivityTerm;
    }

    /**
     * Zero when either aperture is unknown; this loses precision for manual lenses but keeps the
     * shutter and ISO terms usable.
     */
    private static double apertureTerm(double brightAperture, double darkAperture) {
        if (brightAperture <= 0 || darkAperture <= 0) {
            return 0;
        }
        double ratio = darkAperture / brightAperture;
        if (!(ratio > 0) || Double.isInfinite(ratio)) {
            return 0;
        }
        return Math.log(ratio) / Math.log(STOP_FACTOR);
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }
}
