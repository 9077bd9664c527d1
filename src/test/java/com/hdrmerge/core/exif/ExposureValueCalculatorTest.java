package com.hdrmerge.core.exif;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExposureValueCalculatorTest {

    private static ImageMetadata exposure(double shutter, double aperture, int iso) {
        return new ImageMetadata("6000x4000", shutter, aperture, iso);
    }

    @Test
    void identicalExposuresDifferByZero() {
        ImageMetadata same = exposure(1 / 125d, 8, 100);
        assertEquals(0.0, ExposureValueCalculator.evDiff(same, same), 1e-12);
    }

    @Test
    void doublingShutterTimeIsOneStop() {
        assertEquals(1.0, ExposureValueCalculator.evDiff(exposure(1 / 60d, 8, 100), exposure(1 / 120d, 8, 100)), 1e-9);
    }

    @Test
    void doublingIsoIsOneStop() {
        assertEquals(1.0, ExposureValueCalculator.evDiff(exposure(1 / 60d, 8, 200), exposure(1 / 60d, 8, 100)), 1e-9);
    }

    @Test
    void twoApertureStopsUseTheSquareRootOfTwoFactor() {
        double ev = ExposureValueCalculator.evDiff(exposure(1 / 60d, 4, 100), exposure(1 / 60d, 8, 100));
        assertEquals(Math.log(2) / Math.log(ExposureValueCalculator.STOP_FACTOR), ev, 1e-12);
        assertEquals(2.0, ev, 1e-4);
    }

    @Test
    void missingApertureContributesNothing() {
        double withoutAperture = ExposureValueCalculator.evDiff(exposure(1 / 30d, 0, 100), exposure(1 / 120d, 8, 100));
        assertEquals(2.0, withoutAperture, 1e-9);
    }

    @Test
    void brighterArgumentFirstGivesPositiveResult() {
        ImageMetadata bright = exposure(1 / 15d, 5.6, 400);
        ImageMetadata dark = exposure(1 / 250d, 8, 100);

        double forward = ExposureValueCalculator.evDiff(bright, dark);
        assertTrue(forward > 0);
        assertEquals(-forward, ExposureValueCalculator.evDiff(dark, bright), 1e-9);
    }

    @Test
    void referenceSitsFarBrighterThanRealExposures() {
        ImageMetadata longExposure = exposure(30, 1.4, 25600);
        assertTrue(ExposureValueCalculator.evFromReference(longExposure) > 0);
    }

    @Test
    void referenceOffsetsPreserveRelativeStops() {
        double darker = ExposureValueCalculator.evFromReference(exposure(1 / 500d, 8, 100));
        double brighter = ExposureValueCalculator.evFromReference(exposure(1 / 125d, 8, 100));
        assertEquals(2.0, darker - brighter, 1e-9);
    }
}
