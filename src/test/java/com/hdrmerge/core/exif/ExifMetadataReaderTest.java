package com.hdrmerge.core.exif;

import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExifMetadataReaderTest {

    private static final Path FILE = Paths.get("IMG_0001.tif");

    @TempDir
    Path tempDir;

    private static Metadata camera(Rational exposure, Rational fNumber, Integer iso) {
        Metadata metadata = new Metadata();
        ExifIFD0Directory ifd0 = new ExifIFD0Directory();
        ifd0.setInt(ExifDirectoryBase.TAG_IMAGE_WIDTH, 6000);
        ifd0.setInt(ExifDirectoryBase.TAG_IMAGE_HEIGHT, 4000);
        metadata.addDirectory(ifd0);

        ExifSubIFDDirectory sub = new ExifSubIFDDirectory();
        if (exposure != null) {
            sub.setRational(ExifDirectoryBase.TAG_EXPOSURE_TIME, exposure);
        }
        if (fNumber != null) {
            sub.setRational(ExifDirectoryBase.TAG_FNUMBER, fNumber);
        }
        if (iso != null) {
            sub.setInt(ExifDirectoryBase.TAG_ISO_EQUIVALENT, iso);
        }
        metadata.addDirectory(sub);
        return metadata;
    }

    @Test
    void readsResolutionShutterApertureAndIso() throws MetadataException {
        ImageMetadata result = ExifMetadataReader.fromMetadata(FILE,
            camera(new Rational(1, 125), new Rational(8, 1), 100));

        assertEquals("6000x4000", result.resolution());
        assertEquals(0.008, result.shutterSpeed(), 1e-12);
        assertEquals(8.0, result.aperture(), 1e-12);
        assertEquals(100, result.sensitivity());
    }

    @Test
    void zeroOverZeroApertureBecomesUnknownInsteadOfFailing() throws MetadataException {
        ImageMetadata result = ExifMetadataReader.fromMetadata(FILE,
            camera(new Rational(1, 60), new Rational(0, 0), 200));

        assertEquals(0.0, result.aperture());
        assertFalse(result.hasAperture());
    }

    @Test
    void missingApertureBecomesUnknown() throws MetadataException {
        ImageMetadata result = ExifMetadataReader.fromMetadata(FILE, camera(new Rational(1, 60), null, 200));
        assertEquals(0.0, result.aperture());
    }

    @Test
    void fallsBackToExifPixelDimensions() throws MetadataException {
        Metadata metadata = new Metadata();
        ExifSubIFDDirectory sub = new ExifSubIFDDirectory();
        sub.setInt(ExifDirectoryBase.TAG_EXIF_IMAGE_WIDTH, 4032);
        sub.setInt(ExifDirectoryBase.TAG_EXIF_IMAGE_HEIGHT, 3024);
        sub.setRational(ExifDirectoryBase.TAG_EXPOSURE_TIME, new Rational(1, 30));
        sub.setInt(ExifDirectoryBase.TAG_ISO_EQUIVALENT, 400);
        metadata.addDirectory(sub);

        assertEquals("4032x3024", ExifMetadataReader.fromMetadata(FILE, metadata).resolution());
    }

    @Test
    void missingExposureTimeIsAMetadataError() {
        MetadataException error = assertThrows(MetadataException.class,
            () -> ExifMetadataReader.fromMetadata(FILE, camera(null, new Rational(8, 1), 100)));
        assertTrue(error.getMessage().contains("ExposureTime"));
    }

    @Test
    void missingIsoIsAMetadataError() {
        assertThrows(MetadataException.class,
            () -> ExifMetadataReader.fromMetadata(FILE, camera(new Rational(1, 125), new Rational(8, 1), null)));
    }

    @Test
    void fileWithoutImageDataFailsWithMetadataException() throws Exception {
        Path notAnImage = tempDir.resolve("notes.tif");
        Files.writeString(notAnImage, "definitely not a TIFF");

        assertThrows(MetadataException.class, () -> new ExifMetadataReader().read(notAnImage));
    }

    @Test
    void parsesFractionsDecimalsAndIntegers() {
        assertEquals(0.008, ExifMetadataReader.parseRational("1/125"), 1e-12);
        assertEquals(0.5, ExifMetadataReader.parseRational(" 0.5 "), 1e-12);
        assertEquals(8.0, ExifMetadataReader.parseRational("8"), 1e-12);
        assertTrue(Double.isNaN(ExifMetadataReader.parseRational("0/0")));
        assertThrows(NumberFormatException.class, () -> ExifMetadataReader.parseRational(""));
    }
}
