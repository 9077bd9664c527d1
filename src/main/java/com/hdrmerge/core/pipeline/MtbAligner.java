package com.hdrmerge.core.pipeline;

import com.hdrmerge.core.bracket.BracketSet;
import com.hdrmerge.core.process.StageLog;
import com.hdrmerge.logging.AppLogger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * In-process alignment by median threshold bitmaps (translation only).
 * <p>
 * Every exposure is thresholded at its own median luminance, which makes bitmaps of differently
 * exposed frames comparable. Pixels within {@link #EXCLUSION_RANGE} of the median are ignored as
 * noise. The offset of each frame against the middle exposure is searched coarse to fine: the
 * step halves each round and the best of the 3x3 candidates around the current offset is kept.
 * Aligned copies are written as TIFF; uncovered borders stay black.
 */
public final class MtbAligner implements Aligner {
    private static final Logger LOGGER = AppLogger.get();

    static final String LABEL = "mtb";
    static final int EXCLUSION_RANGE = 4;
    private static final int MIN_INITIAL_STEP = 8;

    @Override
    public BracketSet align(WorkUnit unit, BracketSet set) throws IOException {
        OutputLayout layout = unit.layout();
        Files.createDirectories(layout.alignFolder());

        List<BufferedImage> images = new ArrayList<>(set.size());
        for (Path file : set.files()) {
            images.add(readImage(file));
        }
        int base = images.size() / 2;
        BufferedImage reference = images.get(base);
        Luminance referenceLuminance = Luminance.of(reference);

        StringBuilder report = new StringBuilder();
        List<Path> aligned = new ArrayList<>(images.size());
        for (int i = 0; i < images.size(); i++) {
            BufferedImage image = images.get(i);
            if (image.getWidth() != reference.getWidth() || image.getHeight() != reference.getHeight()) {
                throw new IOException("Bracket %s: %s is %dx%d but the reference is %dx%d".formatted(
                    unit.unitId(), set.files().get(i).getFileName(), image.getWidth(), image.getHeight(),
                    reference.getWidth(), reference.getHeight()));
            }
            Offset offset = i == base ? Offset.NONE : estimateOffset(referenceLuminance, Luminance.of(image));
            report.append("%s -> offset (%d, %d)%n".formatted(set.files().get(i).getFileName(), offset.dx(), offset.dy()));

            Path target = layout.alignedFile(set.index(), i);
            writeTiff(shift(image, offset), target);
            aligned.add(target);
        }

        Path logFile = StageLog.fileFor(layout.root(), LABEL, unit.unitId(), LocalDateTime.now());
        StageLog.write(logFile, report.toString(), "");
        LOGGER.fine(() -> "Bracket " + unit.unitId() + " aligned in process:\n" + report);
        return set.withFiles(aligned);
    }

    /**
     * Translation that, applied to {@code moving}, lines it up with {@code reference}.
     */
    static Offset estimateOffset(Luminance reference, Luminance moving) {
        int maxDimension = Math.max(reference.width(), reference.height());
        int step = MIN_INITIAL_STEP;
        while (step < maxDimension / 150) {
            step *= 2;
        }

        int offsetX = 0;
        int offsetY = 0;
        while (step >= 1) {
            int bestX = offsetX;
            int bestY = offsetY;
            double bestError = mismatch(reference, moving, offsetX, offsetY, step);
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    if (dx == 0 && dy == 0) {
                        continue;
                    }
                    int candidateX = offsetX + dx * step;
                    int candidateY = offsetY + dy * step;
                    double error = mismatch(reference, moving, candidateX, candidateY, step);
                    if (error < bestError) {
                        bestError = error;
                        bestX = candidateX;
                        bestY = candidateY;
                    }
                }
            }
            offsetX = bestX;
            offsetY = bestY;
            step /= 2;
        }
        return new Offset(offsetX, offsetY);
    }

    // share of compared pixels whose threshold bits differ, sampling every step pixels
    private static double mismatch(Luminance reference, Luminance moving, int offsetX, int offsetY, int step) {
        long compared = 0;
        long differing = 0;
        for (int y = 0; y < reference.height(); y += step) {
            int movingY = y - offsetY;
            if (movingY < 0 || movingY >= moving.height()) {
                continue;
            }
            for (int x = 0; x < reference.width(); x += step) {
                int movingX = x - offsetX;
                if (movingX < 0 || movingX >= moving.width()) {
                    continue;
                }
                int referenceValue = reference.at(x, y);
                int movingValue = moving.at(movingX, movingY);
                if (reference.excluded(referenceValue) || moving.excluded(movingValue)) {
                    continue;
                }
                compared++;
                if (reference.above(referenceValue) != moving.above(movingValue)) {
                    differing++;
                }
            }
        }
        return compared == 0 ? Double.MAX_VALUE : (double) differing / compared;
    }

    static BufferedImage shift(BufferedImage image, Offset offset) {
        if (offset.equals(Offset.NONE)) {
            return image;
        }
        WritableRaster shifted = image.getRaster().createCompatibleWritableRaster();
        shifted.setRect(offset.dx(), offset.dy(), image.getRaster());
        return new BufferedImage(image.getColorModel(), shifted, image.isAlphaPremultiplied(), null);
    }

    private static BufferedImage readImage(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("No image reader for " + file.getFileName());
        }
        return image;
    }

    private static void writeTiff(BufferedImage image, Path target) throws IOException {
        if (!ImageIO.write(image, "tiff", target.toFile())) {
            throw new IOException("No TIFF writer available for " + target.getFileName());
        }
    }

    record Offset(int dx, int dy) {
        static final Offset NONE = new Offset(0, 0);
    }

    /**
     * 8-bit luminance of an image with its median.
     */
    record Luminance(int width, int height, int[] values, int median) {

        static Luminance of(BufferedImage image) {
            int width = image.getWidth();
            int height = image.getHeight();
            int[] values = new int[width * height];
            int[] histogram = new int[256];
            int[] row = new int[width];
            for (int y = 0; y < height; y++) {
                image.getRGB(0, y, width, 1, row, 0, width);
                for (int x = 0; x < width; x++) {
                    int rgb = row[x];
                    int r = (rgb >> 16) & 0xFF;
                    int g = (rgb >> 8) & 0xFF;
                    int b = rgb & 0xFF;
                    int value = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
                    values[y * width + x] = value;
                    histogram[value]++;
                }
            }
            return new Luminance(width, height, values, median(histogram, values.length));
        }

        private static int median(int[] histogram, int count) {
            int seen = 0;
            for (int value = 0; value < histogram.length; value++) {
                seen += histogram[value];
                if (seen * 2 >= count) {
                    return value;
                }
            }
            return histogram.length - 1;
        }

        int at(int x, int y) {
            return values[y * width + x];
        }

        boolean above(int value) {
            return value > median;
        }

        boolean excluded(int value) {
            return Math.abs(value - median) <= EXCLUSION_RANGE;
        }
    }
}
