package com.hdrmerge.core.batch;

import com.hdrmerge.core.pipeline.OutputLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FolderCleanerTest {

    @TempDir
    Path tempDir;

    @Test
    void removesAlignedAndConvertedFilesOfRawFolder() throws IOException {
        OutputLayout layout = OutputLayout.forFolder(tempDir);
        touch(layout.alignedFile(0, 0));
        touch(tempDir.resolve("tif/DSC_0001.tif"));
        touch(layout.exrPath(0));
        touch(layout.jpgPath(0));

        assertTrue(new FolderCleaner().clean(tempDir, true));

        assertFalse(Files.exists(layout.alignFolder()));
        assertFalse(Files.exists(tempDir.resolve("tif")));
        assertTrue(Files.exists(layout.exrPath(0)));
        assertTrue(Files.exists(layout.jpgPath(0)));
    }

    @Test
    void keepsTifFolderOfProcessedSources() throws IOException {
        touch(tempDir.resolve("tif/IMG_0001.tif"));

        assertTrue(new FolderCleaner().clean(tempDir, false));

        assertTrue(Files.exists(tempDir.resolve("tif/IMG_0001.tif")));
    }

    @Test
    void nothingToDeleteIsClean() {
        assertTrue(new FolderCleaner().clean(tempDir, true));
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.createFile(file);
    }
}
