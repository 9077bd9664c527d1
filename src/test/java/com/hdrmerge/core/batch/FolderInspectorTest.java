package com.hdrmerge.core.batch;

import com.hdrmerge.config.BatchConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FolderInspectorTest {

    @TempDir
    Path tempDir;

    private final FolderInspector inspector = new FolderInspector(BatchConfig.defaults());

    @Test
    void detectsRawFolder() throws IOException {
        Files.createFile(tempDir.resolve("DSC_0001_60.NEF"));
        Files.createFile(tempDir.resolve("DSC_0002_250.NEF"));
        Files.createFile(tempDir.resolve("DSC_0003_60.NEF"));
        Files.createFile(tempDir.resolve("DSC_0004_250.NEF"));

        FolderInspector.FolderAnalysis analysis = inspector.inspect(tempDir);

        assertEquals(".nef", analysis.extension());
        assertTrue(analysis.raw());
    }

    @Test
    void unreadableCaptureStillYieldsAnExtension() throws IOException {
        Files.createFile(tempDir.resolve("IMG_0001_nodata.tif"));

        FolderInspector.FolderAnalysis analysis = inspector.inspect(tempDir);

        assertEquals(".tif", analysis.extension());
        assertTrue(analysis.hasImages());
    }

    @Test
    void firstFileByNameDecidesTheExtension() throws IOException {
        Files.createFile(tempDir.resolve("b_0001_60.dng"));
        Files.createFile(tempDir.resolve("a_0001_60.jpg"));

        FolderInspector.FolderAnalysis analysis = inspector.inspect(tempDir);

        assertEquals(".jpg", analysis.extension());
        assertFalse(analysis.raw());
    }

    @Test
    void folderWithoutImagesHasNone() throws IOException {
        Files.createFile(tempDir.resolve("notes.txt"));

        assertFalse(inspector.inspect(tempDir).hasImages());
        assertFalse(inspector.inspect(tempDir.resolve("missing")).hasImages());
    }

    @Test
    void requestCarriesDetectedExtension() throws IOException {
        Files.createFile(tempDir.resolve("IMG_0001_30.tif"));

        FolderRequest request = inspector.requestFor(tempDir, " Neutral ", true);

        assertEquals(".tif", request.extension());
        assertEquals("Neutral", request.profile());
        assertTrue(request.align());
        assertFalse(request.raw());
    }

    @Test
    void extensionIsLowerCased() {
        assertEquals(".cr2", FolderInspector.extensionOf(Paths.get("IMG_1.CR2")));
        assertEquals("", FolderInspector.extensionOf(Paths.get("README")));
    }
}
