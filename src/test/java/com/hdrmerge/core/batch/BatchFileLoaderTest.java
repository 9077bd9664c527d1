package com.hdrmerge.core.batch;

import com.hdrmerge.config.BatchConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchFileLoaderTest {

    @TempDir
    Path tempDir;

    private final BatchFileLoader loader = new BatchFileLoader(new FolderInspector(BatchConfig.defaults()));

    @Test
    void readsExplicitEntriesAndInspectsTheRest() throws IOException {
        Path raw = Files.createDirectories(tempDir.resolve("raw"));
        Path jpg = Files.createDirectories(tempDir.resolve("jpg"));
        Files.createFile(jpg.resolve("IMG_0001_60.JPG"));
        Path batch = write("""
            {
              "folders": [
                { "path": "%s", "profile": "Neutral", "align": true, "extension": ".dng", "is_raw": true },
                { "path": "%s" },
                { "profile": "ignored" }
              ]
            }
            """.formatted(json(raw), json(jpg)));

        List<FolderRequest> requests = loader.load(batch);

        assertEquals(2, requests.size());
        FolderRequest first = requests.get(0);
        assertEquals(raw, first.folder());
        assertEquals("Neutral", first.profile());
        assertTrue(first.align());
        assertEquals(".dng", first.extension());
        assertTrue(first.raw());

        FolderRequest second = requests.get(1);
        assertEquals(".jpg", second.extension());
        assertFalse(second.raw());
        assertFalse(second.align());
    }

    @Test
    void entryWithUnreadableCaptureStillLoads() throws IOException {
        Path broken = Files.createDirectories(tempDir.resolve("broken"));
        Files.createFile(broken.resolve("IMG_0001_nodata.tif"));
        Path beach = Files.createDirectories(tempDir.resolve("beach"));
        Files.createFile(beach.resolve("IMG_0001_125.tif"));
        Path batch = write("{ \"folders\": [ { \"path\": \"%s\" }, { \"path\": \"%s\" } ] }"
            .formatted(json(broken), json(beach)));

        List<FolderRequest> requests = loader.load(batch);

        assertEquals(2, requests.size());
        assertEquals(".tif", requests.get(0).extension());
        assertEquals(".tif", requests.get(1).extension());
    }

    @Test
    void missingFileIsReported() {
        assertThrows(NoSuchFileException.class, () -> loader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void invalidJsonIsReported() throws IOException {
        Path batch = write("{ folders: [");

        IOException error = assertThrows(IOException.class, () -> loader.load(batch));
        assertTrue(error.getMessage().startsWith("Invalid batch file"));
    }

    @Test
    void foldersKeyIsRequired() throws IOException {
        Path batch = write("{ \"items\": [] }");

        IOException error = assertThrows(IOException.class, () -> loader.load(batch));
        assertTrue(error.getMessage().contains("'folders'"));
    }

    private Path write(String content) throws IOException {
        return Files.writeString(tempDir.resolve("batch.json"), content);
    }

    private static String json(Path path) {
        return path.toString().replace("\\", "\\\\");
    }
}
