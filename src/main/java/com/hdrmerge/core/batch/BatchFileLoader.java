package com.hdrmerge.core.batch;

import com.hdrmerge.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a saved batch:
 * <pre>
 * { "folders": [ { "path": "...", "profile": "...", "align": false, "extension": ".dng", "is_raw": true } ] }
 * </pre>
 * Entries without {@code extension} are inspected on disk. An entry whose folder cannot be listed
 * is kept without an extension so the batch reports that folder on its own.
 */
public final class BatchFileLoader {
    private static final Logger LOGGER = AppLogger.get();

    private final FolderInspector inspector;

    public BatchFileLoader(FolderInspector inspector) {
        this.inspector = inspector;
    }

    public List<FolderRequest> load(Path batchFile) throws IOException {
        if (!Files.isRegularFile(batchFile)) {
            throw new NoSuchFileException(batchFile.toString(), null, "Batch file not found");
        }
        JSONObject root;
        try {
            root = new JSONObject(Files.readString(batchFile));
        } catch (JSONException e) {
            throw new IOException("Invalid batch file " + batchFile + ": " + e.getMessage(), e);
        }
        JSONArray folders = root.optJSONArray("folders");
        if (folders == null) {
            throw new IOException("Invalid batch file format: missing 'folders' key");
        }

        List<FolderRequest> requests = new ArrayList<>();
        for (int i = 0; i < folders.length(); i++) {
            JSONObject entry = folders.optJSONObject(i);
            String path = entry == null ? "" : entry.optString("path", "").trim();
            if (path.isEmpty()) {
                LOGGER.warning("Skipping batch entry #" + i + ": no path");
                continue;
            }
            requests.add(toRequest(entry, Paths.get(path)));
        }
        LOGGER.fine(() -> "Loaded " + requests.size() + " folder(s) from " + batchFile);
        return requests;
    }

    private FolderRequest toRequest(JSONObject entry, Path folder) {
        String profile = entry.optString("profile", "");
        boolean align = entry.optBoolean("align", false);
        if (!entry.has("extension")) {
            try {
                return inspector.requestFor(folder, profile, align);
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Cannot inspect batch folder " + folder + ": " + e.getMessage(), e);
                return new FolderRequest(folder, profile, align, "", false);
            }
        }
        return new FolderRequest(folder, profile, align, entry.optString("extension", ""), entry.optBoolean("is_raw", false));
    }
}
