package com.hdrmerge.config;

import com.hdrmerge.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads {@code config.json} into a {@link BatchConfig}. Defaults are merged once here, so the
 * rest of the code never checks whether a key exists.
 * <p>
 * Layout (all sections optional):
 * <pre>
 * {
 *   "exe_paths":   { "rawtherapee_cli_exe", "align_image_stack_exe", "blender_exe",
 *                    "merge_blend", "merge_py", "luminance_cli_exe" },
 *   "gui_settings": { "threads", "do_recursive", "recursive_max_depth", "recursive_ignore_folders",
 *                    "raw_extensions", "processed_extensions", "align_method", "cleanup" },
 *   "processing":  { "poll_interval_ms", "stage_timeout_seconds", "merge_filter" },
 *   "pp3_profiles": [ { "name", "path", "folder_key", "default" } ]
 * }
 * </pre>
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    private static final String CONFIG_PATH_PROPERTY = "hdrmerge.config";
    private static final String THREADS_PROPERTY = "hdrmerge.threads";

    private ConfigService() {
    }

    public static Path defaultConfigPath() {
        String override = System.getProperty(CONFIG_PATH_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override);
        }
        return Paths.get(System.getProperty("user.home"), ".hdrmerge", "config.json");
    }

    /**
     * Loads the file when it exists, otherwise returns the defaults.
     */
    public static BatchConfig load(Path configFile) throws IOException {
        if (configFile == null || !Files.isRegularFile(configFile) || Files.size(configFile) == 0) {
            LOGGER.info(() -> "No configuration at " + configFile + ", using defaults");
            return applySystemOverrides(BatchConfig.defaults());
        }
        String content = Files.readString(configFile);
        try {
            return applySystemOverrides(fromJson(new JSONObject(content)));
        } catch (JSONException e) {
            throw new IOException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }
    }

    static BatchConfig fromJson(JSONObject root) {
        BatchConfig defaults = BatchConfig.defaults();
        ToolPaths tools = readTools(root.optJSONObject("exe_paths"), defaults.tools());

        JSONObject gui = root.optJSONObject("gui_settings");
        if (gui == null) {
            gui = new JSONObject();
        }
        JSONObject processing = root.optJSONObject("processing");
        if (processing == null) {
            processing = new JSONObject();
        }

        Duration stageTimeout = null;
        long timeoutSeconds = processing.optLong("stage_timeout_seconds", 0);
        if (timeoutSeconds > 0) {
            stageTimeout = Duration.ofSeconds(timeoutSeconds);
        }

        return new BatchConfig(
            tools,
            parseThreads(gui.opt("threads"), defaults.threads()),
            gui.optBoolean("do_recursive", defaults.recursive()),
            gui.optInt("recursive_max_depth", defaults.maxDepth()),
            readStrings(gui.optJSONArray("recursive_ignore_folders"), defaults.ignoreFolders()),
            readStrings(gui.optJSONArray("raw_extensions"), defaults.rawExtensions()),
            readStrings(gui.optJSONArray("processed_extensions"), defaults.processedExtensions()),
            AlignMethod.parse(gui.optString("align_method", null)),
            Duration.ofMillis(processing.optLong("poll_interval_ms", defaults.pollInterval().toMillis())),
            stageTimeout,
            gui.optBoolean("cleanup", defaults.cleanup()),
            processing.optString("merge_filter", defaults.mergeFilter()),
            readProfiles(root.optJSONArray("pp3_profiles"))
        );
    }

    private static ToolPaths readTools(JSONObject exePaths, ToolPaths defaults) {
        if (exePaths == null) {
            return defaults;
        }
        return new ToolPaths(
            pathOr(exePaths, "rawtherapee_cli_exe", defaults.rawConverter()),
            pathOr(exePaths, "align_image_stack_exe", defaults.aligner()),
            pathOr(exePaths, "blender_exe", defaults.blender()),
            pathOr(exePaths, "merge_blend", defaults.mergeBlend()),
            pathOr(exePaths, "merge_py", defaults.mergeScript()),
            pathOr(exePaths, "luminance_cli_exe", defaults.toneMapper())
        );
    }

    private static Path pathOr(JSONObject object, String key, Path fallback) {
        String value = object.optString(key, "");
        return value.isBlank() ? fallback : Paths.get(value.trim());
    }

    // the GUI stored the thread count as a string
    private static int parseThreads(Object raw, int fallback) {
        if (raw instanceof Number number) {
            return Math.max(1, number.intValue());
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Math.max(1, Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                LOGGER.warning("Ignoring invalid thread count '" + text + "'");
            }
        }
        return fallback;
    }

    private static List<String> readStrings(JSONArray array, List<String> fallback) {
        if (array == null) {
            return fallback;
        }
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            String value = array.optString(i, "").trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private static List<ProcessingProfile> readProfiles(JSONArray array) {
        List<ProcessingProfile> profiles = new ArrayList<>();
        if (array == null) {
            return profiles;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject node = array.optJSONObject(i);
            if (node == null) {
                continue;
            }
            String name = node.optString("name", "").trim();
            String path = node.optString("path", "").trim();
            if (name.isEmpty() || path.isEmpty()) {
                LOGGER.warning("Skipping PP3 profile #" + i + ": name and path are required");
                continue;
            }
            profiles.add(new ProcessingProfile(
                name,
                Paths.get(path),
                node.optString("folder_key", ""),
                node.optBoolean("default", false)
            ));
        }
        return profiles;
    }

    private static BatchConfig applySystemOverrides(BatchConfig config) {
        String threads = System.getProperty(THREADS_PROPERTY);
        if (threads == null || threads.isBlank()) {
            return config;
        }
        try {
            return config.withThreads(Math.max(1, Integer.parseInt(threads.trim())));
        } catch (NumberFormatException e) {
            LOGGER.warning("Ignoring -D" + THREADS_PROPERTY + "=" + threads);
            return config;
        }
    }
}
