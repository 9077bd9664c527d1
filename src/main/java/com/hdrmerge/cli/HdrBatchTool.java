package com.hdrmerge.cli;

import com.hdrmerge.config.BatchConfig;
import com.hdrmerge.config.ConfigService;
import com.hdrmerge.config.ConfigurationException;
import com.hdrmerge.core.batch.BatchExecutor;
import com.hdrmerge.core.batch.BatchFileLoader;
import com.hdrmerge.core.batch.BatchListener;
import com.hdrmerge.core.batch.BatchSummary;
import com.hdrmerge.core.batch.FolderInspector;
import com.hdrmerge.core.batch.FolderRequest;
import com.hdrmerge.core.batch.LoggingNotifier;
import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Headless entry point: merges the queued folders and exits with 0 when every set came through,
 * 1 otherwise.
 */
public final class HdrBatchTool {
    private static final Logger LOGGER = AppLogger.get();

    private HdrBatchTool() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.print(CliOptions.USAGE);
            return 1;
        }
        if (options.help()) {
            out.print(CliOptions.USAGE);
            return 0;
        }
        AppLogger.setVerbose(options.verbose());

        try {
            BatchConfig config = configure(options);
            FolderInspector inspector = new FolderInspector(config);
            List<FolderRequest> requests = collectRequests(options, inspector, out);
            if (requests.isEmpty()) {
                err.println("Error: No folders to process!");
                return 1;
            }

            printHeader(out, config, requests);
            BatchExecutor executor = new BatchExecutor(config, new ConsoleListener(out), new LoggingNotifier());
            BatchSummary summary = executor.execute(requests);
            printSummary(out, summary);
            return summary.hasFailures() ? 1 : 0;
        } catch (ConfigurationException | IOException e) {
            LOGGER.log(Level.FINE, "Batch aborted", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static BatchConfig configure(CliOptions options) throws IOException {
        Path configFile = options.configFile() != null ? options.configFile() : ConfigService.defaultConfigPath();
        BatchConfig config = ConfigService.load(configFile);
        if (options.threads() != null) {
            config = config.withThreads(options.threads());
        }
        if (options.recursive()) {
            config = config.withRecursive(true);
        }
        if (options.cleanup()) {
            config = config.withCleanup(true);
        }
        return config;
    }

    private static List<FolderRequest> collectRequests(CliOptions options, FolderInspector inspector, PrintStream out)
        throws IOException {
        List<FolderRequest> requests = new ArrayList<>();
        if (options.batchFile() != null) {
            requests.addAll(new BatchFileLoader(inspector).load(options.batchFile()));
            out.println("Loaded " + requests.size() + " folders from: " + options.batchFile());
        }
        if (options.folder() != null) {
            Path folder = options.folder().toAbsolutePath();
            if (!Files.isDirectory(folder)) {
                out.println("Warning: Folder does not exist: " + options.folder());
            } else if (options.recursive()) {
                // sub-folders are found and inspected by the executor
                requests.add(new FolderRequest(folder, options.profile(), options.align(), "", false));
                out.println("Added folder (recursive): " + folder);
            } else {
                requests.add(inspector.requestFor(folder, options.profile(), options.align()));
                out.println("Added 1 folder(s): " + folder);
            }
        }
        return requests;
    }

    private static void printHeader(PrintStream out, BatchConfig config, List<FolderRequest> requests) {
        String rule = "=".repeat(60);
        out.println();
        out.println(rule);
        out.println("HDR Merge - Headless Processing");
        out.println(rule);
        out.println("Folders to process: " + requests.size());
        out.println("Threads: " + config.threads());
        out.println("Cleanup: " + (config.cleanup() ? "Yes" : "No"));
        out.println("Align folders: " + requests.stream().filter(FolderRequest::align).count());
        for (FolderRequest request : requests) {
            String kind = request.raw() ? "RAW" : "Processed";
            String profile = request.raw() && !request.profile().isEmpty() ? " (Profile: " + request.profile() + ")" : "";
            String align = request.align() ? " [Align]" : "";
            out.println("  - " + request.folder().getFileName() + ": " + kind + profile + align);
        }
        out.println();
    }

    private static void printSummary(PrintStream out, BatchSummary summary) {
        String rule = "=".repeat(60);
        out.println();
        out.println(rule);
        out.println("Processing Complete!");
        out.println(rule);
        out.println(String.format(Locale.ROOT, "Duration: %.1f seconds", summary.duration().toMillis() / 1000.0));
        out.println("Total sets processed: " + summary.totalSets());
        out.println("Merged: " + summary.succeeded() + ", skipped: " + summary.skipped()
            + ", failed: " + summary.failedUnits().size());
        if (!summary.failedFolders().isEmpty()) {
            out.println("Failed folders: " + summary.failedFolders());
        }
        out.println("Threads used: " + summary.threads());
        out.println(rule);
    }

    /**
     * Prints progress; log lines already reach the console through {@link AppLogger}.
     */
    static final class ConsoleListener implements BatchListener {
        private final PrintStream out;

        ConsoleListener(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onProgress(int percent) {
            out.println("Progress: " + percent + "%");
        }
    }
}
