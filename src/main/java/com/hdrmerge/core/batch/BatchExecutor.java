package com.hdrmerge.core.batch;

import com.hdrmerge.config.AlignMethod;
import com.hdrmerge.config.BatchConfig;
import com.hdrmerge.config.ProcessingProfile;
import com.hdrmerge.config.ProfileResolver;
import com.hdrmerge.config.ToolPaths;
import com.hdrmerge.core.bracket.BracketAnalysis;
import com.hdrmerge.core.bracket.BracketAnalyzer;
import com.hdrmerge.core.exif.ExifMetadataReader;
import com.hdrmerge.core.exif.MetadataReader;
import com.hdrmerge.core.fs.FolderDiscoveryService;
import com.hdrmerge.core.pipeline.Aligner;
import com.hdrmerge.core.pipeline.BatchProgress;
import com.hdrmerge.core.pipeline.ExternalStackAligner;
import com.hdrmerge.core.pipeline.FolderJob;
import com.hdrmerge.core.pipeline.MtbAligner;
import com.hdrmerge.core.pipeline.UnitResult;
import com.hdrmerge.core.process.ExternalStageRunner;
import com.hdrmerge.core.process.StageCommands;
import com.hdrmerge.core.process.StageRunner;
import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs a whole batch: validates the tool configuration, resolves the folders, counts the sets for
 * progress, then feeds every folder's units into one shared worker pool and waits for them.
 * <p>
 * A folder that cannot be read or converted is reported and the others carry on; a failed unit
 * never stops its siblings. {@link #cancel()} stops units that have not started a stage yet;
 * external processes already running finish on their own.
 */
public final class BatchExecutor {
    private static final Logger LOGGER = AppLogger.get();
    private static final DateTimeFormatter CLOCK_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final BatchConfig config;
    private final BatchListener listener;
    private final Notifier notifier;
    private final BracketAnalyzer analyzer;
    private final StageRunner stages;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public BatchExecutor(BatchConfig config, BatchListener listener, Notifier notifier) {
        this(config, listener, notifier, new ExifMetadataReader(), null);
    }

    BatchExecutor(BatchConfig config,
                  BatchListener listener,
                  Notifier notifier,
                  MetadataReader metadataReader,
                  StageRunner stages) {
        this.config = config;
        this.listener = listener == null ? BatchListener.NONE : listener;
        this.notifier = notifier == null ? new LoggingNotifier() : notifier;
        this.analyzer = new BracketAnalyzer(metadataReader);
        this.stages = stages != null ? stages : new ExternalStageRunner(config.stageTimeout(), cancelled::get);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log("Cancellation requested; running tools will finish, pending sets are dropped");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws com.hdrmerge.config.ConfigurationException when a required tool is missing
     * @throws NoMatchingFilesException                   when no folder has a complete set
     * @throws InterruptedIOException                      when the waiting thread is interrupted
     */
    public BatchSummary execute(List<FolderRequest> requests) throws IOException {
        Instant start = Instant.now();
        if (requests == null || requests.isEmpty()) {
            throw new NoMatchingFilesException("No folders to process");
        }
        validateTools(requests);

        List<Path> failedFolders = new ArrayList<>();
        List<Path> noMatchFolders = new ArrayList<>();
        List<FolderRequest> folders = resolveFolders(requests);
        log("Starting [" + LocalTime.now().format(CLOCK_TIME) + "]...");

        List<FolderJob> jobs = countSets(folders, failedFolders, noMatchFolders);
        if (jobs.isEmpty()) {
            log("No matching files found in the input folders.");
            throw new NoMatchingFilesException("No matching files found");
        }
        if (jobs.stream().anyMatch(FolderJob::isRawSource)) {
            ToolPaths.require(config.tools().rawConverter(), "RawTherapee CLI");
        }

        int totalSets = jobs.stream().mapToInt(FolderJob::setCount).sum();
        log("Total sets to process: " + totalSets);
        BatchProgress progress = new BatchProgress(totalSets, listener::onProgress);
        listener.onProgress(progress.percent());

        StageCommands commands = new StageCommands(config.tools());
        Aligner aligner = config.alignMethod() == AlignMethod.IN_PROCESS
            ? new MtbAligner()
            : new ExternalStackAligner(stages, commands);
        FolderProcessor processor = new FolderProcessor(
            analyzer, stages, commands, aligner, config.mergeFilter(), cancelled::get);

        List<Integer> bracketCounts = new ArrayList<>();
        List<Path> processedFolders = new ArrayList<>();
        List<FolderSubmission.SubmittedUnit> pending = new ArrayList<>();
        List<UnitResult> results = new ArrayList<>();

        ExecutorService pool = Executors.newFixedThreadPool(config.threads(), workerThreads());
        try {
            for (FolderJob job : jobs) {
                collectFinished(pending, results);
                if (cancelled.get()) {
                    advance(progress, job.setCount());
                    continue;
                }
                FolderSubmission submission;
                try {
                    submission = processor.process(job, pool, progress);
                } catch (IOException e) {
                    failedFolders.add(job.folderPath());
                    LOGGER.log(Level.SEVERE, "Folder " + job.name() + " failed: " + e.getMessage(), e);
                    listener.onLog("Error processing " + job.folderPath() + ": " + e.getMessage());
                    advance(progress, job.setCount());
                    continue;
                }
                if (submission.isNoMatchingFiles()) {
                    noMatchFolders.add(job.folderPath());
                    listener.onLog("Error processing " + job.folderPath() + ": No matching files found");
                    advance(progress, job.setCount());
                    continue;
                }
                if (submission.setCount() > job.setCount()) {
                    String warning = "Warning: Folder %s has %d sets after RAW conversion but %d were counted; progress will reach 100%% early"
                        .formatted(job.name(), submission.setCount(), job.setCount());
                    LOGGER.warning(warning);
                    listener.onLog(warning);
                }
                // a recount after RAW conversion may differ from the first pass
                advance(progress, job.setCount() - submission.setCount());
                bracketCounts.add(submission.bracketCount());
                processedFolders.add(job.folderPath());
                pending.addAll(submission.units());
            }

            awaitUnits(pending, results);
        } finally {
            pool.shutdownNow();
        }

        if (config.cleanup()) {
            FolderCleaner cleaner = new FolderCleaner();
            for (FolderJob job : jobs) {
                cleaner.clean(job.folderPath(), job.isRawSource());
            }
        }

        BatchSummary summary = summarize(start, jobs, bracketCounts, processedFolders, results,
            failedFolders, noMatchFolders);
        notifyQuietly("Completed processing folders: " + jobs.stream()
            .map(FolderJob::name)
            .collect(Collectors.joining(", ")));
        listener.onComplete(summary);
        return summary;
    }

    private void validateTools(List<FolderRequest> requests) {
        ToolPaths tools = config.tools();
        ToolPaths.require(tools.blender(), "Blender");
        ToolPaths.require(tools.mergeBlend(), "Merge scene");
        ToolPaths.require(tools.mergeScript(), "Merge script");
        ToolPaths.require(tools.toneMapper(), "Luminance HDR CLI");
        boolean externalAlign = config.alignMethod() == AlignMethod.EXTERNAL
            && requests.stream().anyMatch(FolderRequest::align);
        if (externalAlign) {
            ToolPaths.require(tools.aligner(), "align_image_stack");
        }
    }

    /**
     * Expands recursive requests into their image subfolders. Subfolders keep a blank extension
     * unless the request names one; detection happens per folder in {@link #countSets}.
     */
    List<FolderRequest> resolveFolders(List<FolderRequest> requests) {
        Map<Path, FolderRequest> resolved = new LinkedHashMap<>();
        for (FolderRequest request : requests) {
            Path folder = request.folder();
            if (!Files.isDirectory(folder)) {
                log("Warning: Batch folder does not exist: " + folder);
                continue;
            }
            if (!config.recursive()) {
                resolved.putIfAbsent(key(folder), request);
                continue;
            }

            List<String> extensions = request.hasExtension() ? List.of(request.extension()) : config.allExtensions();
            FolderDiscoveryService discovery = new FolderDiscoveryService(extensions, config.ignoreFolders());
            List<Path> found = discovery.findImageFolders(folder, config.maxDepth());
            log("Batch folder '%s' (recursive): Found %d subfolders".formatted(folder, found.size()));
            for (Path subfolder : found) {
                resolved.putIfAbsent(key(subfolder), request.forFolder(subfolder, request.extension(), request.raw()));
            }
        }

        List<FolderRequest> folders = new ArrayList<>(resolved.values());
        log("Batch mode: Processing %d folders".formatted(folders.size()));
        folders.forEach(request -> log("  - " + request.folder()));
        return folders;
    }

    private List<FolderJob> countSets(List<FolderRequest> folders, List<Path> failedFolders, List<Path> noMatchFolders) {
        ProfileResolver profiles = new ProfileResolver(config.profiles());
        FolderInspector inspector = new FolderInspector(config);
        List<FolderJob> jobs = new ArrayList<>();
        for (FolderRequest queued : folders) {
            Path folder = queued.folder();
            FolderRequest request;
            BracketAnalysis analysis;
            try {
                request = detectExtension(inspector, queued);
                if (!request.hasExtension()) {
                    noMatchFolders.add(folder);
                    log("Folder %s: no image files".formatted(folder));
                    continue;
                }
                analysis = analyzer.analyze(folder, request.extension());
            } catch (IOException e) {
                failedFolders.add(folder);
                LOGGER.log(Level.SEVERE, "Folder " + folder + ": cannot be analysed: " + e.getMessage(), e);
                listener.onLog("Error processing " + folder + ": " + e.getMessage());
                continue;
            }
            if (analysis.isEmpty()) {
                noMatchFolders.add(folder);
                log("Folder %s: no matching files for %s".formatted(folder, request.extension()));
                continue;
            }
            Path profilePath = request.raw() ? profileFor(profiles, request) : null;
            jobs.add(new FolderJob(folder, request.extension(), request.raw(), profilePath, request.align(),
                analysis.bracketCount(), analysis.setCount()));
        }
        return jobs;
    }

    private static FolderRequest detectExtension(FolderInspector inspector, FolderRequest request) throws IOException {
        if (request.hasExtension()) {
            return request;
        }
        FolderInspector.FolderAnalysis analysis = inspector.inspect(request.folder());
        return request.forFolder(request.folder(), analysis.extension(), analysis.raw());
    }

    private Path profileFor(ProfileResolver profiles, FolderRequest request) {
        Optional<ProcessingProfile> profile = profiles.resolve(request.folder(), request.profile());
        if (profile.isEmpty()) {
            return null;
        }
        Optional<Path> usable = ToolPaths.usable(profile.get().path());
        if (usable.isEmpty()) {
            LOGGER.warning(() -> "Profile '" + profile.get().name() + "' not found at " + profile.get().path());
        }
        return usable.orElse(null);
    }

    private void awaitUnits(List<FolderSubmission.SubmittedUnit> running,
                            List<UnitResult> results) throws InterruptedIOException {
        while (!running.isEmpty()) {
            collectFinished(running, results);
            if (running.isEmpty()) {
                break;
            }
            try {
                Thread.sleep(config.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting for the batch");
                interrupted.initCause(e);
                throw interrupted;
            }
        }
    }

    private static UnitResult resultOf(FolderSubmission.SubmittedUnit submitted) {
        try {
            return submitted.future().get();
        } catch (ExecutionException e) {
            return UnitResult.failed(submitted.unit(), e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UnitResult.failed(submitted.unit(), e);
        }
    }

    /**
     * Moves finished units from {@code running} to {@code results}, reporting failures as they are seen.
     */
    private void collectFinished(List<FolderSubmission.SubmittedUnit> running, List<UnitResult> results) {
        Iterator<FolderSubmission.SubmittedUnit> it = running.iterator();
        while (it.hasNext()) {
            FolderSubmission.SubmittedUnit submitted = it.next();
            if (!submitted.future().isDone()) {
                continue;
            }
            it.remove();
            UnitResult result = resultOf(submitted);
            results.add(result);
            if (result.isFailed()) {
                listener.onLog("Bracket %d: Exception - %s".formatted(result.unit().index(), result.error().getMessage()));
                UnitFailureLog.logFailure(result.unit(), result.error());
            }
        }
    }

    private static void advance(BatchProgress progress, int units) {
        for (int i = 0; i < units; i++) {
            progress.increment();
        }
    }

    private BatchSummary summarize(Instant start,
                                   List<FolderJob> jobs,
                                   List<Integer> bracketCounts,
                                   List<Path> processedFolders,
                                   List<UnitResult> results,
                                   List<Path> failedFolders,
                                   List<Path> noMatchFolders) {
        Duration duration = Duration.between(start, Instant.now());
        int succeeded = count(results, UnitResult.Status.SUCCESS);
        int skipped = count(results, UnitResult.Status.SKIPPED);
        List<UnitResult> failed = results.stream().filter(UnitResult::isFailed).toList();
        boolean alignment = jobs.stream().anyMatch(FolderJob::alignEnabled);

        double seconds = duration.toMillis() / 1000.0;
        log("Done!!!");
        log("Total time: %.1f seconds (%.1f minutes)".formatted(seconds, seconds / 60));
        log("Alignment: " + (alignment ? "Yes" : "No"));
        log("Images per bracket: " + bracketCounts);
        log("Total sets processed: " + results.size());
        log("Threads used: " + config.threads());
        if (!failed.isEmpty() || !failedFolders.isEmpty()) {
            log("Failed: %d set(s), %d folder(s)".formatted(failed.size(), failedFolders.size()));
        }

        return new BatchSummary(duration, alignment, bracketCounts, results.size(), config.threads(),
            processedFolders, succeeded, skipped, failed, failedFolders, noMatchFolders);
    }

    private static int count(List<UnitResult> results, UnitResult.Status status) {
        return (int) results.stream().filter(result -> result.status() == status).count();
    }

    private void notifyQuietly(String message) {
        try {
            notifier.notify(message);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Completion notification failed: " + e.getMessage(), e);
        }
    }

    private void log(String message) {
        LOGGER.info(message);
        listener.onLog(message);
    }

    private static Path key(Path folder) {
        return folder.toAbsolutePath().normalize();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "hdr-merge-worker-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
