package com.hdrmerge.core.batch;

import com.hdrmerge.core.bracket.BracketAnalysis;
import com.hdrmerge.core.bracket.BracketAnalyzer;
import com.hdrmerge.core.bracket.BracketSet;
import com.hdrmerge.core.fs.ImageFileLister;
import com.hdrmerge.core.pipeline.Aligner;
import com.hdrmerge.core.pipeline.BatchProgress;
import com.hdrmerge.core.pipeline.FolderJob;
import com.hdrmerge.core.pipeline.OutputLayout;
import com.hdrmerge.core.pipeline.PipelineRunner;
import com.hdrmerge.core.pipeline.UnitResult;
import com.hdrmerge.core.pipeline.WorkUnit;
import com.hdrmerge.core.process.StageCommands;
import com.hdrmerge.core.process.StageInvocation;
import com.hdrmerge.core.process.StageRunner;
import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * Turns one folder into work units: converts RAW files when needed, analyzes the brackets and
 * submits one {@link PipelineRunner} per set to the shared pool.
 */
public final class FolderProcessor {
    private static final Logger LOGGER = AppLogger.get();

    static final String TIF_FOLDER_NAME = "tif";
    static final String CONVERTED_EXTENSION = ".tif";

    private final BracketAnalyzer analyzer;
    private final StageRunner stages;
    private final StageCommands commands;
    private final Aligner aligner;
    private final String mergeFilter;
    private final BooleanSupplier cancelRequested;

    public FolderProcessor(BracketAnalyzer analyzer,
                           StageRunner stages,
                           StageCommands commands,
                           Aligner aligner,
                           String mergeFilter,
                           BooleanSupplier cancelRequested) {
        this.analyzer = analyzer;
        this.stages = stages;
        this.commands = commands;
        this.aligner = aligner;
        this.mergeFilter = mergeFilter;
        this.cancelRequested = cancelRequested;
    }

    public static Path tifFolder(Path folder) {
        return folder.resolve(TIF_FOLDER_NAME);
    }

    /**
     * @throws IOException when RAW conversion or metadata reading fails for the whole folder
     */
    public FolderSubmission process(FolderJob job, ExecutorService pool, BatchProgress progress) throws IOException {
        Path sourceFolder = job.folderPath();
        String extension = job.extension();

        if (job.isRawSource()) {
            if (job.profile().isEmpty()) {
                LOGGER.warning(() -> "Folder " + job.name() + ": no usable RAW profile, merging RAW files directly");
            } else if (allMerged(job)) {
                LOGGER.info(() -> "Folder " + job.name() + ": every set already merged, skipping RAW conversion");
            } else {
                sourceFolder = convertRaw(job, job.profile().get());
                extension = CONVERTED_EXTENSION;
            }
        }

        BracketAnalysis analysis = analyzer.analyze(sourceFolder, extension);
        if (analysis.isEmpty()) {
            LOGGER.warning(() -> "Folder " + job.name() + ": no matching files found");
            return FolderSubmission.noMatchingFiles(job);
        }
        if (analysis.droppedFiles() > 0) {
            LOGGER.warning(() -> "Folder %s: %d trailing file(s) do not fill a set of %d and are ignored".formatted(
                job.name(), analysis.droppedFiles(), analysis.bracketCount()));
        }
        LOGGER.info(() -> "Folder %s: %d brackets, %d sets".formatted(
            job.name(), analysis.bracketCount(), analysis.setCount()));

        List<FolderSubmission.SubmittedUnit> units = new ArrayList<>(analysis.setCount());
        for (BracketSet set : analysis.sets()) {
            WorkUnit unit = new WorkUnit(job, set, analysis.resolution());
            PipelineRunner runner = new PipelineRunner(
                unit, stages, commands, aligner, progress, mergeFilter, cancelRequested);
            Future<UnitResult> future = pool.submit(runner);
            units.add(new FolderSubmission.SubmittedUnit(unit, future));
        }
        return new FolderSubmission(job, analysis.bracketCount(), units);
    }

    private Path convertRaw(FolderJob job, Path profile) throws IOException {
        Path folder = job.folderPath();
        List<Path> rawFiles = ImageFileLister.list(folder, job.extension());
        Path tifFolder = tifFolder(folder);
        if (rawFiles.isEmpty()) {
            return tifFolder;
        }
        Files.createDirectories(tifFolder);
        LOGGER.info(() -> "Folder %s: converting %d RAW files with %s".formatted(
            job.name(), rawFiles.size(), profile.getFileName()));
        stages.run(new StageInvocation(StageCommands.RAW_LABEL, "all",
            commands.rawConversion(profile, tifFolder, rawFiles), job.outputLayout().root()));
        LOGGER.info(() -> "Folder " + job.name() + ": TIFFs saved to " + tifFolder);
        return tifFolder;
    }

    private static boolean allMerged(FolderJob job) {
        if (job.setCount() == 0) {
            return false;
        }
        OutputLayout layout = job.outputLayout();
        for (int index = 0; index < job.setCount(); index++) {
            if (!Files.exists(layout.exrPath(index))) {
                return false;
            }
        }
        return true;
    }
}
