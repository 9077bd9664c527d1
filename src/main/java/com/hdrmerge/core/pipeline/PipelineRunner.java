package com.hdrmerge.core.pipeline;

import com.hdrmerge.core.bracket.BracketSet;
import com.hdrmerge.core.process.StageCommands;
import com.hdrmerge.core.process.StageInvocation;
import com.hdrmerge.core.process.StageRunner;
import com.hdrmerge.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one bracket set through align, merge and tone-map.
 * <p>
 * A set whose EXR already exists is skipped, so rerunning a batch only redoes missing sets. A
 * stage failure fails this unit alone; it is reported through the returned {@link UnitResult},
 * never thrown. The shared progress counter is bumped exactly once per unit, whatever the outcome.
 */
public final class PipelineRunner implements Callable<UnitResult> {
    private static final Logger LOGGER = AppLogger.get();

    private final WorkUnit unit;
    private final StageRunner stages;
    private final StageCommands commands;
    private final Aligner aligner;
    private final BatchProgress progress;
    private final String mergeFilter;
    private final BooleanSupplier cancelRequested;
    private final List<UnitState> states = new ArrayList<>();

    public PipelineRunner(WorkUnit unit,
                          StageRunner stages,
                          StageCommands commands,
                          Aligner aligner,
                          BatchProgress progress,
                          String mergeFilter,
                          BooleanSupplier cancelRequested) {
        this.unit = unit;
        this.stages = stages;
        this.commands = commands;
        this.aligner = aligner;
        this.progress = progress;
        this.mergeFilter = mergeFilter;
        this.cancelRequested = cancelRequested == null ? () -> false : cancelRequested;
        moveTo(UnitState.PENDING);
    }

    @Override
    public UnitResult call() {
        try {
            return runStages();
        } catch (IOException | RuntimeException e) {
            moveTo(UnitState.FAILED);
            LOGGER.log(Level.SEVERE, unit + " failed: " + e.getMessage(), e);
            return UnitResult.failed(unit, e);
        } finally {
            progress.increment();
        }
    }

    private UnitResult runStages() throws IOException {
        OutputLayout layout = unit.layout();
        int index = unit.index();
        Path exr = layout.exrPath(index);
        if (Files.exists(exr)) {
            moveTo(UnitState.SKIP_EXISTING);
            LOGGER.info(() -> unit + ": " + exr.getFileName() + " exists, skipping");
            moveTo(UnitState.DONE);
            return UnitResult.skipped(unit);
        }

        BracketSet set = unit.set();
        if (unit.job().alignEnabled()) {
            checkCancelled();
            moveTo(UnitState.ALIGNING);
            set = aligner.align(unit, set);
        }

        checkCancelled();
        moveTo(UnitState.MERGING);
        Files.createDirectories(layout.exrFolder());
        stages.run(new StageInvocation(StageCommands.MERGE_LABEL, unit.unitId(),
            commands.merge(unit.resolution(), exr, mergeFilter, index, set.members()), layout.root()));
        Files.deleteIfExists(layout.blendBackup(index));

        checkCancelled();
        moveTo(UnitState.TONE_MAPPING);
        Files.createDirectories(layout.jpgFolder());
        stages.run(new StageInvocation(StageCommands.TONEMAP_LABEL, unit.unitId(),
            commands.toneMap(exr, layout.jpgPath(index)), layout.root()));

        moveTo(UnitState.DONE);
        LOGGER.info(() -> unit + " done");
        return UnitResult.success(unit);
    }

    private void checkCancelled() {
        if (cancelRequested.getAsBoolean()) {
            throw new CancellationException(unit + " cancelled");
        }
    }

    private void moveTo(UnitState state) {
        synchronized (states) {
            states.add(state);
        }
    }

    public WorkUnit unit() {
        return unit;
    }

    /**
     * States visited so far, in order.
     */
    public List<UnitState> states() {
        synchronized (states) {
            return List.copyOf(states);
        }
    }
}
