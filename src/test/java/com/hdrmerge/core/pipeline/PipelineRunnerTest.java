package com.hdrmerge.core.pipeline;

import com.hdrmerge.config.ToolPaths;
import com.hdrmerge.core.bracket.BracketMember;
import com.hdrmerge.core.bracket.BracketSet;
import com.hdrmerge.core.process.RecordingStageRunner;
import com.hdrmerge.core.process.StageCommands;
import com.hdrmerge.core.process.StageExecutionException;
import com.hdrmerge.core.process.StageInvocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineRunnerTest {

    @TempDir
    Path tempDir;

    private Path folder;
    private StageCommands commands;
    private BatchProgress progress;

    @BeforeEach
    void setUp() throws IOException {
        folder = Files.createDirectories(tempDir.resolve("beach"));
        commands = new StageCommands(new ToolPaths(
            Paths.get("rawtherapee-cli"),
            Paths.get("align_image_stack"),
            Paths.get("blender"),
            tempDir.resolve("HDR_Merge.blend"),
            tempDir.resolve("blender_merge.py"),
            Paths.get("luminance-hdr-cli")));
        progress = new BatchProgress(5);
    }

    @Test
    void existingExrSkipsEveryStage() throws IOException {
        WorkUnit unit = unit(false);
        Path exr = unit.layout().exrPath(1);
        Files.createDirectories(exr.getParent());
        Files.createFile(exr);
        RecordingStageRunner stages = new RecordingStageRunner();
        PipelineRunner runner = runner(unit, stages, new ExternalStackAligner(stages, commands), () -> false);

        UnitResult result = runner.call();

        assertEquals(UnitResult.Status.SKIPPED, result.status());
        assertEquals(List.of(UnitState.PENDING, UnitState.SKIP_EXISTING, UnitState.DONE), runner.states());
        assertTrue(stages.invocations().isEmpty());
        assertEquals(1, progress.completedUnits());
    }

    @Test
    void mergesThenToneMapsAndRemovesBlenderBackup() throws IOException {
        WorkUnit unit = unit(false);
        OutputLayout layout = unit.layout();
        Files.createDirectories(layout.exrFolder());
        Files.createFile(layout.blendBackup(1));
        RecordingStageRunner stages = new RecordingStageRunner();
        PipelineRunner runner = runner(unit, stages, new ExternalStackAligner(stages, commands), () -> false);

        UnitResult result = runner.call();

        assertEquals(UnitResult.Status.SUCCESS, result.status());
        assertEquals(List.of(StageCommands.MERGE_LABEL, StageCommands.TONEMAP_LABEL), stages.labels());
        assertEquals(List.of(UnitState.PENDING, UnitState.MERGING, UnitState.TONE_MAPPING, UnitState.DONE),
            runner.states());
        assertTrue(Files.exists(layout.exrPath(1)));
        assertTrue(Files.exists(layout.jpgPath(1)));
        assertFalse(Files.exists(layout.blendBackup(1)));

        StageInvocation merge = stages.invocations().get(0);
        assertEquals("001", merge.unitId());
        assertEquals(layout.root(), merge.outputRoot());
        assertTrue(merge.command().contains("6000x4000"));
    }

    @Test
    void alignedFilesReplaceSourcesButKeepEvs() {
        WorkUnit unit = unit(true);
        RecordingStageRunner stages = new RecordingStageRunner();
        PipelineRunner runner = runner(unit, stages, new ExternalStackAligner(stages, commands), () -> false);

        UnitResult result = runner.call();

        assertEquals(UnitResult.Status.SUCCESS, result.status());
        assertEquals(List.of(StageCommands.ALIGN_LABEL, StageCommands.MERGE_LABEL, StageCommands.TONEMAP_LABEL),
            stages.labels());
        assertEquals(UnitState.ALIGNING, runner.states().get(1));

        List<String> mergeArgs = stages.invocations().get(1).command();
        String first = mergeArgs.get(mergeArgs.size() - 2);
        String second = mergeArgs.get(mergeArgs.size() - 1);
        assertTrue(first.endsWith("/aligned/align_1_0000.tif___2.0"), first);
        assertTrue(second.endsWith("/aligned/align_1_0001.tif___0.0"), second);
    }

    @Test
    void stageFailureFailsOnlyThisUnit() {
        WorkUnit unit = unit(false);
        RecordingStageRunner stages = new RecordingStageRunner(
            invocation -> invocation.label().equals(StageCommands.MERGE_LABEL));
        PipelineRunner runner = runner(unit, stages, new ExternalStackAligner(stages, commands), () -> false);

        UnitResult result = runner.call();

        assertTrue(result.isFailed());
        StageExecutionException error = assertInstanceOf(StageExecutionException.class, result.error());
        assertEquals(2, error.exitCode());
        assertEquals(List.of(StageCommands.MERGE_LABEL), stages.labels());
        assertEquals(UnitState.FAILED, runner.states().get(runner.states().size() - 1));
        assertEquals(1, progress.completedUnits());
    }

    @Test
    void cancelledUnitRunsNoStage() {
        WorkUnit unit = unit(true);
        RecordingStageRunner stages = new RecordingStageRunner();
        PipelineRunner runner = runner(unit, stages, new ExternalStackAligner(stages, commands), () -> true);

        UnitResult result = runner.call();

        assertTrue(result.isFailed());
        assertInstanceOf(CancellationException.class, result.error());
        assertTrue(stages.invocations().isEmpty());
        assertEquals(1, progress.completedUnits());
    }

    @Test
    void alignerWithoutOutputFails() {
        WorkUnit unit = unit(true);
        ExternalStackAligner aligner = new ExternalStackAligner(invocation -> { }, commands);

        StageExecutionException error = assertThrows(StageExecutionException.class,
            () -> aligner.align(unit, unit.set()));
        assertEquals(StageCommands.ALIGN_LABEL, error.stage());
    }

    private PipelineRunner runner(WorkUnit unit, RecordingStageRunner stages, Aligner aligner,
                                  BooleanSupplier cancelled) {
        return new PipelineRunner(unit, stages, commands, aligner, progress, "None", cancelled);
    }

    private WorkUnit unit(boolean align) {
        FolderJob job = new FolderJob(folder, ".tif", false, null, align, 2, 2);
        BracketSet set = new BracketSet(1, List.of(
            new BracketMember(folder.resolve("IMG_0003.tif"), 2.0),
            new BracketMember(folder.resolve("IMG_0004.tif"), 0.0)));
        return new WorkUnit(job, set, "6000x4000");
    }
}
