package com.hdrmerge.core.pipeline;

import com.hdrmerge.core.bracket.BracketSet;
import com.hdrmerge.core.process.StageCommands;
import com.hdrmerge.core.process.StageExecutionException;
import com.hdrmerge.core.process.StageInvocation;
import com.hdrmerge.core.process.StageRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Aligns with {@code align_image_stack}, which writes {@code align_<set>_0000.tif} and onwards.
 */
public final class ExternalStackAligner implements Aligner {

    private final StageRunner stages;
    private final StageCommands commands;

    public ExternalStackAligner(StageRunner stages, StageCommands commands) {
        this.stages = stages;
        this.commands = commands;
    }

    @Override
    public BracketSet align(WorkUnit unit, BracketSet set) throws IOException {
        OutputLayout layout = unit.layout();
        Files.createDirectories(layout.alignFolder());

        List<String> command = commands.align(layout.alignPrefix(set.index()), set.files());
        stages.run(new StageInvocation(StageCommands.ALIGN_LABEL, unit.unitId(), command, layout.root()));

        List<Path> aligned = new ArrayList<>(set.size());
        for (int position = 0; position < set.size(); position++) {
            Path file = layout.alignedFile(set.index(), position);
            if (!Files.isRegularFile(file)) {
                throw new StageExecutionException(StageCommands.ALIGN_LABEL, StageExecutionException.NO_EXIT_CODE, null,
                    "Aligner did not produce " + file.getFileName() + " for bracket " + unit.unitId());
            }
            aligned.add(file);
        }
        return set.withFiles(aligned);
    }
}
