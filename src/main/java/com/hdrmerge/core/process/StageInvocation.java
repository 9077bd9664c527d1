package com.hdrmerge.core.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One external tool call.
 *
 * @param label      stage name used in the log file name, e.g. {@code blender}
 * @param unitId     zero-padded bracket index the call belongs to
 * @param command    program followed by its arguments
 * @param outputRoot folder whose {@code logs} sub-folder receives the captured output
 */
public record StageInvocation(String label, String unitId, List<String> command, Path outputRoot) {

    public StageInvocation {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(outputRoot, "outputRoot");
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must name a program");
        }
    }

    public String program() {
        return command.get(0);
    }
}
