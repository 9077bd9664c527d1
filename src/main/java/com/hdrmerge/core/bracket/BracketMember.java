package com.hdrmerge.core.bracket;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One exposure of a bracket set. {@code evOffset} is the number of stops this exposure sits
 * below the brightest position of the pattern, so the brightest exposure carries {@code 0}.
 */
public record BracketMember(Path file, double evOffset) {

    public BracketMember {
        Objects.requireNonNull(file, "file");
    }

    /**
     * Encoding understood by the merge script: {@code <absolute path>___<ev>}.
     */
    public String toMergeArgument() {
        return file.toAbsolutePath().toString().replace('\\', '/') + "___" + evOffset;
    }
}
