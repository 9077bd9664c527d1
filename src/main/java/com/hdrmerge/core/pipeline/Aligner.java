package com.hdrmerge.core.pipeline;

import com.hdrmerge.core.bracket.BracketSet;

import java.io.IOException;

/**
 * Registers the exposures of one set against each other.
 */
@FunctionalInterface
public interface Aligner {

    /**
     * Writes aligned copies into the unit's {@code aligned} folder and returns the set pointing at
     * them, in the same order and with the same EV offsets.
     */
    BracketSet align(WorkUnit unit, BracketSet set) throws IOException;
}
