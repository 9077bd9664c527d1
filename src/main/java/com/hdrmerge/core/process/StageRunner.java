package com.hdrmerge.core.process;

/**
 * Runs one external stage: RAW conversion, alignment, merge or tone-map.
 */
@FunctionalInterface
public interface StageRunner {

    void run(StageInvocation invocation) throws StageExecutionException;
}
