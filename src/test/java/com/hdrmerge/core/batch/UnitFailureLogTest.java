package com.hdrmerge.core.batch;

import com.hdrmerge.core.bracket.BracketMember;
import com.hdrmerge.core.bracket.BracketSet;
import com.hdrmerge.core.pipeline.FolderJob;
import com.hdrmerge.core.pipeline.WorkUnit;
import com.hdrmerge.core.process.StageExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnitFailureLogTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsRowsUnderSingleHeader() throws IOException {
        WorkUnit first = unit(0);
        WorkUnit second = unit(4);

        UnitFailureLog.logFailure(first, new StageExecutionException("blender", 3, null, "blender exited with code 3"));
        UnitFailureLog.logFailure(second, new IOException("disk full, retry later"));

        List<String> lines = Files.readAllLines(UnitFailureLog.fileFor(first));
        assertEquals(3, lines.size());
        assertEquals("timestamp,folder,bracket,stage,exit_code,exception_type,message", lines.get(0));
        assertTrue(lines.get(1).endsWith(",000,blender,3,"
            + StageExecutionException.class.getName() + ",blender exited with code 3"), lines.get(1));
        assertTrue(lines.get(2).endsWith(",004,,,java.io.IOException,\"disk full, retry later\""), lines.get(2));
    }

    @Test
    void logFileLivesInFolderLogs() {
        assertEquals(tempDir.resolve("Merged/logs/failures.csv"), UnitFailureLog.fileFor(unit(1)));
    }

    @Test
    void quotesSeparatorsAndQuotes() {
        assertEquals("a,\"b,c\",\"say \"\"hi\"\"\",", UnitFailureLog.toCsv(new String[] {"a", "b,c", "say \"hi\"", null}));
    }

    private WorkUnit unit(int index) {
        FolderJob job = new FolderJob(tempDir, ".tif", false, null, false, 1, 5);
        BracketSet set = new BracketSet(index, List.of(new BracketMember(tempDir.resolve("a.tif"), 0.0)));
        return new WorkUnit(job, set, "10x10");
    }
}
