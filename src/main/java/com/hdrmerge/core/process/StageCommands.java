package com.hdrmerge.core.process;

import com.hdrmerge.config.ToolPaths;
import com.hdrmerge.core.bracket.BracketMember;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Argument layouts of the external tools. Paths are passed absolute with forward slashes, which
 * every tool accepts on Windows as well.
 */
public final class StageCommands {

    public static final String RAW_LABEL = "rawtherapee";
    public static final String ALIGN_LABEL = "align";
    public static final String MERGE_LABEL = "blender";
    public static final String TONEMAP_LABEL = "luminance";

    private final ToolPaths tools;

    public StageCommands(ToolPaths tools) {
        this.tools = tools;
    }

    /**
     * {@code rawtherapee-cli -p <profile> -o <tif folder> -t -c <raw files...>}: 16-bit TIFF output.
     */
    public List<String> rawConversion(Path profile, Path tifFolder, List<Path> rawFiles) {
        List<String> command = new ArrayList<>();
        command.add(program(tools.rawConverter()));
        command.add("-p");
        command.add(text(profile));
        command.add("-o");
        command.add(text(tifFolder));
        command.add("-t");
        command.add("-c");
        rawFiles.forEach(file -> command.add(text(file)));
        return command;
    }

    /**
     * {@code align_image_stack -v -i -l -a <prefix> --gpu <files...>}; output files are named
     * {@code <prefix>0000.tif}, {@code <prefix>0001.tif}, ...
     */
    public List<String> align(String outputPrefix, List<Path> files) {
        List<String> command = new ArrayList<>(List.of(
            program(tools.aligner()), "-v", "-i", "-l", "-a", outputPrefix, "--gpu"));
        files.forEach(file -> command.add(text(file)));
        return command;
    }

    /**
     * Blender in background mode running the merge script; everything after {@code --} is read
     * by the script: resolution, output EXR, filter label, bracket index, then
     * {@code path___ev} per exposure.
     */
    public List<String> merge(String resolution, Path exrPath, String filter, int index, List<BracketMember> members) {
        List<String> command = new ArrayList<>(List.of(
            program(tools.blender()),
            "--background",
            text(tools.mergeBlend()),
            "--factory-startup",
            "--python",
            text(tools.mergeScript()),
            "--",
            resolution,
            text(exrPath),
            filter,
            String.valueOf(index)
        ));
        members.forEach(member -> command.add(member.toMergeArgument()));
        return command;
    }

    /**
     * {@code luminance-hdr-cli -l <exr> --tmo reinhard02 -q 98 -o <jpg>}.
     */
    public List<String> toneMap(Path exrPath, Path jpgPath) {
        return List.of(
            program(tools.toneMapper()),
            "-l",
            text(exrPath),
            "--tmo",
            "reinhard02",
            "-q",
            "98",
            "-o",
            text(jpgPath)
        );
    }

    // left as configured so a bare name is looked up on PATH
    private static String program(Path executable) {
        return executable.toString();
    }

    static String text(Path path) {
        return path.toAbsolutePath().toString().replace('\\', '/');
    }
}
