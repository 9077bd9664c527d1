package com.hdrmerge.cli;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parsed command line of {@link HdrBatchTool}.
 *
 * @param threads worker count, {@code null} to keep the configured value
 */
public record CliOptions(Path batchFile,
                         Path folder,
                         boolean recursive,
                         String profile,
                         boolean align,
                         Integer threads,
                         boolean cleanup,
                         boolean verbose,
                         Path configFile,
                         boolean help) {

    static final String USAGE = """
        Usage: hdr-merge-batch [options]
          -b, --batch FILE     load the folder list from a JSON batch file
          -f, --folder PATH    add a single folder
          -r, --recursive      process the sub-folders of each folder
          -p, --profile NAME   RawTherapee profile for RAW folders
          -a, --align          align every set before merging
          -t, --threads N      number of worker threads
          -c, --cleanup        delete aligned and converted intermediates afterwards
          -v, --verbose        print every log line
              --config FILE    configuration file (default ~/.hdrmerge/config.json)
          -h, --help           show this help
        """;

    public static CliOptions parse(String[] args) {
        Path batchFile = null;
        Path folder = null;
        boolean recursive = false;
        String profile = "";
        boolean align = false;
        Integer threads = null;
        boolean cleanup = false;
        boolean verbose = false;
        Path configFile = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-b", "--batch" -> batchFile = Paths.get(value(args, ++i, arg));
                case "-f", "--folder" -> folder = Paths.get(value(args, ++i, arg));
                case "-r", "--recursive" -> recursive = true;
                case "-p", "--profile" -> profile = value(args, ++i, arg);
                case "-a", "--align" -> align = true;
                case "-t", "--threads" -> threads = parseThreads(value(args, ++i, arg));
                case "-c", "--cleanup" -> cleanup = true;
                case "-v", "--verbose" -> verbose = true;
                case "--config" -> configFile = Paths.get(value(args, ++i, arg));
                case "-h", "--help" -> help = true;
                // accepted for older launch scripts
                case "--cli" -> { }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (!help && batchFile == null && folder == null) {
            throw new IllegalArgumentException("Must specify either --batch or --folder");
        }
        return new CliOptions(batchFile, folder, recursive, profile, align, threads, cleanup, verbose, configFile, help);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].isBlank()) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index].trim();
    }

    private static int parseThreads(String text) {
        try {
            int threads = Integer.parseInt(text);
            if (threads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1: " + text);
            }
            return threads;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--threads needs a number: " + text, e);
        }
    }
}
