package cssmin.tool;

import static lombok.AccessLevel.PRIVATE;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import cssmin.minifier.Minifier;
import cssmin.minifier.MinifierSettings;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(access = PRIVATE)
public class CssMin {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 64;

    private static final String STDIN = "-";
    private static final String USAGE =
        "Usage: cssmin [--important-comments] [--cache-dir <dir>] [--exclude <glob>]... [file|-]...";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Flags flags;
        try {
            flags = Flags.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("cssmin: " + ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        var minifier = new Minifier(MinifierSettings.builder()
            .preserveImportantComments(flags.importantComments)
            .build());

        StylesheetCache cache = null;
        if (flags.cacheDir != null) {
            try {
                cache = StylesheetCache.open(flags.cacheDir, minifier, flags.excluded);
            } catch (IOException ex) {
                report(err, "cannot open cache " + flags.cacheDir, ex);
                return EXIT_FAILURE;
            }
        }

        var inputs = flags.inputs.isEmpty() ? List.of(STDIN) : flags.inputs;
        var exitCode = EXIT_OK;
        for (var input : inputs) {
            try {
                out.println(minifyInput(input, minifier, cache, in));
            } catch (IOException ex) {
                report(err, input, ex);
                exitCode = EXIT_FAILURE;
            }
        }
        return exitCode;
    }

    private static String minifyInput(String input, Minifier minifier, StylesheetCache cache, InputStream in)
            throws IOException {
        if (STDIN.equals(input)) {
            var bytes = in.readAllBytes();
            return minifier.minify(new String(bytes, StandardCharsets.UTF_8));
        }

        var path = Paths.get(input);
        if (cache == null) {
            return minifier.minify(Files.readString(path, StandardCharsets.UTF_8));
        }

        var cached = cache.minify(path);
        if (cached.isPresent()) {
            return Files.readString(cached.get(), StandardCharsets.UTF_8);
        }
        var original = Files.readString(path, StandardCharsets.UTF_8);
        // a file of nothing but comments minifies to nothing, cached or not
        return minifier.minify(original).isEmpty() ? "" : original;
    }

    private static void report(PrintStream err, String subject, IOException ex) {
        err.println("cssmin: " + subject + ": " + ex.getClass().getSimpleName() + " " + ex.getMessage());
    }

    static class Flags {
        boolean importantComments = false;
        Path cacheDir = null;
        final List<String> excluded = new ArrayList<>();
        final List<String> inputs = new ArrayList<>();

        static Flags parse(String[] args) {
            var flags = new Flags();
            for (var i = 0; i < args.length; i++) {
                var arg = args[i];
                if ("--important-comments".equals(arg)) {
                    flags.importantComments = true;
                } else if ("--cache-dir".equals(arg)) {
                    flags.cacheDir = Paths.get(value(args, ++i, arg));
                } else if ("--exclude".equals(arg)) {
                    flags.excluded.add(value(args, ++i, arg));
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("unknown option " + arg);
                } else {
                    flags.inputs.add(arg);
                }
            }
            if (!flags.excluded.isEmpty() && flags.cacheDir == null) {
                throw new IllegalArgumentException("--exclude needs --cache-dir");
            }
            return flags;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("missing value for " + option);
            }
            return args[index];
        }
    }
}
