package com.declparser.tool;

import com.declparser.ParseException;
import com.declparser.ast.Node;
import com.declparser.jackson.DeclparseJackson;
import com.declparser.parsing.DeclParser;
import com.declparser.parsing.NodeKind;
import com.declparser.parsing.ParserOptions;
import com.declparser.printing.TokenPrinter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line front end: parses declaration fragments from files (or stdin) and prints them
 * back as tokens, as a JSON tree, or just reports whether they parse.
 *
 * Usage:
 *   java -cp ... com.declparser.tool.DeclTool [options] [files...]
 *
 * Options:
 *   --kind=K              Node to parse: variant|variants|fields|field|unnamed-field|visibility|type|expr|path
 *                         (default: variant)
 *   --mode=print|json|check
 *                         Reprint the tokens, dump the tree as JSON, or only validate (default: print)
 *   --max-depth=N         Nesting limit for types and expressions (default: 128)
 *   --verbose             Report each input on stderr
 *
 * Exit status: 0 when every input parsed, 1 when any failed, 2 on bad usage.
 */
public class DeclTool {

    private static final ObjectMapper mapper = DeclparseJackson.createObjectMapper();

    public enum Mode {
        PRINT, JSON, CHECK
    }

    private final Config config;
    private final DeclParser parser;

    public static void main(String[] args) {
        Config config = Config.parse(args, System.err);
        if (config == null) {
            printUsage(System.err);
            System.exit(2);
        }
        int exitCode = new DeclTool(config).run(System.in, System.out, System.err);
        System.exit(exitCode);
    }

    public DeclTool(Config config) {
        this.config = config;
        this.parser = new DeclParser(ParserOptions.defaults().withMaxDepth(config.maxDepth));
    }

    /**
     * Processes every configured file, or {@code stdin} when none were given.
     */
    public int run(InputStream stdin, PrintStream out, PrintStream err) {
        int failures = 0;
        if (config.files.isEmpty()) {
            try {
                String source = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
                failures += process("<stdin>", source, out, err) ? 0 : 1;
            } catch (IOException e) {
                err.println("Failed to read stdin: " + e.getMessage());
                return 1;
            }
        }
        for (Path file : config.files) {
            String source;
            try {
                source = Files.readString(file);
            } catch (IOException e) {
                err.println(file + ": cannot read: " + e.getMessage());
                failures++;
                continue;
            }
            failures += process(file.toString(), source, out, err) ? 0 : 1;
        }
        if (config.verbose) {
            err.println("Inputs with errors: " + failures);
        }
        return failures == 0 ? 0 : 1;
    }

    private boolean process(String name, String source, PrintStream out, PrintStream err) {
        if (config.verbose) {
            err.println("Parsing " + name + " as " + config.kind.label());
        }
        Node node;
        try {
            node = parser.parse(config.kind, source);
        } catch (ParseException e) {
            err.println(name + ": " + e.getMessage());
            return false;
        }
        switch (config.mode) {
            case PRINT -> out.println(TokenPrinter.render(node));
            case JSON -> {
                try {
                    out.println(mapper.writerFor(Node.class).withDefaultPrettyPrinter().writeValueAsString(node));
                } catch (JsonProcessingException e) {
                    err.println(name + ": failed to write JSON: " + e.getOriginalMessage());
                    return false;
                }
            }
            case CHECK -> out.println(name + ": OK");
        }
        return true;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: DeclTool [options] [files...]");
        err.println("  --kind=" + NodeKind.labels() + "  (default: variant)");
        err.println("  --mode=print|json|check  (default: print)");
        err.println("  --max-depth=N            (default: " + ParserOptions.DEFAULT_MAX_DEPTH + ")");
        err.println("  --verbose");
        err.println("Reads stdin when no files are given.");
    }

    public static class Config {
        NodeKind kind = NodeKind.VARIANT;
        Mode mode = Mode.PRINT;
        int maxDepth = ParserOptions.DEFAULT_MAX_DEPTH;
        List<Path> files = new ArrayList<>();
        boolean verbose = false;

        /**
         * Returns null, after reporting the problem on {@code err}, when the arguments are invalid
         * or help was requested.
         */
        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--kind=")) {
                    try {
                        config.kind = NodeKind.fromLabel(arg.substring(7));
                    } catch (IllegalArgumentException e) {
                        err.println(e.getMessage());
                        return null;
                    }
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid mode: " + mode);
                        return null;
                    }
                } else if (arg.startsWith("--max-depth=")) {
                    try {
                        config.maxDepth = Integer.parseInt(arg.substring(12));
                    } catch (NumberFormatException e) {
                        err.println("Invalid max depth: " + arg.substring(12));
                        return null;
                    }
                    if (config.maxDepth <= 0) {
                        err.println("Max depth must be positive");
                        return null;
                    }
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            return config;
        }

        public NodeKind kind() {
            return kind;
        }

        public Mode mode() {
            return mode;
        }

        public int maxDepth() {
            return maxDepth;
        }

        public List<Path> files() {
            return files;
        }
    }
}
