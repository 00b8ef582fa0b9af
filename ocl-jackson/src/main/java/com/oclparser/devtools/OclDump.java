package com.oclparser.devtools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oclparser.ParseException;
import com.oclparser.Parser;
import com.oclparser.ast.Document;
import com.oclparser.jackson.OclJackson;
import com.oclparser.view.Views;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dumps OCL files as JSON, for eyeballing what the parser and the view layer make of real input.
 *
 * Usage:
 *   java -cp target/classes:... com.oclparser.devtools.OclDump [options] <files...>
 *
 * Options:
 *   --ast             Print the syntax tree instead of the view
 *   --max-depth=N     Nesting limit passed to the parser (default: 256)
 */
public class OclDump {

    private static final ObjectMapper mapper = OclJackson.createObjectMapper();

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }

        int exitCode = new OclDump(config, System.out, System.err).run();
        System.exit(exitCode);
    }

    public OclDump(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * Dumps every configured file. Returns 0 when all files were dumped, 1 otherwise.
     */
    public int run() {
        int failed = 0;
        for (Path file : config.files) {
            try {
                String source = Files.readString(file);
                Document document = Parser.parse(source, config.maxDepth);
                Object target = config.ast ? document : Views.of(document);
                if (config.files.size() > 1) {
                    out.println("// " + file);
                }
                out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(target));
            } catch (ParseException e) {
                err.println(file + ": " + e.getMessage());
                failed++;
            } catch (JsonProcessingException e) {
                err.println(file + ": failed to write JSON: " + e.getOriginalMessage());
                failed++;
            } catch (IOException e) {
                err.println(file + ": cannot read file: " + e.getMessage());
                failed++;
            }
        }

        if (failed > 0) {
            err.println(failed + " of " + config.files.size() + " files failed");
            return 1;
        }
        return 0;
    }

    private static void printUsage() {
        System.err.println("Usage: OclDump [--ast] [--max-depth=N] <files...>");
    }

    public static class Config {
        boolean ast = false;
        int maxDepth = Parser.DEFAULT_MAX_DEPTH;
        List<Path> files = new ArrayList<>();

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.equals("--ast")) {
                    config.ast = true;
                } else if (arg.startsWith("--max-depth=")) {
                    try {
                        config.maxDepth = Integer.parseInt(arg.substring(12));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid max depth: " + arg.substring(12));
                        return null;
                    }
                    if (config.maxDepth < 1) {
                        System.err.println("Max depth must be at least 1");
                        return null;
                    }
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.files.isEmpty()) {
                System.err.println("Error: No files specified");
                return null;
            }

            return config;
        }
    }
}
