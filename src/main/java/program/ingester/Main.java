package program.ingester;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.LoggerFactory;

import program.ingester.graph.Graph;
import program.ingester.graph.GraphBuilder;
import program.ingester.io.GraphWriter;
import program.ingester.io.OutputFormat;
import program.ingester.model.FeatureRecord;
import program.ingester.scan.FeatureReader;

public final class Main {

    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private static final Set<String> LOG_LEVELS = Set.of("trace", "debug", "info", "warn", "error", "off");

    private Main() {
    }

    public static void main(String[] args) {
        final int code = run(args, System.in, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        Path input = null;
        Path out = null;
        OutputFormat format = OutputFormat.PRETTY;
        final List<String> ignored = new ArrayList<>();

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage(stdout);
                return 0;
            }
            if (arg.startsWith("--out=")) {
                out = Paths.get(arg.substring("--out=".length()));
                continue;
            }
            if (arg.startsWith("--format=")) {
                try {
                    format = OutputFormat.parse(arg.substring("--format=".length()));
                } catch (IllegalArgumentException ex) {
                    stderr.println("ERROR: " + ex.getMessage());
                    printUsage(stderr);
                    return 2;
                }
                continue;
            }
            if (arg.startsWith("--logLevel=")) {
                final String level = arg.substring("--logLevel=".length()).trim().toLowerCase(Locale.ROOT);
                if (!LOG_LEVELS.contains(level)) {
                    stderr.println("ERROR: unknown log level: " + level);
                    printUsage(stderr);
                    return 2;
                }
                // must happen before the first logger is created
                System.setProperty(LOG_LEVEL_PROPERTY, level);
                continue;
            }
            if (arg.startsWith("--")) {
                stderr.println("ERROR: unknown argument: " + arg);
                printUsage(stderr);
                return 2;
            }
            if (input == null) {
                input = Paths.get(arg);
                continue;
            }
            ignored.add(arg);
        }

        if (!ignored.isEmpty()) {
            LoggerFactory.getLogger(Main.class)
                    .warn("additional arguments supplied and will be ignored: {}", ignored);
        }

        try {
            final List<FeatureRecord> records;
            if (input != null) {
                records = FeatureReader.read(input);
            } else {
                records = FeatureReader.read(new BufferedReader(
                        new InputStreamReader(stdin, StandardCharsets.UTF_8.newDecoder())));
            }

            final Graph graph = GraphBuilder.build(records);

            final GraphWriter writer = new GraphWriter(format);
            if (out != null) {
                writer.write(graph, out);
                stderr.println("Graph written to: " + out.toAbsolutePath().normalize());
            } else {
                final Writer w = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
                writer.write(graph, w);
            }
            return 0;
        } catch (IngestException ex) {
            stderr.println("ERROR: " + ex.kind() + ": " + safeMsg(ex.getMessage()));
            return ex.kind() == ErrorKind.IO_FAILURE ? 2 : 1;
        } catch (IOException ex) {
            stderr.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        }
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: program-ingester [inputFile] [options]");
        ps.println("Reads feature lines from inputFile (default: standard input).");
        ps.println("Options:");
        ps.println("  --out=<path>            Write the graph to a file instead of standard output");
        ps.println("  --format=<fmt>          json | pretty | tree (default: pretty)");
        ps.println("  --logLevel=<level>      trace | debug | info | warn | error | off (default: info)");
        ps.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
