package program.ingester.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import program.ingester.graph.Graph;
import program.ingester.graph.GraphBuilder;
import program.ingester.model.Feature;
import program.ingester.model.Program;
import program.ingester.scan.FeatureLineParser;

/**
 * Renders a resolved graph as JSON ({"programs": [...]}) or as an indented text outline.
 */
public final class GraphWriter {

    // {"programs": [ {"root": {...}} ]} plus an object and a "subfeatures" array per level
    static final int MAX_NESTING_DEPTH = 3 + 2 * GraphBuilder.MAX_DEPTH;

    private final OutputFormat format;
    private final ObjectMapper jsonMapper;

    public GraphWriter(OutputFormat format) {
        this.format = Objects.requireNonNull(format, "format");
        final JsonFactory factory = JsonFactory.builder()
                .streamWriteConstraints(StreamWriteConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH)
                        .build())
                .build();
        this.jsonMapper = JsonMapper.builder(factory)
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .configure(SerializationFeature.INDENT_OUTPUT, format == OutputFormat.PRETTY)
                .build();
    }

    public void write(Graph graph, Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // overwrite each time (simple + deterministic)
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            write(graph, bw);
        }
    }

    /**
     * Writes to {@code out} and flushes it; the writer is left open.
     */
    public void write(Graph graph, Writer out) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(out, "out");
        if (format == OutputFormat.TREE) {
            out.write(renderTree(graph));
        } else {
            jsonMapper.writeValue(out, graph);
            out.write(System.lineSeparator());
        }
        out.flush();
    }

    public String render(Graph graph) throws IOException {
        final StringWriter sw = new StringWriter();
        write(graph, sw);
        return sw.toString();
    }

    static String renderTree(Graph graph) {
        final StringBuilder sb = new StringBuilder();
        for (Program p : graph.programs()) {
            sb.append("program ").append(p.id()).append('\n');
            appendFeature(sb, p.root(), 1);
        }
        return sb.toString();
    }

    private static void appendFeature(StringBuilder sb, Feature f, int depth) {
        sb.append("  ".repeat(depth))
                .append(f.id())
                .append(" [").append(f.status()).append(", ").append(f.team()).append("] ")
                .append(FeatureLineParser.TIMESTAMP.format(f.start()))
                .append(" .. ")
                .append(FeatureLineParser.TIMESTAMP.format(f.end()))
                .append('\n');
        for (Feature child : f.subfeatures()) {
            appendFeature(sb, child, depth + 1);
        }
    }
}
