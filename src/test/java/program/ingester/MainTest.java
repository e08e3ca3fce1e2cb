package program.ingester;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class MainTest {

    private static final String INPUT = ""
            + "2023-01-01T00:00:00.000Z 2023-06-30T00:00:00.000Z P1 Complete B Root->Child\n"
            + "2023-01-01T00:00:00.000Z 2023-12-31T00:00:00.000Z P1 In_Progress A null->Root\n";

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return Main.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void readsStdinAndPrintsJson() throws Exception {
        assertEquals(0, run(INPUT, "--format=json"));

        final JsonNode tree = new ObjectMapper().readTree(stdout());
        final JsonNode root = tree.get("programs").get(0).get("root");
        assertEquals("Root", root.get("feature").asText());
        assertEquals("Child", root.get("subfeatures").get(0).get("feature").asText());
    }

    @Test
    void readsFileAndWritesFile() throws Exception {
        final Path in = tmp.resolve("in.txt");
        final Path target = tmp.resolve("out/graph.txt");
        Files.writeString(in, INPUT, StandardCharsets.UTF_8);

        assertEquals(0, run("", in.toString(), "--format=tree", "--out=" + target));

        final String text = Files.readString(target, StandardCharsets.UTF_8);
        assertTrue(text.startsWith("program P1\n  Root "), text);
        assertTrue(stderr().contains("Graph written to:"));
    }

    @Test
    void malformedLineExitsWithOne() {
        assertEquals(1, run(INPUT + "2023-01-01T00:00:00.000Z P1 Complete B a-b\n"));

        assertTrue(stderr().contains("ERROR: INVALID_INPUT: line 3: "), stderr());
        assertEquals("", stdout());
    }

    @Test
    void cycleExitsWithOne() {
        final String input = INPUT + "2023-01-01T00:00:00.000Z 2023-06-30T00:00:00.000Z P1 Complete B Child->Root\n"
                + "2023-01-01T00:00:00.000Z 2023-12-31T00:00:00.000Z P1 In_Progress A null->Root\n";

        assertEquals(1, run(input));
        assertTrue(stderr().contains("ERROR: CYCLIC_REFERENCE"), stderr());
    }

    @Test
    void missingFileExitsWithTwo() {
        assertEquals(2, run("", tmp.resolve("nope.txt").toString()));

        assertTrue(stderr().contains("ERROR: IO_FAILURE"), stderr());
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(0, run("", "--help"));

        assertTrue(stdout().startsWith("Usage: program-ingester"));
    }

    @Test
    void unknownOptionsExitWithTwo() {
        assertEquals(2, run(INPUT, "--bogus=1"));
        assertEquals(2, run(INPUT, "--format=xml"));
        assertEquals(2, run(INPUT, "--logLevel=loud"));
    }

    @Test
    void extraPositionalArgumentsAreIgnored() throws Exception {
        final Path in = tmp.resolve("in.txt");
        Files.writeString(in, INPUT, StandardCharsets.UTF_8);

        assertEquals(0, run("", in.toString(), "extra", "--format=json"));
        assertEquals("Root", new ObjectMapper().readTree(stdout())
                .get("programs").get(0).get("root").get("feature").asText());
    }

    @Test
    void deepChainPrintsJson() throws Exception {
        final StringBuilder input = new StringBuilder(
                "2023-01-01T00:00:00Z 2023-12-31T00:00:00Z P1 Complete A null->n0\n");
        for (int i = 1; i < 600; i++) {
            input.append("2023-01-01T00:00:00Z 2023-12-31T00:00:00Z P1 Complete A n")
                    .append(i - 1).append("->n").append(i).append('\n');
        }

        assertEquals(0, run(input.toString(), "--format=json"), stderr());
        assertTrue(stdout().contains("\"feature\":\"n599\""));
    }

    @Test
    void tooDeepChainExitsWithOne() {
        final StringBuilder input = new StringBuilder(
                "2023-01-01T00:00:00Z 2023-12-31T00:00:00Z P1 Complete A null->n0\n");
        for (int i = 1; i <= 1000; i++) {
            input.append("2023-01-01T00:00:00Z 2023-12-31T00:00:00Z P1 Complete A n")
                    .append(i - 1).append("->n").append(i).append('\n');
        }

        assertEquals(1, run(input.toString()));
        assertTrue(stderr().contains("ERROR: DEPTH_LIMIT"), stderr());
    }

    @Test
    void invalidUtf8OnStdinIsIoFailure() {
        final byte[] head = "2023-01-01T00:00:00Z 2023-12-31T00:00:00Z P1 Complete Team".getBytes(StandardCharsets.UTF_8);
        final byte[] tail = " null->Root\n".getBytes(StandardCharsets.UTF_8);
        final byte[] bytes = new byte[head.length + 1 + tail.length];
        System.arraycopy(head, 0, bytes, 0, head.length);
        bytes[head.length] = (byte) 0xFF;
        System.arraycopy(tail, 0, bytes, head.length + 1, tail.length);

        final int code = Main.run(new String[0],
                new ByteArrayInputStream(bytes),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(2, code);
        assertTrue(stderr().contains("ERROR: IO_FAILURE"), stderr());
        assertEquals("", stdout());
    }
}
