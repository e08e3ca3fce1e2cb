package program.ingester.scan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import program.ingester.IngestException;
import program.ingester.model.FeatureRecord;

/**
 * Reads a whole batch of feature lines. The first bad line aborts the batch.
 */
public final class FeatureReader {

    private static final Logger log = LoggerFactory.getLogger(FeatureReader.class);

    private FeatureReader() {
    }

    public static List<FeatureRecord> read(Path file) throws IngestException {
        Objects.requireNonNull(file, "file");
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(br, file.toString());
        } catch (IOException ex) {
            throw IngestException.ioFailure("could not read " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static List<FeatureRecord> read(Reader reader) throws IngestException {
        Objects.requireNonNull(reader, "reader");
        final BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        try {
            return read(br, "<stdin>");
        } catch (IOException ex) {
            throw IngestException.ioFailure("could not read input: " + ex.getMessage(), ex);
        }
    }

    private static List<FeatureRecord> read(BufferedReader br, String source) throws IOException, IngestException {
        final List<FeatureRecord> records = new ArrayList<>();
        int lineNumber = 0;
        String line;
        // readLine() already drops "\n" and "\r\n"
        while ((line = br.readLine()) != null) {
            lineNumber++;
            try {
                records.add(FeatureLineParser.parse(line));
            } catch (IngestException ex) {
                throw ex.atLine(lineNumber);
            }
        }
        log.debug("Read {} feature records from {}", records.size(), source);
        return records;
    }
}
