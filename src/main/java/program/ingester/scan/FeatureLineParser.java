package program.ingester.scan;

import java.time.OffsetDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Objects;

import program.ingester.IngestException;
import program.ingester.model.FeatureRecord;
import program.ingester.model.Relations;

/**
 * Parses one feature line:
 * {@code 2023-01-01T00:00:00.000Z 2023-06-30T00:00:00.000Z program1 Complete TeamB Suite->Email}
 * <p>
 * Fields are separated by exactly one space, so values cannot contain spaces.
 * No cross-field checks (start <= end is not enforced).
 */
public final class FeatureLineParser {

    private static final int FIELD_COUNT = 6;
    /**
     * RFC 3339 date-time: seconds required, fraction optional, offset as {@code Z} or {@code +HH:MM}.
     */
    public static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private FeatureLineParser() {
    }

    public static FeatureRecord parse(String line) throws IngestException {
        Objects.requireNonNull(line, "line");

        final String[] parts = line.trim().split(" ", -1);
        if (parts.length != FIELD_COUNT) {
            throw IngestException.invalidInput("The feature '" + line + "' needs to have 6 parts: "
                    + "start, end, program, progress_status, assigned_team, feature-relation");
        }

        final String[] relation = parts[5].split(Relations.SEPARATOR, -1);
        if (relation.length != 2) {
            throw IngestException.invalidInput("The feature-relation '" + parts[5]
                    + "' needs to have 2 parts separated by '" + Relations.SEPARATOR + "'");
        }

        return new FeatureRecord(
                relation[1],
                Relations.parentOrNull(relation[0]),
                parts[2],
                parts[3],
                parts[4],
                parseTimestamp(parts[0]),
                parseTimestamp(parts[1])
        );
    }

    /**
     * Inverse of {@link #parse(String)}.
     */
    public static String format(FeatureRecord record) {
        Objects.requireNonNull(record, "record");
        return String.join(" ",
                TIMESTAMP.format(record.start()),
                TIMESTAMP.format(record.end()),
                record.programId(),
                record.status(),
                record.team(),
                Relations.token(record.parentId(), record.id()));
    }

    static OffsetDateTime parseTimestamp(String text) throws IngestException {
        try {
            return OffsetDateTime.parse(text, TIMESTAMP);
        } catch (DateTimeParseException ex) {
            throw IngestException.invalidTimestamp(text, ex);
        }
    }
}
