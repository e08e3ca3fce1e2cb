package program.ingester.io;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    PRETTY,
    TREE;

    public static OutputFormat parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown format: " + value + " (expected json, pretty or tree)", ex);
        }
    }
}
