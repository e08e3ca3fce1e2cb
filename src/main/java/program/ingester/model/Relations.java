package program.ingester.model;

import java.util.Objects;

/**
 * Relation token helpers for the {@code parent->child} field of an input line.
 */
public final class Relations {

    public static final String SEPARATOR = "->";
    public static final String NO_PARENT = "null";

    private Relations() {
    }

    public static String token(String parentId, String id) {
        Objects.requireNonNull(id, "id");
        return (parentId == null ? NO_PARENT : parentId) + SEPARATOR + id;
    }

    public static String parentOrNull(String parentSpec) {
        return NO_PARENT.equals(parentSpec) ? null : parentSpec;
    }
}
