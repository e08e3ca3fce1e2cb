package program.ingester.model;

/**
 * One program: the program id of its root record plus the resolved root feature.
 */
public record Program(
        String id,
        Feature root
) {
}
