package program.ingester.graph;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import program.ingester.model.Program;

/**
 * Fully resolved result, ready for writing.
 * - programs sorted by root start
 * - danglingParents: parent ids that were referenced but never defined (not serialized)
 */
@JsonIgnoreProperties("danglingParents")
public record Graph(
        List<Program> programs,
        List<String> danglingParents
) {
    public Graph {
        programs = List.copyOf(programs);
        danglingParents = List.copyOf(danglingParents);
    }
}
