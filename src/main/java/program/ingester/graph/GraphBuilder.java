package program.ingester.graph;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import program.ingester.IngestException;
import program.ingester.model.Feature;
import program.ingester.model.FeatureRecord;
import program.ingester.model.Program;

/**
 * Resolves a batch of feature records into one program per root feature.
 * <p>
 * Step 1: build the id mapping (records may arrive child-before-parent).
 * Step 2: every defined, parentless entry becomes a program.
 * Step 3: depth-first resolution of each root's children, guarded against cycles.
 * <p>
 * Parents that are referenced but never defined produce nothing and are only logged.
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    static final Comparator<Feature> FEATURE_ORDER =
            Comparator.comparing(Feature::start, OffsetDateTime.timeLineOrder())
                    .thenComparing(Feature::id);

    static final Comparator<Program> PROGRAM_ORDER =
            Comparator.comparing((Program p) -> p.root().start(), OffsetDateTime.timeLineOrder())
                    .thenComparing(Program::id)
                    .thenComparing(p -> p.root().id());

    /**
     * Deepest feature chain that is resolved (the root counts as level 1).
     * Deeper chains fail with {@link program.ingester.ErrorKind#DEPTH_LIMIT}.
     */
    public static final int MAX_DEPTH = 1000;

    private final List<FeatureRecord> records;

    public GraphBuilder(List<FeatureRecord> records) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));
    }

    public static Graph build(List<FeatureRecord> records) throws IngestException {
        return new GraphBuilder(records).build();
    }

    public Graph build() throws IngestException {
        final FeatureMap mapping = FeatureMap.of(records);

        final List<String> dangling = mapping.danglingIds();
        for (String id : dangling) {
            log.debug("Parent '{}' referenced by {} but never defined; dropped",
                    id, mapping.children(id));
        }

        final List<Program> programs = new ArrayList<>();
        for (FeatureRecord root : mapping.roots()) {
            final Set<String> path = new LinkedHashSet<>();
            final Feature resolved = resolve(root, mapping, path);
            programs.add(new Program(root.programId(), resolved));
        }
        programs.sort(PROGRAM_ORDER);

        log.debug("Resolved {} records ({} ids) into {} programs, {} dangling parents",
                records.size(), mapping.size(), programs.size(), dangling.size());
        return new Graph(programs, dangling);
    }

    private static Feature resolve(FeatureRecord record, FeatureMap mapping, Set<String> path)
            throws IngestException {
        if (!path.add(record.id())) {
            throw IngestException.cyclicReference("Feature '" + record.id()
                    + "' is its own ancestor: " + String.join(" -> ", path) + " -> " + record.id());
        }
        if (path.size() > MAX_DEPTH) {
            throw IngestException.depthLimit("Feature '" + record.id() + "' is nested deeper than "
                    + MAX_DEPTH + " levels below root '" + path.iterator().next() + "'");
        }

        final List<Feature> subfeatures = new ArrayList<>();
        for (String childId : mapping.children(record.id())) {
            final FeatureRecord child = mapping.data(childId);
            if (child == null) {
                // cannot happen: a child id always comes from a record with that id
                continue;
            }
            subfeatures.add(resolve(child, mapping, path));
        }
        subfeatures.sort(FEATURE_ORDER);

        path.remove(record.id());
        return Feature.of(record, subfeatures);
    }
}
