package program.ingester.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import program.ingester.model.FeatureRecord;

/**
 * Build-time mapping: feature id -> (record or absent, child ids).
 * <p>
 * An entry can be created by its own record or by a child naming it as parent,
 * in either order. Records overwrite (last one wins); child links only accumulate.
 */
public final class FeatureMap {

    // LinkedHashMap keeps first-mention order (deterministic iteration)
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public static FeatureMap of(List<FeatureRecord> records) {
        final FeatureMap map = new FeatureMap();
        for (FeatureRecord r : records) {
            map.upsertFeature(r);
            if (r.parentId() != null) {
                map.linkChild(r.parentId(), r.id());
            }
        }
        return map;
    }

    public void upsertFeature(FeatureRecord record) {
        Objects.requireNonNull(record, "record");
        entries.computeIfAbsent(record.id(), k -> new Entry()).data = record;
    }

    public void linkChild(String parentId, String childId) {
        Objects.requireNonNull(parentId, "parentId");
        Objects.requireNonNull(childId, "childId");
        entries.computeIfAbsent(parentId, k -> new Entry()).children.add(childId);
    }

    public FeatureRecord data(String id) {
        final Entry e = entries.get(id);
        return e == null ? null : e.data;
    }

    public List<String> children(String id) {
        final Entry e = entries.get(id);
        return e == null ? List.of() : List.copyOf(e.children);
    }

    /**
     * Records whose (final) data has no parent.
     */
    public List<FeatureRecord> roots() {
        final List<FeatureRecord> out = new ArrayList<>();
        for (Entry e : entries.values()) {
            if (e.data != null && e.data.isRoot()) {
                out.add(e.data);
            }
        }
        return out;
    }

    /**
     * Ids that were named as a parent but never defined by a record of their own.
     */
    public List<String> danglingIds() {
        final List<String> out = new ArrayList<>();
        for (var e : entries.entrySet()) {
            if (e.getValue().data == null) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        FeatureRecord data;
        final Set<String> children = new LinkedHashSet<>();
    }
}
