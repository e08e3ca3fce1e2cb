package program.ingester.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One parsed input line:
 * {@code <start> <end> <programId> <status> <team> <parentId|null>-><id>}
 */
public record FeatureRecord(
        String id,
        String parentId,        // null for a root feature
        String programId,
        String status,          // opaque, e.g. "Complete" | "In_Progress"
        String team,
        OffsetDateTime start,
        OffsetDateTime end
) {
    public FeatureRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(programId, "programId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
