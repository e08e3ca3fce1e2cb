package program.ingester.model;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Output tree node. Subfeatures are already in presentation order (start, then id).
 */
@JsonPropertyOrder({"feature", "progress_status", "assigned_team", "start", "end", "subfeatures"})
public record Feature(
        @JsonProperty("feature") String id,
        @JsonProperty("progress_status") String status,
        @JsonProperty("assigned_team") String team,
        OffsetDateTime start,
        OffsetDateTime end,
        List<Feature> subfeatures
) {
    public Feature {
        subfeatures = List.copyOf(subfeatures);
    }

    public static Feature of(FeatureRecord record, List<Feature> subfeatures) {
        return new Feature(record.id(), record.status(), record.team(),
                record.start(), record.end(), subfeatures);
    }
}
