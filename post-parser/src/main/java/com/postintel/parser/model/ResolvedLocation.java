package com.postintel.parser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * A location attached to a single post. Created fresh per post and never mutated;
 * copies with a different source or confidence go through toBuilder().
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolvedLocation(
        String canonical,
        AdminType locationType,
        List<String> hierarchyPath,
        String district,
        String assembly,
        String block,
        String gramPanchayat,
        String village,
        String urbanBody,
        String ward,
        String zone,
        String canonicalKey,
        LocationSource source,
        double confidence,
        String landmarkTrigger
) {

    public ResolvedLocation {
        hierarchyPath = hierarchyPath == null ? List.of() : List.copyOf(hierarchyPath);
    }

    public ResolvedLocation withProvenance(LocationSource newSource, double newConfidence) {
        return toBuilder().source(newSource).confidence(newConfidence).build();
    }
}
