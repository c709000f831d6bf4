package com.postintel.parser.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Entities mentioned in one post. Every list is sorted and de-duplicated.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EntityBundle(
        List<String> schemes,
        List<String> targetGroups,
        List<String> communities,
        List<String> organizations,
        List<String> people,
        List<String> wordBuckets,
        List<String> hashtags
) {

    public EntityBundle {
        schemes = sortedDistinct(schemes);
        targetGroups = sortedDistinct(targetGroups);
        communities = sortedDistinct(communities);
        organizations = sortedDistinct(organizations);
        people = sortedDistinct(people);
        wordBuckets = sortedDistinct(wordBuckets);
        hashtags = sortedDistinct(hashtags);
    }

    public static EntityBundle empty() {
        return new EntityBundle(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    private static List<String> sortedDistinct(Collection<String> values) {
        if (values == null) return List.of();
        return List.copyOf(new TreeSet<>(values));
    }
}
