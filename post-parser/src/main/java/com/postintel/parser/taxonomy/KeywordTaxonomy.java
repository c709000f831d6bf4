package com.postintel.parser.taxonomy;

import com.postintel.parser.model.EventCategory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only keyword data shared by the classifier, rescue engine, entity extractor
 * and location resolver. Loaded once at startup by {@link TaxonomyLoader}.
 *
 * All keyword collections hold script-folded forms (see TextNormalizer.foldScript);
 * stopwords hold normalized forms. Patterns are matched against normalized text.
 */
public record KeywordTaxonomy(
        List<EventCluster> clusters,
        List<SchemePattern> schemes,
        Map<String, List<String>> targetGroups,
        Map<String, List<String>> communities,
        Map<String, List<String>> organizations,
        Map<String, List<String>> wordBuckets,
        Map<String, List<String>> vipPeople,
        List<String> honorifics,
        Set<String> personStopwords,
        List<RescueTier> rescueTiers,
        Set<String> urbanContext,
        Set<String> ruralContext,
        Set<String> stopwords
) {

    public KeywordTaxonomy {
        clusters = List.copyOf(clusters);
        schemes = List.copyOf(schemes);
        targetGroups = Map.copyOf(targetGroups);
        communities = Map.copyOf(communities);
        organizations = Map.copyOf(organizations);
        wordBuckets = Map.copyOf(wordBuckets);
        vipPeople = Map.copyOf(vipPeople);
        honorifics = List.copyOf(honorifics);
        personStopwords = Set.copyOf(personStopwords);
        rescueTiers = List.copyOf(rescueTiers);
        urbanContext = Set.copyOf(urbanContext);
        ruralContext = Set.copyOf(ruralContext);
        stopwords = Set.copyOf(stopwords);
    }

    public Optional<EventCluster> cluster(EventCategory category) {
        return clusters.stream().filter(c -> c.category() == category).findFirst();
    }
}
