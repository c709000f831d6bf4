package com.postintel.parser.taxonomy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.postintel.parser.model.ContentMode;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the keyword taxonomy JSON and the optional rescue-tier proposal file.
 *
 * Taxonomy layout (snake_case keys):
 *   clusters        - [{category, weight, strong[], medium[], weak[]}], order breaks score ties
 *   schemes         - [{pattern, canonical}]
 *   target_groups, communities, organizations, word_buckets, vip_people - {canonical: [keywords]}
 *   honorifics, person_stopwords, urban_context, rural_context, stopwords - [strings]
 *   rescue_tiers    - [{tag, patterns[], target, bonus, content_mode}], evaluated in order
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TaxonomyLoader {

    private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public KeywordTaxonomy load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new TaxonomyException("Taxonomy not found at " + location);
        }

        TaxonomyDocument doc;
        try (InputStream in = resource.getInputStream()) {
            doc = objectMapper.readValue(in, TaxonomyDocument.class);
        } catch (IOException e) {
            throw new TaxonomyException("Could not read taxonomy at " + location, e);
        }

        KeywordTaxonomy taxonomy = toTaxonomy(doc);
        if (taxonomy.clusters().isEmpty()) {
            throw new TaxonomyException("Taxonomy at " + location + " defines no event clusters");
        }

        log.info("Loaded taxonomy: {} clusters, {} schemes, {} rescue tiers, {} VIPs",
                taxonomy.clusters().size(), taxonomy.schemes().size(),
                taxonomy.rescueTiers().size(), taxonomy.vipPeople().size());
        return taxonomy;
    }

    /**
     * Rescue tiers proposed by the advisory assistant. Optional: a blank location,
     * a missing file or a malformed file all yield no proposals.
     */
    public List<RescueProposal> loadProposals(String location) {
        if (location == null || location.isBlank()) return List.of();

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Rescue-tier proposals not found at {} - ignoring", location);
            return List.of();
        }

        try (InputStream in = resource.getInputStream()) {
            ProposalDocument doc = objectMapper.readValue(in, ProposalDocument.class);
            List<RescueProposal> proposals = new ArrayList<>();
            for (ProposalEntry entry : nullSafe(doc.proposals())) {
                proposals.add(new RescueProposal(entry.position(), toRescueTier(entry.tier())));
            }
            log.info("Loaded {} rescue-tier proposals from {}", proposals.size(), location);
            return proposals;
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring malformed rescue-tier proposals at {}: {}", location, e.getMessage());
            return List.of();
        }
    }

    // ── Conversion ──────────────────────────────────────────────────────────

    private KeywordTaxonomy toTaxonomy(TaxonomyDocument doc) {
        List<EventCluster> clusters = new ArrayList<>();
        for (ClusterEntry entry : nullSafe(doc.clusters())) {
            EventCategory category = parseCategory(entry.category());
            if (category.isUncategorized()) {
                throw new TaxonomyException("The uncategorized bucket cannot have a keyword cluster");
            }
            EventCluster cluster = new EventCluster(category,
                    entry.weight() == null ? 1.0 : entry.weight(),
                    folded(entry.strong()), folded(entry.medium()), folded(entry.weak()));
            if (cluster.isEmpty()) {
                log.warn("Cluster {} has no keywords - skipping", category);
                continue;
            }
            clusters.add(cluster);
        }

        List<SchemePattern> schemes = new ArrayList<>();
        for (SchemeEntry entry : nullSafe(doc.schemes())) {
            schemes.add(new SchemePattern(compile(entry.pattern()), entry.canonical()));
        }

        List<RescueTier> tiers = new ArrayList<>();
        for (RescueTierEntry entry : nullSafe(doc.rescueTiers())) {
            tiers.add(toRescueTier(entry));
        }

        return new KeywordTaxonomy(
                clusters,
                schemes,
                foldedMap(doc.targetGroups()),
                foldedMap(doc.communities()),
                foldedMap(doc.organizations()),
                foldedMap(doc.wordBuckets()),
                foldedMap(doc.vipPeople()),
                nullSafe(doc.honorifics()),
                Set.copyOf(folded(doc.personStopwords())),
                tiers,
                Set.copyOf(folded(doc.urbanContext())),
                Set.copyOf(folded(doc.ruralContext())),
                normalizedSet(doc.stopwords()));
    }

    private RescueTier toRescueTier(RescueTierEntry entry) {
        if (entry == null || entry.tag() == null) {
            throw new TaxonomyException("Rescue tier without a tag");
        }
        List<Pattern> patterns = nullSafe(entry.patterns()).stream().map(this::compile).toList();
        if (patterns.isEmpty()) {
            throw new TaxonomyException("Rescue tier " + entry.tag() + " has no patterns");
        }
        EventCategory target = entry.target() == null ? EventCategory.UNCATEGORIZED : parseCategory(entry.target());
        ContentMode mode = entry.contentMode() == null ? ContentMode.FIELD_EVENT : ContentMode.fromValue(entry.contentMode());
        return new RescueTier(entry.tag(), patterns, target, entry.bonus() == null ? 0.0 : entry.bonus(), mode);
    }

    private Pattern compile(String regex) {
        try {
            return Pattern.compile(Normalizer.normalize(regex, Normalizer.Form.NFC), PATTERN_FLAGS);
        } catch (PatternSyntaxException | NullPointerException e) {
            throw new TaxonomyException("Invalid taxonomy pattern: " + regex, e);
        }
    }

    private EventCategory parseCategory(String value) {
        try {
            return EventCategory.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new TaxonomyException(e.getMessage(), e);
        }
    }

    private static List<String> folded(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : nullSafe(values)) {
            String f = TextNormalizer.foldScript(v);
            if (!f.isEmpty()) out.add(f);
        }
        return List.copyOf(out);
    }

    private static Map<String, List<String>> foldedMap(Map<String, List<String>> values) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (values == null) return out;
        values.forEach((canonical, keywords) -> out.put(canonical, folded(keywords)));
        return out;
    }

    private static Set<String> normalizedSet(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : nullSafe(values)) {
            out.add(TextNormalizer.normalize(v));
        }
        return out;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    // ── JSON shapes ─────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record TaxonomyDocument(
            List<ClusterEntry> clusters,
            List<SchemeEntry> schemes,
            Map<String, List<String>> targetGroups,
            Map<String, List<String>> communities,
            Map<String, List<String>> organizations,
            Map<String, List<String>> wordBuckets,
            Map<String, List<String>> vipPeople,
            List<String> honorifics,
            List<String> personStopwords,
            List<RescueTierEntry> rescueTiers,
            List<String> urbanContext,
            List<String> ruralContext,
            List<String> stopwords
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ClusterEntry(String category, Double weight, List<String> strong, List<String> medium, List<String> weak) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SchemeEntry(String pattern, String canonical) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record RescueTierEntry(String tag, List<String> patterns, String target, Double bonus, String contentMode) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProposalDocument(List<ProposalEntry> proposals) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProposalEntry(int position, RescueTierEntry tier) {}

    /** A proposed rescue tier and the priority position it should be inserted at. */
    public record RescueProposal(int position, RescueTier tier) {}
}
