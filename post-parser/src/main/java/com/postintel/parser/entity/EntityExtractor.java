package com.postintel.parser.entity;

import com.postintel.parser.model.EntityBundle;
import com.postintel.parser.taxonomy.KeywordTaxonomy;
import com.postintel.parser.taxonomy.SchemePattern;
import com.postintel.parser.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls schemes, groups, organisations, people and hashtags out of a post.
 * Runs independently of classification and location.
 */
@Component
@Slf4j
public class EntityExtractor {

    private static final String NAME_WORD = "[\\p{L}\\p{M}]+";
    private static final int MAX_NAME_WORDS = 3;

    private final KeywordTaxonomy taxonomy;
    private final Pattern honorificName;

    public EntityExtractor(KeywordTaxonomy taxonomy) {
        this.taxonomy = taxonomy;
        this.honorificName = compileHonorificPattern(taxonomy.honorifics());
    }

    public EntityBundle extract(String text) {
        if (text == null || text.isBlank()) return EntityBundle.empty();

        String cleaned = TextNormalizer.clean(text);
        String normalized = TextNormalizer.normalize(cleaned);
        String folded = TextNormalizer.foldScript(cleaned);

        List<String> schemes = new ArrayList<>();
        for (SchemePattern scheme : taxonomy.schemes()) {
            if (scheme.matches(normalized)) schemes.add(scheme.canonical());
        }

        return new EntityBundle(
                schemes,
                keywordHits(taxonomy.targetGroups(), folded),
                keywordHits(taxonomy.communities(), folded),
                keywordHits(taxonomy.organizations(), folded),
                people(cleaned, folded),
                keywordHits(taxonomy.wordBuckets(), folded),
                TextNormalizer.extractHashtags(text).stream()
                        .map(TextNormalizer::normalize)
                        .toList());
    }

    // ── People ───────────────────────────────────────────────────────────────

    private List<String> people(String cleaned, String folded) {
        Set<String> people = new TreeSet<>(keywordHits(taxonomy.vipPeople(), folded));
        if (honorificName == null) return List.copyOf(people);

        Matcher m = honorificName.matcher(cleaned);
        while (m.find()) {
            trimName(m.group(1)).ifPresent(name -> people.add(vipCanonical(name).orElse(name)));
        }
        return List.copyOf(people);
    }

    /** Cuts the name at the first title or function word; "श्री अरुण साव जी ने" gives "अरुण साव". */
    private Optional<String> trimName(String raw) {
        List<String> kept = new ArrayList<>();
        for (String word : raw.trim().split("\\s+")) {
            if (taxonomy.personStopwords().contains(TextNormalizer.foldScript(word))) break;
            kept.add(word);
        }
        return kept.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", kept));
    }

    private Optional<String> vipCanonical(String name) {
        String folded = TextNormalizer.foldScript(name);
        return taxonomy.vipPeople().entrySet().stream()
                .filter(e -> e.getValue().contains(folded))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static Pattern compileHonorificPattern(List<String> honorifics) {
        if (honorifics.isEmpty()) {
            log.warn("No honorifics configured - honorific name extraction disabled");
            return null;
        }
        // longest first so "श्रीमती" is not read as "श्री" + "मती"
        String alternatives = honorifics.stream()
                .map(h -> h.endsWith(".") ? h.substring(0, h.length() - 1) : h)
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        String regex = "(?<![\\p{L}\\p{M}])(?:" + alternatives + ")\\.?\\s+"
                + "(" + NAME_WORD + "(?:\\s+" + NAME_WORD + "){0," + (MAX_NAME_WORDS - 1) + "})";
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    // ── Keyword groups ───────────────────────────────────────────────────────

    private static List<String> keywordHits(Map<String, List<String>> groups, String folded) {
        List<String> hits = new ArrayList<>();
        groups.forEach((canonical, keywords) -> {
            for (String keyword : keywords) {
                if (folded.contains(keyword)) {
                    hits.add(canonical);
                    return;
                }
            }
        });
        return hits;
    }
}
