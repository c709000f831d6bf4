package com.postintel.parser.semantic;

import com.postintel.parser.gazetteer.GazetteerIndex;
import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process similarity search over gazetteer names using character n-gram vectors
 * and cosine similarity. Names are script-folded with spaces and hyphens removed,
 * so "बलौदाबाजार" and "बलौदा बाजार" score 1.0.
 *
 * Stands in for a precomputed embedding index when no remote backend is configured.
 * Linear scan per query; fine for a state-sized gazetteer.
 */
@Slf4j
public class NgramLocationSearchIndex implements LocationSearchClient {

    private record Entry(String name, Map<String, Integer> grams, double norm) {}

    private final int n;
    private final List<Entry> entries = new ArrayList<>();

    public NgramLocationSearchIndex(GazetteerIndex gazetteer, int n) {
        if (n < 2) {
            throw new IllegalArgumentException("n-gram size must be at least 2, got " + n);
        }
        this.n = n;

        Map<String, String> keyToName = new LinkedHashMap<>();
        for (GazetteerRecord record : gazetteer.records()) {
            for (String name : record.allNames()) {
                keyToName.putIfAbsent(key(name), record.canonical());
            }
        }
        keyToName.forEach((key, name) -> {
            Map<String, Integer> grams = grams(key);
            if (!grams.isEmpty()) entries.add(new Entry(name, grams, norm(grams)));
        });
        log.info("N-gram location index built: {} name keys (n={})", entries.size(), n);
    }

    @Override
    public List<SearchHit> search(String query, int k, double minScore) {
        if (entries.isEmpty()) {
            throw new SemanticBackendUnavailableException("N-gram index is empty");
        }
        Map<String, Integer> q = grams(key(query));
        if (q.isEmpty()) return List.of();
        double qNorm = norm(q);

        // Best score per place name; several keys can point at the same name
        Map<String, Double> best = new HashMap<>();
        for (Entry e : entries) {
            double score = dot(q, e.grams()) / (qNorm * e.norm());
            if (score >= minScore) best.merge(e.name(), score, Math::max);
        }

        return best.entrySet().stream()
                .map(e -> new SearchHit(e.getKey(), round4(e.getValue())))
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed().thenComparing(SearchHit::name))
                .limit(Math.max(1, k))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    // ── Vectors ──────────────────────────────────────────────────────────────

    private static String key(String name) {
        return TextNormalizer.foldScript(name).replaceAll("[\\s\\-]+", "");
    }

    private Map<String, Integer> grams(String key) {
        Map<String, Integer> grams = new HashMap<>();
        if (key.isEmpty()) return grams;
        String padded = "#" + key + "#";
        if (padded.length() < n) {
            grams.put(padded, 1);
            return grams;
        }
        for (int i = 0; i + n <= padded.length(); i++) {
            grams.merge(padded.substring(i, i + n), 1, Integer::sum);
        }
        return grams;
    }

    private static double dot(Map<String, Integer> a, Map<String, Integer> b) {
        Map<String, Integer> small = a.size() <= b.size() ? a : b;
        Map<String, Integer> large = small == a ? b : a;
        double sum = 0.0;
        for (Map.Entry<String, Integer> e : small.entrySet()) {
            Integer other = large.get(e.getKey());
            if (other != null) sum += e.getValue() * other;
        }
        return sum;
    }

    private static double norm(Map<String, Integer> grams) {
        double sum = 0.0;
        for (int v : grams.values()) sum += (double) v * v;
        return Math.sqrt(sum);
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
