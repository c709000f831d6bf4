package com.postintel.parser.gazetteer;

import com.postintel.parser.model.AdminType;
import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.text.TextNormalizer;
import com.postintel.parser.text.Transliterator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only name lookup over the administrative reference data.
 *
 * Three typed indexes (village, urban local body, district). Each record is keyed under
 * every variant of every name it answers to, so "सिलतरा", "Siltara" and the folded
 * or transliterated spellings all land on the same record. A name shared by several
 * records (two villages called "खैरा" in different districts) keeps all of them in
 * insertion order.
 *
 * Exact keys (normalize() of a name) are kept apart from variant keys so callers can
 * tell a direct hit from a spelling-variant hit.
 */
public final class GazetteerIndex {

    /** Lookup order for resolveByName: most specific first. */
    private static final List<AdminType> INDEXED_TYPES =
            List.of(AdminType.VILLAGE, AdminType.URBAN_LOCAL_BODY, AdminType.DISTRICT);

    private final List<GazetteerRecord> records;
    private final Map<AdminType, Map<String, List<GazetteerRecord>>> exactKeys = new EnumMap<>(AdminType.class);
    private final Map<AdminType, Map<String, List<GazetteerRecord>>> variantKeys = new EnumMap<>(AdminType.class);

    private GazetteerIndex(List<GazetteerRecord> records) {
        this.records = List.copyOf(records);
        for (AdminType type : INDEXED_TYPES) {
            exactKeys.put(type, new HashMap<>());
            variantKeys.put(type, new HashMap<>());
        }
        for (GazetteerRecord record : this.records) {
            index(record);
        }
    }

    public static GazetteerIndex of(List<GazetteerRecord> records) {
        return new GazetteerIndex(records);
    }

    public static GazetteerIndex empty() {
        return new GazetteerIndex(List.of());
    }

    // ── Lookups ──────────────────────────────────────────────────────────────

    /** Most specific record answering to this name: village, then urban body, then district. */
    public Optional<GazetteerRecord> resolveByName(String name) {
        for (AdminType type : INDEXED_TYPES) {
            Optional<GazetteerRecord> hit = first(type, name);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    /**
     * Every typed record the candidate matches, exact hits first.
     * A record appears once even if several variants hit it.
     */
    public List<GazetteerMatch> lookupAll(String candidate) {
        if (candidate == null || candidate.isBlank()) return List.of();

        Map<GazetteerRecord, GazetteerMatch> matches = new LinkedHashMap<>();
        String exactKey = TextNormalizer.normalize(candidate);
        Set<String> variants = TextNormalizer.variants(candidate);

        for (AdminType type : INDEXED_TYPES) {
            for (GazetteerRecord r : exactKeys.get(type).getOrDefault(exactKey, List.of())) {
                matches.putIfAbsent(r, new GazetteerMatch(r, candidate, true));
            }
        }
        for (AdminType type : INDEXED_TYPES) {
            Map<String, List<GazetteerRecord>> byVariant = variantKeys.get(type);
            for (String key : variants) {
                for (GazetteerRecord r : byVariant.getOrDefault(key, List.of())) {
                    matches.putIfAbsent(r, new GazetteerMatch(r, candidate, false));
                }
            }
        }
        return new ArrayList<>(matches.values());
    }

    /**
     * Latin-script names of districts and urban bodies, lower-cased, for handle inference.
     * Longer names come first so "bhilaicharoda" wins over "bhilai".
     */
    public List<Map.Entry<String, GazetteerRecord>> latinNames(int minLength) {
        Map<String, GazetteerRecord> names = new LinkedHashMap<>();
        for (GazetteerRecord r : records) {
            if (r.type() != AdminType.DISTRICT && r.type() != AdminType.URBAN_LOCAL_BODY) continue;
            for (String name : r.allNames()) {
                if (Transliterator.containsDevanagari(name)) continue;
                String key = name.toLowerCase().replaceAll("[^a-z]", "");
                if (key.length() >= minLength) names.putIfAbsent(key, r);
            }
        }
        List<Map.Entry<String, GazetteerRecord>> sorted = new ArrayList<>(names.entrySet());
        sorted.sort((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()));
        return sorted;
    }

    public List<GazetteerRecord> records() {
        return records;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Record counts per type, for startup logging. */
    public Map<AdminType, Integer> stats() {
        Map<AdminType, Integer> counts = new EnumMap<>(AdminType.class);
        for (GazetteerRecord r : records) {
            counts.merge(r.type(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void index(GazetteerRecord record) {
        if (!INDEXED_TYPES.contains(record.type())) return;

        Map<String, List<GazetteerRecord>> exact = exactKeys.get(record.type());
        Map<String, List<GazetteerRecord>> variant = variantKeys.get(record.type());

        Set<String> exactForRecord = new LinkedHashSet<>();
        Set<String> variantForRecord = new LinkedHashSet<>();
        for (String name : record.allNames()) {
            exactForRecord.add(TextNormalizer.normalize(name));
            variantForRecord.addAll(TextNormalizer.variants(name));
        }
        exactForRecord.forEach(k -> exact.computeIfAbsent(k, x -> new ArrayList<>()).add(record));
        variantForRecord.forEach(k -> variant.computeIfAbsent(k, x -> new ArrayList<>()).add(record));
    }

    private Optional<GazetteerRecord> first(AdminType type, String name) {
        if (name == null || name.isBlank()) return Optional.empty();

        List<GazetteerRecord> hits = exactKeys.get(type).get(TextNormalizer.normalize(name));
        if (hits != null && !hits.isEmpty()) return Optional.of(hits.get(0));

        for (String key : TextNormalizer.variants(name)) {
            hits = variantKeys.get(type).get(key);
            if (hits != null && !hits.isEmpty()) return Optional.of(hits.get(0));
        }
        return Optional.empty();
    }
}
