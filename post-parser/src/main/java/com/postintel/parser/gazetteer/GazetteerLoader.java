package com.postintel.parser.gazetteer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.AdminType;
import com.postintel.parser.model.GazetteerRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the gazetteer from the reference datasets.
 *
 * Sources (all optional, each a Spring resource location):
 *   districts.json      - {"state": .., "districts": {"Raipur": {"hindi": "रायपुर", "aliases": [..]}}}
 *   villages.ndjson     - one village per line: village, village_hi, gram_panchayat, block,
 *                         district, district_hi, assembly, aliases[]
 *   urban_bodies.ndjson - one urban local body per line: ulb, ulb_hi, ulb_type, district,
 *                         district_hi, assembly, ward_count, aliases[]
 *   aliases.csv         - alias,canonical,type curated spelling table
 *
 * A missing or unreadable file is logged and skipped; so is a malformed line.
 * An empty gazetteer is valid: every lookup simply falls through.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GazetteerLoader {

    private final PostParserProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public GazetteerIndex loadIndex() {
        PostParserProperties.Gazetteer cfg = properties.getGazetteer();
        String state = cfg.getState();

        Map<String, GazetteerRecord> districts = loadDistricts(cfg.getDistricts(), state);
        Map<String, String> districtHindi = new HashMap<>();
        districts.forEach((english, record) -> districtHindi.put(english.toLowerCase(Locale.ROOT), record.canonical()));

        List<GazetteerRecord> records = new ArrayList<>(districts.values());
        records.addAll(loadVillages(cfg.getVillages(), state, districtHindi));
        records.addAll(loadUrbanBodies(cfg.getUrbanBodies(), state, districtHindi));

        records = applyAliases(records, cfg.getAliases());

        GazetteerIndex index = GazetteerIndex.of(records);
        log.info("Gazetteer ready: {}", index.stats());
        if (index.isEmpty()) {
            log.warn("Gazetteer is empty - location resolution will fall through to inference tiers");
        }
        return index;
    }

    public LandmarkTable loadLandmarks() {
        String location = properties.getGazetteer().getLandmarks();
        Optional<JsonNode> root = readJson(location);
        if (root.isEmpty()) return LandmarkTable.empty();

        Map<String, String> phrases = new LinkedHashMap<>();
        root.get().fields().forEachRemaining(e -> phrases.put(e.getKey(), e.getValue().asText()));
        LandmarkTable table = LandmarkTable.of(phrases);
        log.info("Loaded {} landmarks from {}", table.size(), location);
        return table;
    }

    // ── Districts ────────────────────────────────────────────────────────────

    private Map<String, GazetteerRecord> loadDistricts(String location, String state) {
        Map<String, GazetteerRecord> out = new LinkedHashMap<>();
        Optional<JsonNode> root = readJson(location);
        if (root.isEmpty()) return out;

        JsonNode districts = root.get().path("districts");
        districts.fields().forEachRemaining(entry -> {
            String english = entry.getKey();
            JsonNode node = entry.getValue();
            String hindi = text(node, "hindi");
            String canonical = hindi != null ? hindi : english;

            GazetteerRecord.GazetteerRecordBuilder builder = GazetteerRecord.builder()
                    .canonical(canonical)
                    .alias(english)
                    .type(AdminType.DISTRICT)
                    .hierarchyPath(List.of(state, AdminType.DISTRICT.pathLabel(canonical)))
                    .district(canonical);
            node.path("aliases").forEach(a -> builder.alias(a.asText()));
            out.put(english, builder.build());
        });

        log.info("Loaded {} districts from {}", out.size(), location);
        return out;
    }

    // ── Villages ─────────────────────────────────────────────────────────────

    private List<GazetteerRecord> loadVillages(String location, String state, Map<String, String> districtHindi) {
        List<GazetteerRecord> out = new ArrayList<>();
        int skipped = 0;

        for (JsonNode node : readNdjson(location)) {
            String english = text(node, "village");
            String hindi = Optional.ofNullable(text(node, "village_hi"))
                    .orElse(textAt(node, "variants", "village", "hindi"));
            if (english == null && hindi == null) {
                skipped++;
                continue;
            }
            String canonical = hindi != null ? hindi : english;
            String district = districtName(node, districtHindi);
            String block = text(node, "block");
            String gp = text(node, "gram_panchayat");

            List<String> path = new ArrayList<>();
            path.add(state);
            if (district != null) path.add(AdminType.DISTRICT.pathLabel(district));
            if (block != null) path.add(AdminType.BLOCK.pathLabel(block));
            if (gp != null) path.add(AdminType.GRAM_PANCHAYAT.pathLabel(gp));
            path.add(canonical);

            GazetteerRecord.GazetteerRecordBuilder builder = GazetteerRecord.builder()
                    .canonical(canonical)
                    .type(AdminType.VILLAGE)
                    .hierarchyPath(path)
                    .district(district)
                    .assembly(text(node, "assembly"))
                    .block(block)
                    .gramPanchayat(gp);
            if (english != null && !english.equals(canonical)) builder.alias(english);
            node.path("aliases").forEach(a -> builder.alias(a.asText()));
            out.add(builder.build());
        }

        log.info("Loaded {} villages from {} ({} skipped)", out.size(), location, skipped);
        return out;
    }

    // ── Urban local bodies ───────────────────────────────────────────────────

    private List<GazetteerRecord> loadUrbanBodies(String location, String state, Map<String, String> districtHindi) {
        List<GazetteerRecord> out = new ArrayList<>();
        int skipped = 0;

        for (JsonNode node : readNdjson(location)) {
            String english = text(node, "ulb");
            String hindi = text(node, "ulb_hi");
            if (english == null && hindi == null) {
                skipped++;
                continue;
            }
            String canonical = hindi != null ? hindi : english;
            String district = districtName(node, districtHindi);
            String ulbType = text(node, "ulb_type");

            List<String> path = new ArrayList<>();
            path.add(state);
            if (district != null) path.add(AdminType.DISTRICT.pathLabel(district));
            path.add(ulbType != null ? canonical + " " + ulbType : canonical);

            GazetteerRecord.GazetteerRecordBuilder builder = GazetteerRecord.builder()
                    .canonical(canonical)
                    .type(AdminType.URBAN_LOCAL_BODY)
                    .hierarchyPath(path)
                    .district(district)
                    .assembly(text(node, "assembly"))
                    .urbanBodyType(ulbType)
                    .wardCount(node.hasNonNull("ward_count") ? node.get("ward_count").asInt() : null);
            if (english != null && !english.equals(canonical)) builder.alias(english);
            node.path("aliases").forEach(a -> builder.alias(a.asText()));
            out.add(builder.build());
        }

        log.info("Loaded {} urban local bodies from {} ({} skipped)", out.size(), location, skipped);
        return out;
    }

    // ── Curated aliases ──────────────────────────────────────────────────────

    /**
     * Adds curated aliases (alias,canonical,type) onto matching records.
     * An alias whose canonical record is unknown is logged and dropped.
     */
    private List<GazetteerRecord> applyAliases(List<GazetteerRecord> records, String location) {
        Map<String, List<String>> extra = new HashMap<>();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Alias table not found at {} - continuing without curated aliases", location);
            return records;
        }

        int read = 0;
        try (CSVReader reader = new CSVReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String[] row;
            boolean header = true;
            while ((row = reader.readNext()) != null) {
                if (header) {
                    header = false;
                    if (row.length > 0 && "alias".equalsIgnoreCase(row[0].trim())) continue;
                }
                if (row.length < 3 || row[0].isBlank() || row[1].isBlank()) continue;
                String key = aliasKey(row[1].trim(), row[2].trim());
                extra.computeIfAbsent(key, k -> new ArrayList<>()).add(row[0].trim());
                read++;
            }
        } catch (IOException | CsvValidationException e) {
            log.warn("Failed to read alias table {}: {}", location, e.getMessage());
            return records;
        }

        List<GazetteerRecord> out = new ArrayList<>(records.size());
        int applied = 0;
        for (GazetteerRecord r : records) {
            List<String> aliases = extra.remove(aliasKey(r.canonical(), r.type().code()));
            if (aliases == null) {
                out.add(r);
                continue;
            }
            out.add(r.toBuilder().aliases(aliases).build());
            applied += aliases.size();
        }
        if (!extra.isEmpty()) {
            log.warn("{} curated aliases point at unknown records: {}", extra.size(), extra.keySet());
        }
        log.info("Applied {} of {} curated aliases from {}", applied, read, location);
        return out;
    }

    private static String aliasKey(String canonical, String typeCode) {
        return typeCode.toLowerCase(Locale.ROOT) + "|" + canonical;
    }

    // ── Reading helpers ──────────────────────────────────────────────────────

    private Optional<JsonNode> readJson(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Reference file not found: {}", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(objectMapper.readTree(in));
        } catch (IOException e) {
            log.warn("Failed to read reference file {}: {}", location, e.getMessage());
            return Optional.empty();
        }
    }

    private List<JsonNode> readNdjson(String location) {
        List<JsonNode> nodes = new ArrayList<>();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Reference file not found: {}", location);
            return nodes;
        }

        int lineNo = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    nodes.add(objectMapper.readTree(line));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed line {} in {}: {}", lineNo, location, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to read reference file {} after {} lines: {}", location, lineNo, e.getMessage());
        }
        return nodes;
    }

    private String districtName(JsonNode node, Map<String, String> districtHindi) {
        String hindi = text(node, "district_hi");
        if (hindi != null) return hindi;
        String english = text(node, "district");
        if (english == null) return null;
        return districtHindi.getOrDefault(english.toLowerCase(Locale.ROOT), english);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String s = value.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static String textAt(JsonNode node, String... path) {
        JsonNode current = node;
        for (String p : path) {
            current = current.path(p);
        }
        if (current.isMissingNode() || current.isNull()) return null;
        String s = current.asText().trim();
        return s.isEmpty() ? null : s;
    }
}
