package com.postintel.parser.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.postintel.parser.model.Post;
import com.postintel.parser.model.PostHints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps one NDJSON input line to a {@link Post}.
 *
 * Accepted field names:
 *   text       - "text" or "raw_text"
 *   id         - "id" or "tweet_id"; falls back to "line-N"
 *   timestamp  - "created_at" or "timestamp": ISO-8601, epoch millis, or the
 *                classic Twitter form "Wed Oct 10 20:19:24 +0000 2018"
 *   hints      - optional {"handles": [...], "location_hint": "..."}
 *
 * A bad timestamp is not fatal; the post is kept without one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PostRecordMapper {

    private static final List<DateTimeFormatter> TIMESTAMP_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_INSTANT,
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH));

    private final ObjectMapper objectMapper;

    public Post map(String line, long lineNumber) {
        if (line == null || line.isBlank()) {
            throw new MalformedPostException("Line " + lineNumber + " is blank");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedPostException("Line " + lineNumber + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode record)) {
            throw new MalformedPostException("Line " + lineNumber + " is not a JSON object");
        }

        String text = firstText(record, "text", "raw_text");
        if (text == null || text.isBlank()) {
            throw new MalformedPostException("Line " + lineNumber + " has no text");
        }

        String id = firstText(record, "id", "tweet_id");
        if (id == null || id.isBlank()) {
            id = "line-" + lineNumber;
        }

        return new Post(id, text, timestamp(record, id), hints(record.get("hints")), record);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String firstText(ObjectNode record, String... fields) {
        for (String field : fields) {
            JsonNode value = record.get(field);
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Instant timestamp(ObjectNode record, String id) {
        JsonNode value = record.hasNonNull("created_at") ? record.get("created_at") : record.get("timestamp");
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return Instant.ofEpochMilli(value.asLong());

        String raw = value.asText().trim();
        DateTimeParseException last = null;
        for (DateTimeFormatter format : TIMESTAMP_FORMATS) {
            try {
                return format.parse(raw, Instant::from);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.debug("Post {}: unparseable timestamp '{}' ({})", id, raw, last == null ? "" : last.getMessage());
        return null;
    }

    private static PostHints hints(JsonNode node) {
        if (node == null || !node.isObject()) return PostHints.none();

        List<String> handles = new ArrayList<>();
        JsonNode handlesNode = node.get("handles");
        if (handlesNode != null && handlesNode.isArray()) {
            handlesNode.forEach(h -> {
                String handle = h.asText().trim();
                if (handle.startsWith("@")) handle = handle.substring(1);
                if (!handle.isEmpty()) handles.add(handle);
            });
        }
        JsonNode location = node.hasNonNull("location_hint") ? node.get("location_hint") : node.get("location");
        String locationHint = location == null || location.isNull() ? null : location.asText();
        return new PostHints(handles, locationHint);
    }
}
