package com.postintel.parser.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.AnnotatedPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes annotated posts as NDJSON, one record per line.
 *
 * Output path pattern: {outputDir}/{stem}_parsed.jsonl
 *
 * Each line is the input record with two fields added:
 *   parsed_data - the annotation
 *   metadata    - {model, version, processing_time_ms}
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnnotatedPostWriter {

    private final ObjectMapper objectMapper;
    private final PostParserProperties properties;

    public Path write(List<AnnotatedPost> posts, Path outputDir, String stem) {
        OutputFiles.ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(stem + "_parsed.jsonl");

        try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            for (AnnotatedPost annotated : posts) {
                writer.write(objectMapper.writeValueAsString(toRecord(annotated)));
                writer.newLine();
            }
            log.info("Written {} annotated posts to {}", posts.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write annotated posts to {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("NDJSON write failed: " + outputPath, e);
        }
    }

    ObjectNode toRecord(AnnotatedPost annotated) {
        ObjectNode record = annotated.post().raw() != null
                ? annotated.post().raw().deepCopy()
                : objectMapper.createObjectNode()
                        .put("id", annotated.post().id())
                        .put("text", annotated.post().text());

        record.set("parsed_data", objectMapper.valueToTree(annotated.parsed()));
        record.putObject("metadata")
                .put("model", properties.getModelName())
                .put("version", properties.getVersion())
                .put("processing_time_ms", annotated.processingTimeMs());
        return record;
    }
}
