package com.postintel.parser.output;

import com.opencsv.CSVWriter;
import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.AnnotatedPost;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.model.ParsedPost;
import com.postintel.parser.model.ResolvedLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a flat review summary of annotated posts to CSV.
 *
 * Output path pattern: {outputDir}/{stem}_summary.csv
 * List-valued columns are joined with "|".
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private final PostParserProperties properties;

    private static final String[] HEADERS = {
            "post_id", "event_date",
            "event_type", "event_type_secondary", "classification_source", "content_mode", "rescue_tag",
            "location", "location_type", "district", "urban_body", "village", "ward",
            "location_source", "location_confidence",
            "schemes", "people", "hashtags",
            "confidence", "review_status", "needs_review"
    };

    public Path write(List<AnnotatedPost> posts, Path outputDir, String stem) {
        OutputFiles.ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(stem + "_summary.csv");

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (AnnotatedPost annotated : posts) {
                writer.writeNext(toRow(annotated.parsed()));
            }

            log.info("Written {} rows to CSV: {}", posts.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + outputPath, e);
        }
    }

    String[] toRow(ParsedPost p) {
        ResolvedLocation loc = p.getLocation();
        return new String[]{
                str(p.getPostId()),
                str(p.getEventDate()),
                p.getEventType().name(),
                p.getEventTypeSecondary() == null ? ""
                        : p.getEventTypeSecondary().stream().map(EventCategory::name).collect(Collectors.joining("|")),
                p.getClassificationSource() == null ? "" : p.getClassificationSource().wireName(),
                p.getContentMode() == null ? "" : p.getContentMode().name(),
                str(p.getRescueTag()),
                loc == null ? "" : str(loc.canonical()),
                loc == null ? "" : loc.locationType().code(),
                loc == null ? "" : str(loc.district()),
                loc == null ? "" : str(loc.urbanBody()),
                loc == null ? "" : str(loc.village()),
                loc == null ? "" : str(loc.ward()),
                loc == null ? "" : loc.source().wireName(),
                str(p.getLocationConfidence()),
                p.getEntities() == null ? "" : String.join("|", p.getEntities().schemes()),
                p.getEntities() == null ? "" : String.join("|", p.getEntities().people()),
                p.getEntities() == null ? "" : String.join("|", p.getEntities().hashtags()),
                str(p.getConfidence()),
                p.getReviewStatus() == null ? "" : p.getReviewStatus().wireName(),
                str(p.isNeedsReview())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
