package com.postintel.parser.output;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.AnnotatedPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Routes annotated posts to the configured sink(s).
 * Supports NDJSON, CSV, or BOTH modes. The stats side-car is always written.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final AnnotatedPostWriter annotatedPostWriter;
    private final CsvWriter csvWriter;
    private final StatsWriter statsWriter;
    private final PostParserProperties properties;

    public void write(List<AnnotatedPost> posts, String stem) {
        Path outputDir = outputDir();
        PostParserProperties.Output.OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case NDJSON -> annotatedPostWriter.write(posts, outputDir, stem);
            case CSV -> csvWriter.write(posts, outputDir, stem);
            case BOTH -> {
                annotatedPostWriter.write(posts, outputDir, stem);
                csvWriter.write(posts, outputDir, stem);
            }
        }
    }

    public void writeStats(BatchStats stats, String stem) {
        statsWriter.write(stats, outputDir(), stem);
    }

    public Path outputDir() {
        return Paths.get(properties.getOutput().getOutputDir());
    }
}
