package com.postintel.parser.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** Writes the {@code <stem>_stats.json} side-car. */
@Component
@Slf4j
@RequiredArgsConstructor
public class StatsWriter {

    private final ObjectMapper objectMapper;

    public Path write(BatchStats stats, Path outputDir, String stem) {
        OutputFiles.ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(stem + "_stats.json");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), stats);
            log.info("Batch stats written to {}", outputPath);
            return outputPath;
        } catch (IOException e) {
            log.error("Failed to write stats file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("Stats write failed: " + outputPath, e);
        }
    }
}
