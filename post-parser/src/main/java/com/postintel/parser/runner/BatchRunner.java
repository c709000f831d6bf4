package com.postintel.parser.runner;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.service.BatchParseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runs a batch on startup.
 *
 * The input file comes from the first non-option argument, or from
 * post-parser.batch.input (BATCH_INPUT env var). With neither set the
 * application only loads its reference data and exits.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BatchRunner implements ApplicationRunner {

    private final BatchParseService batchParseService;
    private final PostParserProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String input = args.getNonOptionArgs().isEmpty()
                ? properties.getBatch().getInput()
                : args.getNonOptionArgs().get(0);

        if (input == null || input.isBlank()) {
            log.info("Post parser ready. No batch input configured (post-parser.batch.input)");
            return;
        }

        Path path = Paths.get(input);
        if (!Files.isRegularFile(path)) {
            log.error("Batch input {} does not exist or is not a file", path);
            return;
        }
        batchParseService.run(path);
    }
}
