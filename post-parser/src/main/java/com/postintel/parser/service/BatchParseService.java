package com.postintel.parser.service;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.location.LocationWindow;
import com.postintel.parser.location.NoOpLocationWindow;
import com.postintel.parser.location.RollingLocationWindow;
import com.postintel.parser.location.StagedLocationWindow;
import com.postintel.parser.model.AnnotatedPost;
import com.postintel.parser.model.BatchRun;
import com.postintel.parser.model.ParsedPost;
import com.postintel.parser.model.Post;
import com.postintel.parser.output.BatchStats;
import com.postintel.parser.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Annotates an NDJSON file of posts and writes the results plus a stats side-car.
 *
 * With one worker the posts run in input order through a single shared location
 * window, so temporal inference sees the whole stream. With N workers the input is
 * cut into N contiguous slices and each worker gets its own window: a post at the
 * start of a slice cannot inherit a location from the previous slice.
 * Output order always follows input order.
 *
 * A post that overruns its time budget is emitted unannotated and leaves no trace
 * in the window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchParseService {

    private final PostRecordMapper recordMapper;
    private final PostParsingService parsingService;
    private final OutputRouter outputRouter;
    private final PostParserProperties properties;

    public BatchRun run(Path input) {
        BatchRun run = BatchRun.builder()
                .runId(UUID.randomUUID().toString())
                .inputFile(input.toString())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();
        String stem = stem(input);
        List<AnnotatedPost> annotated = List.of();
        int skipped = 0;

        log.info("Batch {} started: {}", run.getRunId(), input);
        try {
            byte[] data = Files.readAllBytes(input);
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);

            List<Post> posts = new ArrayList<>();
            long lineNumber = 0;
            for (int start = 0; start < data.length; ) {
                int end = lineEnd(data, start);
                lineNumber++;
                try {
                    String line = decodeLine(decoder, data, start, end, lineNumber);
                    if (!line.isBlank()) {
                        posts.add(recordMapper.map(line, lineNumber));
                    }
                } catch (MalformedPostException e) {
                    skipped++;
                    log.warn("Skipping input record: {}", e.getMessage());
                }
                start = end + 1;
            }
            run.setRecordsRead(posts.size() + skipped);
            run.setRecordsSkipped(skipped);

            annotated = annotateAll(posts);
            outputRouter.write(annotated, stem);

            run.setRecordsWritten(annotated.size());
            run.setStatus("SUCCESS");
            log.info("Batch {} complete: {} annotated, {} skipped", run.getRunId(), annotated.size(), skipped);

        } catch (IOException e) {
            fail(run, e);
            throw new UncheckedIOException("Cannot read batch input: " + input, e);
        } catch (RuntimeException e) {
            fail(run, e);
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writeStats(BatchStats.from(run, annotated, skipped), stem);
        }
        return run;
    }

    List<AnnotatedPost> annotateAll(List<Post> posts) {
        int workers = Math.max(1, Math.min(properties.getBatch().getWorkers(), posts.size()));
        if (workers <= 1) {
            return annotateSlice(posts, newWindow(), 0);
        }

        log.info("Annotating {} posts with {} workers (one location window each)", posts.size(), workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            int sliceSize = (posts.size() + workers - 1) / workers;
            List<Future<List<AnnotatedPost>>> slices = new ArrayList<>();
            for (int from = 0; from < posts.size(); from += sliceSize) {
                List<Post> slice = posts.subList(from, Math.min(from + sliceSize, posts.size()));
                int offset = from;
                slices.add(pool.submit(() -> annotateSlice(slice, newWindow(), offset)));
            }

            List<AnnotatedPost> out = new ArrayList<>(posts.size());
            for (Future<List<AnnotatedPost>> slice : slices) {
                out.addAll(slice.get());
            }
            return out;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<AnnotatedPost> annotateSlice(List<Post> posts, LocationWindow window, int offset) {
        PostParserProperties.Batch cfg = properties.getBatch();
        List<AnnotatedPost> out = new ArrayList<>(posts.size());

        for (Post post : posts) {
            StagedLocationWindow staged = new StagedLocationWindow(window);
            long started = System.nanoTime();
            ParsedPost parsed = parsingService.parse(post, staged);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            if (cfg.getPostBudgetMs() > 0 && elapsedMs > cfg.getPostBudgetMs()) {
                log.warn("Post {} took {} ms (budget {} ms) - emitted unannotated",
                        post.id(), elapsedMs, cfg.getPostBudgetMs());
                staged.discard();
                parsed = parsingService.sparse(post, "budget exceeded: " + elapsedMs + " ms");
            } else {
                staged.commit();
            }
            out.add(new AnnotatedPost(post, parsed, elapsedMs));

            int done = offset + out.size();
            if (cfg.getProgressEvery() > 0 && done % cfg.getProgressEvery() == 0) {
                log.info("Annotated {} posts", done);
            }
        }
        return out;
    }

    private LocationWindow newWindow() {
        PostParserProperties.Temporal temporal = properties.getLocation().getTemporal();
        return temporal.isEnabled() ? new RollingLocationWindow(temporal.getWindowSize()) : NoOpLocationWindow.INSTANCE;
    }

    private static int lineEnd(byte[] data, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == '\n') return i;
        }
        return data.length;
    }

    /** Decodes one line strictly; a line that is not valid UTF-8 is a malformed record. */
    static String decodeLine(CharsetDecoder decoder, byte[] data, int start, int end, long lineNumber) {
        int length = end - start;
        if (length > 0 && data[end - 1] == '\r') length--;
        try {
            return decoder.decode(ByteBuffer.wrap(data, start, length)).toString();
        } catch (CharacterCodingException e) {
            throw new MalformedPostException("Line " + lineNumber + " is not valid UTF-8", e);
        }
    }

    private static void fail(BatchRun run, Exception e) {
        log.error("Batch {} failed: {}", run.getRunId(), e.getMessage(), e);
        run.setStatus("FAILED");
        run.setErrorMessage(e.getMessage());
    }

    static String stem(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
