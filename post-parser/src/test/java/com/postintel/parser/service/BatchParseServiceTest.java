package com.postintel.parser.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.postintel.parser.TestFixtures;
import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.location.LocationWindow;
import com.postintel.parser.model.BatchRun;
import com.postintel.parser.model.Post;
import com.postintel.parser.output.AnnotatedPostWriter;
import com.postintel.parser.output.CsvWriter;
import com.postintel.parser.output.OutputRouter;
import com.postintel.parser.output.StatsWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

class BatchParseServiceTest {

    @TempDir
    Path outputDir;

    private PostParserProperties properties;
    private BatchParseService batch;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        properties.getSemantic().setMode(PostParserProperties.Semantic.Mode.DISABLED);
        properties.getOutput().setOutputDir(outputDir.toString());
        properties.getOutput().setMode(PostParserProperties.Output.OutputMode.BOTH);
        batch = newBatch(properties);
    }

    private static BatchParseService newBatch(PostParserProperties properties) {
        return newBatch(properties,
                TestFixtures.parsingService(properties, TestFixtures.resolver(properties, TestFixtures.gazetteer())));
    }

    private static BatchParseService newBatch(PostParserProperties properties, PostParsingService parsingService) {
        OutputRouter router = new OutputRouter(
                new AnnotatedPostWriter(TestFixtures.MAPPER, properties),
                new CsvWriter(properties),
                new StatsWriter(TestFixtures.MAPPER),
                properties);
        return new BatchParseService(new PostRecordMapper(TestFixtures.MAPPER), parsingService, router, properties);
    }

    private static Path fixture() throws Exception {
        return Paths.get(BatchParseServiceTest.class.getResource("/fixtures/posts.ndjson").toURI());
    }

    @Test
    @DisplayName("annotates good lines, skips malformed ones and keeps input order")
    void annotatesFixtureFile() throws Exception {
        BatchRun run = batch.run(fixture());

        assertThat(run.getStatus()).isEqualTo("SUCCESS");
        assertThat(run.getRecordsRead()).isEqualTo(5);
        assertThat(run.getRecordsSkipped()).isEqualTo(2);
        assertThat(run.getRecordsWritten()).isEqualTo(3);

        List<String> lines = Files.readAllLines(outputDir.resolve("posts_parsed.jsonl"), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);

        JsonNode first = TestFixtures.MAPPER.readTree(lines.get(0));
        assertThat(first.get("tweet_id").asText()).isEqualTo("1001");
        assertThat(first.get("raw_text").asText()).contains("जनदर्शन");
        assertThat(first.at("/parsed_data/event_type").asText()).isEqualTo("PUBLIC_OUTREACH");
        assertThat(first.at("/parsed_data/location/canonical").asText()).isEqualTo("रायपुर");
        assertThat(first.at("/parsed_data/event_date").asText()).isEqualTo("2024-03-05");
        assertThat(first.at("/parsed_data/signals/keyword").isNumber()).isTrue();
        assertThat(first.at("/metadata/model").asText()).isEqualTo("post-parser");

        assertThat(TestFixtures.MAPPER.readTree(lines.get(1)).get("id").asText()).isEqualTo("1002");
        assertThat(TestFixtures.MAPPER.readTree(lines.get(2)).at("/parsed_data/needs_review").asBoolean()).isTrue();
    }

    @Test
    void writesCsvSummaryAndStats() throws Exception {
        batch.run(fixture());

        List<String> csv = Files.readAllLines(outputDir.resolve("posts_summary.csv"), StandardCharsets.UTF_8);
        assertThat(csv).hasSize(4);
        assertThat(csv.get(0)).startsWith("\"post_id\"");

        JsonNode stats = TestFixtures.MAPPER.readTree(outputDir.resolve("posts_stats.json").toFile());
        assertThat(stats.get("total_posts").asInt()).isEqualTo(3);
        assertThat(stats.get("skipped_records").asInt()).isEqualTo(2);
        assertThat(stats.at("/by_category/INAUGURATION").asInt()).isEqualTo(1);
        assertThat(stats.at("/run/status").asText()).isEqualTo("SUCCESS");
    }

    @Test
    @DisplayName("parallel workers produce the same posts in the same order")
    void parallelWorkersKeepOrder() throws Exception {
        properties.getBatch().setWorkers(3);
        properties.getOutput().setMode(PostParserProperties.Output.OutputMode.NDJSON);

        newBatch(properties).run(fixture());

        List<String> ids = Files.readAllLines(outputDir.resolve("posts_parsed.jsonl"), StandardCharsets.UTF_8).stream()
                .map(line -> {
                    JsonNode node = readQuietly(line);
                    return node.has("tweet_id") ? node.get("tweet_id").asText() : node.get("id").asText();
                })
                .toList();
        assertThat(ids).containsExactly("1001", "1002", "1004");
    }

    @Test
    @DisplayName("a missing input file fails the run but still writes stats")
    void missingInput() {
        Path missing = outputDir.resolve("nope.ndjson");

        assertThatThrownBy(() -> batch.run(missing)).isInstanceOf(UncheckedIOException.class);
        assertThat(outputDir.resolve("nope_stats.json")).exists();
    }

    @Test
    @DisplayName("a line that is not valid UTF-8 is skipped and the rest of the file is annotated")
    void invalidUtf8LineIsSkipped() throws Exception {
        Path input = outputDir.resolve("mixed.ndjson");
        try (OutputStream out = Files.newOutputStream(input)) {
            out.write(("{\"id\": \"1\", \"text\": \"नए सामुदायिक भवन का उद्घाटन किया\"}\r\n")
                    .getBytes(StandardCharsets.UTF_8));
            out.write("{\"id\": \"2\", \"text\": \"bad ".getBytes(StandardCharsets.UTF_8));
            out.write(0xFF);
            out.write(" byte\"}\r\n".getBytes(StandardCharsets.UTF_8));
            out.write("{\"id\": \"3\", \"text\": \"आज का दिन बहुत अच्छा रहा\"}\n".getBytes(StandardCharsets.UTF_8));
        }

        BatchRun run = batch.run(input);

        assertThat(run.getStatus()).isEqualTo("SUCCESS");
        assertThat(run.getRecordsRead()).isEqualTo(3);
        assertThat(run.getRecordsSkipped()).isEqualTo(1);
        assertThat(run.getRecordsWritten()).isEqualTo(2);
        assertThat(Files.readAllLines(outputDir.resolve("mixed_parsed.jsonl"), StandardCharsets.UTF_8))
                .extracting(line -> readQuietly(line).get("id").asText())
                .containsExactly("1", "3");
    }

    @Test
    void decodeLineStripsCarriageReturnAndRejectsBadBytes() {
        byte[] data = "ab\r".getBytes(StandardCharsets.UTF_8);
        assertThat(BatchParseService.decodeLine(StandardCharsets.UTF_8.newDecoder(), data, 0, data.length, 1))
                .isEqualTo("ab");

        byte[] bad = {'a', (byte) 0xC3};
        assertThatThrownBy(() -> BatchParseService.decodeLine(strictDecoder(), bad, 0, bad.length, 7))
                .isInstanceOf(MalformedPostException.class)
                .hasMessageContaining("Line 7");
    }

    @Test
    @DisplayName("a post over its time budget leaves nothing in the window for the next post")
    void budgetBreachDoesNotFeedTemporalInference() throws Exception {
        properties.getBatch().setPostBudgetMs(200);
        properties.getOutput().setMode(PostParserProperties.Output.OutputMode.NDJSON);
        PostParsingService slowOnFirst = spy(
                TestFixtures.parsingService(properties, TestFixtures.resolver(properties, TestFixtures.gazetteer())));
        doAnswer(invocation -> {
            Object parsed = invocation.callRealMethod();
            if ("1".equals(invocation.<Post>getArgument(0).id())) {
                Thread.sleep(400);
            }
            return parsed;
        }).when(slowOnFirst).parse(any(Post.class), any(LocationWindow.class));

        Path input = outputDir.resolve("slow.ndjson");
        Files.write(input, List.of(
                "{\"id\": \"1\", \"text\": \"रायपुर जिला में आज जनदर्शन कार्यक्रम आयोजित हुआ\", \"timestamp\": \"2024-03-05T05:00:00Z\"}",
                "{\"id\": \"2\", \"text\": \"नए सामुदायिक भवन का उद्घाटन एवं लोकार्पण किया\", \"timestamp\": \"2024-03-05T05:10:00Z\"}"),
                StandardCharsets.UTF_8);

        newBatch(properties, slowOnFirst).run(input);

        List<String> lines = Files.readAllLines(outputDir.resolve("slow_parsed.jsonl"), StandardCharsets.UTF_8);
        JsonNode first = readQuietly(lines.get(0));
        JsonNode second = readQuietly(lines.get(1));
        assertThat(first.at("/parsed_data/location").isMissingNode()).isTrue();
        assertThat(first.at("/parsed_data/trace/0").asText()).startsWith("budget exceeded");
        assertThat(second.at("/parsed_data/location").isMissingNode()).isTrue();
        assertThat(second.at("/parsed_data/event_type").asText()).isEqualTo("INAUGURATION");
    }

    private static CharsetDecoder strictDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    @Test
    void stemDropsTheExtension() {
        assertThat(BatchParseService.stem(Paths.get("/data/posts_2024.ndjson"))).isEqualTo("posts_2024");
        assertThat(BatchParseService.stem(Paths.get("posts"))).isEqualTo("posts");
    }

    private static JsonNode readQuietly(String line) {
        try {
            return TestFixtures.MAPPER.readTree(line);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
