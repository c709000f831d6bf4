package com.postintel.parser;

import com.postintel.parser.classify.RescueTierRegistry;
import com.postintel.parser.gazetteer.GazetteerIndex;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.model.ParsedPost;
import com.postintel.parser.model.Post;
import com.postintel.parser.semantic.DisabledLocationSearchClient;
import com.postintel.parser.semantic.LocationSearchClient;
import com.postintel.parser.service.PostParsingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "post-parser.semantic.mode=DISABLED",
        "post-parser.batch.input="
})
class PostParserApplicationTest {

    @Autowired
    private PostParsingService parsingService;

    @Autowired
    private GazetteerIndex gazetteerIndex;

    @Autowired
    private RescueTierRegistry rescueTierRegistry;

    @Autowired
    private LocationSearchClient locationSearchClient;

    @Test
    void contextWiresTheWholePipeline() {
        assertThat(gazetteerIndex.isEmpty()).isFalse();
        assertThat(rescueTierRegistry.tiers()).isNotEmpty();
        assertThat(locationSearchClient).isInstanceOf(DisabledLocationSearchClient.class);

        ParsedPost p = parsingService.parse(Post.of("1", "नए सामुदायिक भवन का उद्घाटन एवं लोकार्पण किया"));
        assertThat(p.getEventType()).isEqualTo(EventCategory.INAUGURATION);
    }
}
