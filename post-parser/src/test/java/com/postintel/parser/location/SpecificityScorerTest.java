package com.postintel.parser.location;

import com.postintel.parser.TestFixtures;
import com.postintel.parser.model.AdminType;
import com.postintel.parser.model.GazetteerRecord;
import com.postintel.parser.model.Post;
import com.postintel.parser.text.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SpecificityScorerTest {

    private final SpecificityScorer scorer = new SpecificityScorer(TestFixtures.properties(), TestFixtures.taxonomy());

    private LocationContext context(String text) {
        String normalized = TextNormalizer.normalize(text);
        String folded = TextNormalizer.foldScript(text);
        return new LocationContext(Post.of("t", text), text, normalized, folded, List.of(),
                scorer.detectArea(folded), NoOpLocationWindow.INSTANCE);
    }

    @Nested
    @DisplayName("Area context")
    class Area {

        @Test
        void wardVocabularyIsUrban() {
            assertThat(scorer.detectArea(TextNormalizer.foldScript("वार्ड 5 के पार्षद"))).isEqualTo(AreaContext.URBAN);
        }

        @Test
        void panchayatVocabularyIsRural() {
            assertThat(scorer.detectArea(TextNormalizer.foldScript("ग्राम पंचायत में सरपंच"))).isEqualTo(AreaContext.RURAL);
        }

        @Test
        void noVocabularyIsNone() {
            assertThat(scorer.detectArea("आज का दिन")).isEqualTo(AreaContext.NONE);
        }
    }

    @Nested
    @DisplayName("Marker adjacency")
    class Markers {

        @Test
        void trailingDistrictMarker() {
            assertThat(scorer.markerAdjacent("रायपुर जिला में", "रायपुर", AdminType.DISTRICT)).isTrue();
            assertThat(scorer.markerAdjacent("रायपुर जिला में", "रायपुर", AdminType.URBAN_LOCAL_BODY)).isFalse();
        }

        @Test
        void leadingVillageMarker() {
            assertThat(scorer.markerAdjacent("ग्राम सिलतरा में", "सिलतरा", AdminType.VILLAGE)).isTrue();
        }

        @Test
        void markerMustBeAWholeWord() {
            assertThat(scorer.markerAdjacent("रायपुर जिलाध्यक्ष", "रायपुर", AdminType.DISTRICT)).isFalse();
        }
    }

    @Nested
    @DisplayName("Tie-break score")
    class Score {

        @Test
        void urbanBodyWithWardMarkerInUrbanContext() {
            GazetteerRecord ulb = TestFixtures.urbanBody("कुरुद", "धमतरी", "नगर पालिका");
            double score = scorer.score(ulb, "कुरुद", 0.90, context("कुरुद वार्ड 5 के पार्षद"));
            // 0.5 + 0.2 type + 0.5 context + 1.0 marker + 3 x 0.05 depth + 0.90
            assertThat(score).isCloseTo(3.25, within(1e-9));
        }

        @Test
        void villageWithoutMarkerOrContext() {
            GazetteerRecord village = TestFixtures.village("कुरुद", "धमतरी", "कुरुद", "कुरुद");
            double score = scorer.score(village, "कुरुद", 0.95, context("कुरुद वार्ड 5 के पार्षद"));
            // 0.5 + 0.3 type + 5 x 0.05 depth + 0.95
            assertThat(score).isCloseTo(2.0, within(1e-9));
        }

        @Test
        void markerOutweighsSpecificity() {
            LocationContext ctx = context("रायपुर जिला में बैठक");
            double district = scorer.score(TestFixtures.district("रायपुर"), "रायपुर", 0.85, ctx);
            double ulb = scorer.score(TestFixtures.urbanBody("रायपुर", "रायपुर", "नगर निगम"), "रायपुर", 0.90, ctx);
            assertThat(district).isGreaterThan(ulb);
        }
    }
}
