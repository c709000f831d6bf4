package com.postintel.parser.location;

import com.postintel.parser.TestFixtures;
import com.postintel.parser.model.PostHints;
import com.postintel.parser.text.TextNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateExtractorTest {

    private final CandidateExtractor extractor =
            new CandidateExtractor(TestFixtures.taxonomy(), TestFixtures.properties());

    private List<Candidate> extract(String text) {
        return extractor.extract(TextNormalizer.normalize(text), PostHints.none());
    }

    @Test
    void nameBeforeTrailingMarkerIsMarkerAdjacent() {
        assertThat(extract("रायपुर जिला में आज जनदर्शन कार्यक्रम आयोजित हुआ"))
                .contains(new Candidate("रायपुर", true));
    }

    @Test
    void multiWordMarkerIsNotSwallowedIntoTheName() {
        assertThat(extract("भिलाई नगर निगम की बैठक"))
                .contains(new Candidate("भिलाई", true))
                .noneMatch(c -> c.markerAdjacent() && c.surface().startsWith("भिलाई "));
    }

    @Test
    void nameAfterLeadingMarkerIsMarkerAdjacent() {
        assertThat(extract("ग्राम सिलतरा में चौपाल"))
                .contains(new Candidate("सिलतरा", true));
    }

    @Test
    void plainTokensAreCandidatesWithoutMarkerFlag() {
        assertThat(extract("रायपुर जिला में आज जनदर्शन कार्यक्रम आयोजित हुआ"))
                .contains(new Candidate("जनदर्शन", false));
    }

    @Test
    void stopwordsNeverBecomeCandidates() {
        assertThat(extract("आज का दिन बहुत अच्छा रहा"))
                .extracting(Candidate::surface)
                .doesNotContain("आज", "का", "रहा");
    }

    @Test
    void locationHintIsAddedAsMarkerAdjacent() {
        List<Candidate> candidates = extractor.extract("बैठक संपन्न", new PostHints(List.of(), "धमतरी"));
        assertThat(candidates).contains(new Candidate("धमतरी", true));
    }

    @Test
    void blankTextHasNoCandidates() {
        assertThat(extract("  ")).isEmpty();
    }
}
