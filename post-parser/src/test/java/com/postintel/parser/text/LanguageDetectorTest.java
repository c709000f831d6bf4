package com.postintel.parser.text;

import com.postintel.parser.model.LanguageProfile;
import com.postintel.parser.model.LanguageProfile.Language;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageDetectorTest {

    @Test
    void hindiPost() {
        assertThat(LanguageDetector.detect("रायपुर में समीक्षा बैठक").language()).isEqualTo(Language.HINDI);
    }

    @Test
    void englishPost() {
        assertThat(LanguageDetector.detect("Reviewed the flood relief work today").language())
                .isEqualTo(Language.ENGLISH);
    }

    @Test
    void mixedPostIsFlagged() {
        LanguageProfile profile = LanguageDetector.detect("Raipur meeting रायपुर बैठक");
        assertThat(profile.language()).isEqualTo(Language.MIXED);
        assertThat(profile.mixed()).isTrue();
    }

    @Test
    void blankIsUnknown() {
        assertThat(LanguageDetector.detect(" ").language()).isEqualTo(Language.UNKNOWN);
    }
}
