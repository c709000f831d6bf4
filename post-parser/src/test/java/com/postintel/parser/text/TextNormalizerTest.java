package com.postintel.parser.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Nested
    @DisplayName("clean / normalize")
    class CleanAndNormalize {

        @Test
        void removesUrlsAndCollapsesWhitespace() {
            assertThat(TextNormalizer.clean("रायपुर   में  https://t.co/abc123 बैठक"))
                    .isEqualTo("रायपुर में बैठक");
        }

        @Test
        void lowercasesLatinAndKeepsDevanagari() {
            assertThat(TextNormalizer.normalize("  CM  Vishnu Deo SAI  रायपुर "))
                    .isEqualTo("cm vishnu deo sai रायपुर");
        }

        @Test
        void nullAndBlankBecomeEmpty() {
            assertThat(TextNormalizer.normalize(null)).isEmpty();
            assertThat(TextNormalizer.normalize("   ")).isEmpty();
            assertThat(TextNormalizer.clean(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("foldScript")
    class FoldScript {

        @Test
        void chandrabinduAndAnusvaraFoldTogether() {
            assertThat(TextNormalizer.foldScript("गाँव")).isEqualTo(TextNormalizer.foldScript("गांव"));
        }

        @Test
        void precomposedAndCombiningNuktaFoldToBaseLetter() {
            String precomposed = "\u095B\u093F\u0932\u093E";
            String combining = "\u091C\u093C\u093F\u0932\u093E";
            assertThat(TextNormalizer.foldScript(precomposed)).isEqualTo("जिला");
            assertThat(TextNormalizer.foldScript(combining)).isEqualTo("जिला");
        }

        @Test
        void nuktaLettersComposedByNfcFoldToo() {
            assertThat(TextNormalizer.foldScript("\u0928\u093C\u092F\u093E")).isEqualTo("\u0928\u092F\u093E");
            assertThat(TextNormalizer.foldScript("\u0929\u092F\u093E")).isEqualTo("\u0928\u092F\u093E");
            assertThat(TextNormalizer.foldScript("\u0930\u093C")).isEqualTo("\u0930");
        }

        @Test
        void dropsZeroWidthJoiners() {
            assertThat(TextNormalizer.foldScript("रा\u200Dयपुर")).isEqualTo(TextNormalizer.foldScript("रायपुर"));
        }
    }

    @Nested
    @DisplayName("variants")
    class Variants {

        @Test
        void devanagariNameGetsLatinForms() {
            Set<String> keys = TextNormalizer.variants("सिलतरा");
            assertThat(keys).contains("सिलतरा", "siltraa", "siltra");
        }

        @Test
        void latinNameGetsVowelCollapsedForm() {
            assertThat(TextNormalizer.variants("Raipoor")).contains("raipoor", "raipor");
        }
    }

    @Nested
    @DisplayName("tokens, handles and hashtags")
    class Tokens {

        @Test
        void splitsOnDandaAndDropsStopwordsAndDigits() {
            assertThat(TextNormalizer.tokens("रायपुर में बैठक। वार्ड 12", Set.of("में"), 2))
                    .containsExactly("रायपुर", "बैठक", "वार्ड");
        }

        @Test
        void extractsHandlesWithoutAt() {
            assertThat(TextNormalizer.extractHandles("साथ में @CMOChhattisgarh और @RaipurDM"))
                    .containsExactly("CMOChhattisgarh", "RaipurDM");
        }

        @Test
        void extractsDevanagariHashtags() {
            assertThat(TextNormalizer.extractHashtags("#छत्तीसगढ़ #ViksitBharat"))
                    .containsExactly("छत्तीसगढ़", "ViksitBharat");
        }
    }
}
