package com.postintel.parser.classify;

import com.postintel.parser.TestFixtures;
import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.model.ClassificationResult;
import com.postintel.parser.model.ClassificationSource;
import com.postintel.parser.model.ContentMode;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.model.RescueVerdict;
import com.postintel.parser.taxonomy.RescueTier;
import com.postintel.parser.taxonomy.TaxonomyLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class RescueEngineTest {

    private static final ClassificationResult UNCATEGORIZED = ClassificationResult.uncategorized(0.3);

    private final RescueEngine engine = new RescueEngine(new RescueTierRegistry(TestFixtures.taxonomy().rescueTiers()));

    private static RescueTier tier(String tag, EventCategory target, String... patterns) {
        return new RescueTier(tag, java.util.Arrays.stream(patterns).map(Pattern::compile).toList(),
                target, 0.1, ContentMode.FIELD_EVENT);
    }

    @Nested
    @DisplayName("Eligibility")
    class Eligibility {

        @Test
        @DisplayName("a categorized post passes through with its implied content mode")
        void categorizedPassesThrough() {
            ClassificationResult meeting = new ClassificationResult(EventCategory.MEETING, List.of(),
                    Map.of(EventCategory.MEETING, 0.6), 0.6, ClassificationSource.KEYWORD);

            RescueVerdict v = engine.rescue(meeting, "Naxal encounter, martyr jawan");

            assertThat(v.rescued()).isFalse();
            assertThat(v.category()).isEqualTo(EventCategory.MEETING);
            assertThat(v.contentMode()).isEqualTo(ContentMode.FIELD_EVENT);
        }

        @Test
        void contentModesForCategorizedPosts() {
            assertThat(RescueEngine.contentModeFor(EventCategory.SPORTS_ACHIEVEMENT)).isEqualTo(ContentMode.SPORTS_REACTION);
            assertThat(RescueEngine.contentModeFor(EventCategory.CONDOLENCE)).isEqualTo(ContentMode.GREETINGS);
            assertThat(RescueEngine.contentModeFor(EventCategory.PRESS_MEDIA)).isEqualTo(ContentMode.POLICY_STATEMENT);
            assertThat(RescueEngine.contentModeFor(EventCategory.UNCATEGORIZED)).isEqualTo(ContentMode.DIGITAL_POST);
            assertThat(RescueEngine.contentModeFor(EventCategory.INSPECTION)).isEqualTo(ContentMode.FIELD_EVENT);
        }
    }

    @Nested
    @DisplayName("Bundled tiers")
    class BundledTiers {

        @Test
        void securityVocabularyRescues() {
            RescueVerdict v = engine.rescue(UNCATEGORIZED, "Tributes to the martyr jawan killed in the Naxal encounter");

            assertThat(v.rescued()).isTrue();
            assertThat(v.category()).isEqualTo(EventCategory.INTERNAL_SECURITY);
            assertThat(v.rescueTag()).isEqualTo("security");
            assertThat(v.matchRatio()).isEqualTo(1.0);
            assertThat(v.confidenceBonus()).isEqualTo(0.25);
            assertThat(v.contentMode()).isEqualTo(ContentMode.POLICY_STATEMENT);
        }

        @Test
        @DisplayName("specific tiers are tried before greetings")
        void securityBeatsGreetings() {
            RescueVerdict v = engine.rescue(UNCATEGORIZED,
                    "Best wishes and happy festival greetings to every martyr jawan family after the naxal attack");

            assertThat(v.category()).isEqualTo(EventCategory.INTERNAL_SECURITY);
        }

        @Test
        void greetingsRescue() {
            RescueVerdict v = engine.rescue(UNCATEGORIZED, "Happy Diwali! Best wishes to everyone");

            assertThat(v.category()).isEqualTo(EventCategory.GREETINGS);
            assertThat(v.contentMode()).isEqualTo(ContentMode.GREETINGS);
        }

        @Test
        @DisplayName("digital tier tags the content mode without rescuing")
        void digitalTagOnly() {
            RescueVerdict v = engine.rescue(UNCATEGORIZED, "Watch live #CGNews @someone");

            assertThat(v.rescued()).isFalse();
            assertThat(v.category()).isEqualTo(EventCategory.UNCATEGORIZED);
            assertThat(v.rescueTag()).isEqualTo("digital");
            assertThat(v.contentMode()).isEqualTo(ContentMode.DIGITAL_POST);
        }

        @Test
        void nothingMatches() {
            RescueVerdict v = engine.rescue(UNCATEGORIZED, "आज का दिन बहुत अच्छा रहा");

            assertThat(v.rescued()).isFalse();
            assertThat(v.rescueTag()).isNull();
            assertThat(v.contentMode()).isEqualTo(ContentMode.DIGITAL_POST);
        }
    }

    @Test
    @DisplayName("a match ratio of exactly one half is not enough")
    void halfIsNotEnough() {
        RescueEngine halfEngine = new RescueEngine(new RescueTierRegistry(
                List.of(tier("pair", EventCategory.MEETING, "alpha", "beta"))));

        assertThat(halfEngine.rescue(UNCATEGORIZED, "alpha only").rescued()).isFalse();
        assertThat(halfEngine.rescue(UNCATEGORIZED, "alpha and beta").rescued()).isTrue();
    }

    @Nested
    @DisplayName("Tier registry")
    class Registry {

        @Test
        void proposalsAreInstalledAtTheirPosition() {
            PostParserProperties properties = TestFixtures.properties();
            properties.getTaxonomy().setProposedRescueTiers("classpath:fixtures/proposals.json");
            RescueTierRegistry registry = new RescueTierRegistry(TestFixtures.taxonomy(),
                    new TaxonomyLoader(new DefaultResourceLoader(), TestFixtures.MAPPER), properties);

            assertThat(registry.tiers().get(0).tag()).isEqualTo("cricket_first");

            RescueVerdict v = new RescueEngine(registry).rescue(UNCATEGORIZED, "India won the cricket final");
            assertThat(v.rescueTag()).isEqualTo("cricket_first");
            assertThat(v.category()).isEqualTo(EventCategory.SPORTS_ACHIEVEMENT);
        }

        @Test
        void noProposalsKeepsTaxonomyOrder() {
            RescueTierRegistry registry = new RescueTierRegistry(TestFixtures.taxonomy(),
                    new TaxonomyLoader(new DefaultResourceLoader(), TestFixtures.MAPPER), TestFixtures.properties());

            assertThat(registry.tiers()).isEqualTo(TestFixtures.taxonomy().rescueTiers());
        }

        @Test
        void insertReplacesSameTagAndClampsPosition() {
            RescueTierRegistry registry = new RescueTierRegistry(List.of(
                    tier("a", EventCategory.MEETING, "a"), tier("b", EventCategory.RALLY, "b")));

            registry.insert(99, tier("a", EventCategory.INSPECTION, "aa"));

            assertThat(registry.tiers()).extracting(RescueTier::tag).containsExactly("b", "a");
            assertThat(registry.tiers().get(1).target()).isEqualTo(EventCategory.INSPECTION);
        }
    }
}
