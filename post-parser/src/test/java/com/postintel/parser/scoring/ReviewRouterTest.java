package com.postintel.parser.scoring;

import com.postintel.parser.TestFixtures;
import com.postintel.parser.model.EventCategory;
import com.postintel.parser.model.ReviewStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewRouterTest {

    private final ReviewRouter router = new ReviewRouter(TestFixtures.properties());

    @Test
    @DisplayName("a condolence post at 0.80 goes to review")
    void condolenceBelowStrictBar() {
        ReviewDecision d = router.route(0.80, EventCategory.CONDOLENCE);

        assertThat(d.needsReview()).isTrue();
        assertThat(d.status()).isEqualTo(ReviewStatus.PENDING);
        assertThat(d.threshold()).isEqualTo(0.92);
    }

    @Test
    @DisplayName("0.88 clears the ordinary bar but not the strict one")
    void sameScoreDifferentCategories() {
        assertThat(router.route(0.88, EventCategory.MEETING).status()).isEqualTo(ReviewStatus.AUTO_APPROVED);
        assertThat(router.route(0.88, EventCategory.CONDOLENCE).needsReview()).isTrue();
    }

    @Test
    void thresholdIsInclusive() {
        assertThat(router.route(0.85, EventCategory.INSPECTION).needsReview()).isFalse();
        assertThat(router.route(0.92, EventCategory.SPORTS_ACHIEVEMENT).needsReview()).isFalse();
    }

    @Test
    void strictCategories() {
        assertThat(router.thresholdFor(EventCategory.INTERNAL_SECURITY)).isEqualTo(0.92);
        assertThat(router.thresholdFor(EventCategory.BIRTHDAY_GREETING)).isEqualTo(0.92);
        assertThat(router.thresholdFor(EventCategory.DISASTER_ACCIDENT)).isEqualTo(0.92);
        assertThat(router.thresholdFor(EventCategory.UNCATEGORIZED)).isEqualTo(0.85);
    }
}
