package com.postintel.parser.gazetteer;

import com.postintel.parser.TestFixtures;
import com.postintel.parser.model.AdminType;
import com.postintel.parser.model.GazetteerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GazetteerIndexTest {

    @Nested
    @DisplayName("Round trip over the bundled reference data")
    class RoundTrip {

        @Test
        void everyRecordIsReachableByEachOfItsNames() {
            GazetteerIndex index = TestFixtures.gazetteer();
            assertThat(index.records()).isNotEmpty();

            for (GazetteerRecord record : index.records()) {
                for (String name : record.allNames()) {
                    assertThat(index.lookupAll(name))
                            .as("%s via '%s'", record.canonical(), name)
                            .anyMatch(m -> m.record().equals(record) && m.exact());
                }
            }
        }

        @Test
        void loadsAllThreeLevels() {
            Map<AdminType, Integer> stats = TestFixtures.gazetteer().stats();
            assertThat(stats.get(AdminType.DISTRICT)).isGreaterThanOrEqualTo(30);
            assertThat(stats).containsKeys(AdminType.VILLAGE, AdminType.URBAN_LOCAL_BODY);
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        private final GazetteerIndex index = TestFixtures.kurudGazetteer();

        @Test
        void sharedNameReturnsEveryTypedRecord() {
            List<GazetteerMatch> matches = index.lookupAll("कुरुद");

            assertThat(matches).extracting(m -> m.record().type())
                    .containsExactlyInAnyOrder(AdminType.VILLAGE, AdminType.URBAN_LOCAL_BODY);
            assertThat(matches).allMatch(GazetteerMatch::exact);
        }

        @Test
        void resolveByNamePrefersTheMostSpecificLevel() {
            assertThat(index.resolveByName("कुरुद")).get()
                    .extracting(GazetteerRecord::type).isEqualTo(AdminType.VILLAGE);
            assertThat(index.resolveByName("Dhamtari")).get()
                    .extracting(GazetteerRecord::canonical).isEqualTo("धमतरी");
        }

        @Test
        void spellingVariantIsAFuzzyHit() {
            List<GazetteerMatch> matches = index.lookupAll("DHAAMTARI");

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).record().canonical()).isEqualTo("धमतरी");
            assertThat(matches.get(0).exact()).isFalse();
        }

        @Test
        void unknownAndBlankNamesMatchNothing() {
            assertThat(index.lookupAll("मुंबई")).isEmpty();
            assertThat(index.lookupAll(" ")).isEmpty();
            assertThat(index.resolveByName(null)).isEmpty();
        }

        @Test
        void latinNamesAreLongestFirst() {
            List<Map.Entry<String, GazetteerRecord>> names = index.latinNames(4);

            assertThat(names).extracting(Map.Entry::getKey).containsExactly("dhamtari", "kurud");
        }
    }

    @Test
    void emptyIndex() {
        GazetteerIndex empty = GazetteerIndex.empty();
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.lookupAll("रायपुर")).isEmpty();
    }
}
