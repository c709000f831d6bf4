package com.postintel.parser.location;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WardZoneExtractorTest {

    @Test
    void hindiWardWithKramank() {
        assertThat(WardZoneExtractor.extract("वार्ड क्रमांक 12 में सफाई").ward()).isEqualTo("12");
    }

    @Test
    void englishWardAndZone() {
        WardZoneExtractor.WardZone wz = WardZoneExtractor.extract("ward no. 05 of zone 3");
        assertThat(wz.ward()).isEqualTo("5");
        assertThat(wz.zone()).isEqualTo("3");
    }

    @Test
    void nothingToExtract() {
        assertThat(WardZoneExtractor.extract("नगर निगम की बैठक").isEmpty()).isTrue();
        assertThat(WardZoneExtractor.extract(null).isEmpty()).isTrue();
    }
}
