package com.rally.leaguesync.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClubNameNormalizerTest {

    @Test
    void keepsOnlyFirstDashSegment() {
        assertThat(ClubNameNormalizer.normalize("Glen Ellyn - 7 SW")).isEqualTo("Glen Ellyn");
    }

    @Test
    void stripsSeriesAndTeamTokens() {
        assertThat(ClubNameNormalizer.normalize("Birchwood 12")).isEqualTo("Birchwood");
        assertThat(ClubNameNormalizer.normalize("Hinsdale 3b")).isEqualTo("Hinsdale");
        assertThat(ClubNameNormalizer.normalize("Lake Forest II")).isEqualTo("Lake Forest");
        assertThat(ClubNameNormalizer.normalize("Glencoe S2")).isEqualTo("Glencoe");
        assertThat(ClubNameNormalizer.normalize("Winnetka A")).isEqualTo("Winnetka");
    }

    @Test
    void keepsClubTypeSuffixesUpperCased() {
        assertThat(ClubNameNormalizer.normalize("skokie cc")).isEqualTo("Skokie CC");
        assertThat(ClubNameNormalizer.normalize("Hinsdale PC 1")).isEqualTo("Hinsdale PC");
    }

    @Test
    void dropsTrailingParentheticalAndPunctuation() {
        assertThat(ClubNameNormalizer.normalize("Saddle & Cycle (Chicago)")).isEqualTo("Saddle & Cycle");
        assertThat(ClubNameNormalizer.normalize("St. Charles  CC")).isEqualTo("St Charles CC");
    }

    @Test
    void blankInputNormalizesToEmpty() {
        assertThat(ClubNameNormalizer.normalize("   ")).isEmpty();
        assertThat(ClubNameNormalizer.normalize(null)).isEmpty();
    }
}
