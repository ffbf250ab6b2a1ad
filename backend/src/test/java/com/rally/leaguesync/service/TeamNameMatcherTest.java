package com.rally.leaguesync.service;

import com.rally.leaguesync.config.LeagueSyncProperties.AliasRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TeamNameMatcherTest {

    private TeamIndex index;

    @BeforeEach
    void setUp() {
        index = new TeamIndex();
        index.add(1L, "Hinsdale PC 1");
        index.add(2L, "Winnetka");
        index.add(3L, "Lake Forest - 2");
        index.add(4L, "Lake Forest - 22");
        index.add(5L, "Glencoe 7");
        index.add(6L, "Evanston (North)");
    }

    @Test
    void exactMatchIgnoresCaseAndSpacing() {
        Resolution r = TeamNameMatcher.resolve(index, "  hinsdale   PC 1 ", List.of());
        assertThat(r.id()).isEqualTo(1L);
        assertThat(r.strategy()).isEqualTo(MatchStrategy.EXACT);
    }

    @Test
    void seriesSuffixIsStrippedBeforeOtherFallbacks() {
        Resolution r = TeamNameMatcher.resolve(index, "Hinsdale PC 1 - Series 1", List.of());
        assertThat(r.id()).isEqualTo(1L);
        assertThat(r.strategy()).isEqualTo(MatchStrategy.SUFFIX_NORMALIZED);
    }

    @Test
    void trailingNumberIsStripped() {
        Resolution r = TeamNameMatcher.resolve(index, "Winnetka 3", List.of());
        assertThat(r.id()).isEqualTo(2L);
        assertThat(r.strategy()).isEqualTo(MatchStrategy.TRAILING_NUMBER);
    }

    @Test
    void prefixPrefersShortestName() {
        Resolution r = TeamNameMatcher.resolve(index, "Lake Forest", List.of());
        assertThat(r.id()).isEqualTo(3L);
        assertThat(r.strategy()).isEqualTo(MatchStrategy.PREFIX);

        Resolution paren = TeamNameMatcher.resolve(index, "Evanston", List.of());
        assertThat(paren.id()).isEqualTo(6L);
    }

    @Test
    void prefixNeedsASeparator() {
        assertThat(TeamNameMatcher.resolve(index, "Glen", List.of()).resolved()).isFalse();
    }

    @Test
    void aliasRewriteIsTriedLast() {
        List<AliasRule> aliases = List.of(new AliasRule("^(.+?)\\s+-\\s+(\\d+)$", "$1 $2"));
        Resolution r = TeamNameMatcher.resolve(index, "Glencoe - 7", aliases);
        assertThat(r.id()).isEqualTo(5L);
        assertThat(r.strategy()).isEqualTo(MatchStrategy.ALIAS);
    }

    @Test
    void unknownNameIsAnExplicitUnresolvedResult() {
        Resolution r = TeamNameMatcher.resolve(index, "Nowhere Club", List.of());
        assertThat(r.resolved()).isFalse();
        assertThat(r.id()).isNull();
        assertThat(r.strategy()).isEqualTo(MatchStrategy.UNRESOLVED);
    }
}
