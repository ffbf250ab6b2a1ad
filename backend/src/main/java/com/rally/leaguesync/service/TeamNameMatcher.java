package com.rally.leaguesync.service;

import com.rally.leaguesync.config.LeagueSyncProperties.AliasRule;
import com.rally.leaguesync.util.NameNormalizer;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches a scraped team name against a league's {@link TeamIndex}.
 *
 * Strategies are tried in a fixed order: exact, " - Series X" suffix stripped, trailing number
 * stripped, prefix, and finally the league's alias rewrites (each rewrite re-run through the
 * first four).
 */
public final class TeamNameMatcher {

    private static final Pattern SERIES_SUFFIX = Pattern.compile("\\s+-\\s+series\\s+\\S+$");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("\\s+\\d+$");

    private TeamNameMatcher() {}

    public static Resolution resolve(TeamIndex index, String sourceName, List<AliasRule> aliases) {
        String name = NameNormalizer.normalize(sourceName);
        if (name == null || name.isEmpty()) return Resolution.unresolved();

        Resolution direct = resolveDirect(index, name);
        if (direct.resolved()) return direct;

        if (aliases != null) {
            for (AliasRule rule : aliases) {
                String rewritten = NameNormalizer.normalize(rule.apply(NameNormalizer.collapse(sourceName)));
                if (rewritten == null || rewritten.isEmpty() || rewritten.equals(name)) continue;
                Resolution viaAlias = resolveDirect(index, rewritten);
                if (viaAlias.resolved()) return new Resolution(viaAlias.id(), MatchStrategy.ALIAS);
            }
        }
        return Resolution.unresolved();
    }

    private static Resolution resolveDirect(TeamIndex index, String name) {
        Optional<Long> exact = index.exact(name);
        if (exact.isPresent()) return new Resolution(exact.get(), MatchStrategy.EXACT);

        String base = SERIES_SUFFIX.matcher(name).replaceFirst("");
        if (!base.equals(name)) {
            Optional<Long> suffix = index.exact(base);
            if (suffix.isPresent()) return new Resolution(suffix.get(), MatchStrategy.SUFFIX_NORMALIZED);
        }

        String withoutNumber = TRAILING_NUMBER.matcher(base).replaceFirst("");
        if (!withoutNumber.equals(base) && !withoutNumber.isEmpty()) {
            Optional<Long> numbered = index.exact(withoutNumber);
            if (numbered.isPresent()) return new Resolution(numbered.get(), MatchStrategy.TRAILING_NUMBER);
        }

        return index.prefix(base)
                .map(id -> new Resolution(id, MatchStrategy.PREFIX))
                .orElse(Resolution.unresolved());
    }
}
