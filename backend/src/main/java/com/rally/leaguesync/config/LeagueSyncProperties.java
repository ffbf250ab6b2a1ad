package com.rally.leaguesync.config;

import com.rally.leaguesync.score.LeagueScoringRules;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed configuration of the import engine, bound from {@code leaguesync.*}.
 *
 * League rules are keyed by league key. Keys must use bracket notation in property files
 * ({@code leaguesync.leagues[APTA_CHICAGO].series-pattern=...}) so the underscore survives binding;
 * {@link #rulesFor(String)} still matches loosely.
 */
@Validated
@ConfigurationProperties(prefix = "leaguesync")
public class LeagueSyncProperties {

    private String dataDir = "data/leagues";

    @Min(100)
    @Max(1000)
    private int batchSize = 500;

    @Min(0)
    private int errorCeiling = 500;

    @Min(1)
    private int sampleLimit = 20;

    @DecimalMin("0.5")
    @DecimalMax("1.0")
    private double assignmentThreshold = 0.8;

    @Min(1)
    private int maxParallelLeagues = 4;

    private String orphanMappingLocation = "classpath:orphan-mapping.csv";

    private Map<String, LeagueRule> leagues = new LinkedHashMap<>();

    public LeagueRule rulesFor(String leagueKey) {
        if (leagueKey == null) return new LeagueRule();
        String wanted = looseKey(leagueKey);
        for (Map.Entry<String, LeagueRule> e : leagues.entrySet()) {
            if (looseKey(e.getKey()).equals(wanted)) return e.getValue();
        }
        return new LeagueRule();
    }

    private static String looseKey(String key) {
        return key.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
    }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public int getErrorCeiling() { return errorCeiling; }
    public void setErrorCeiling(int errorCeiling) { this.errorCeiling = errorCeiling; }
    public int getSampleLimit() { return sampleLimit; }
    public void setSampleLimit(int sampleLimit) { this.sampleLimit = sampleLimit; }
    public double getAssignmentThreshold() { return assignmentThreshold; }
    public void setAssignmentThreshold(double assignmentThreshold) { this.assignmentThreshold = assignmentThreshold; }
    public int getMaxParallelLeagues() { return maxParallelLeagues; }
    public void setMaxParallelLeagues(int maxParallelLeagues) { this.maxParallelLeagues = maxParallelLeagues; }
    public String getOrphanMappingLocation() { return orphanMappingLocation; }
    public void setOrphanMappingLocation(String orphanMappingLocation) { this.orphanMappingLocation = orphanMappingLocation; }
    public Map<String, LeagueRule> getLeagues() { return leagues; }
    public void setLeagues(Map<String, LeagueRule> leagues) { this.leagues = leagues; }

    /** Per-league naming and scoring conventions. */
    public static class LeagueRule {
        private boolean superTiebreakAlways;
        private boolean lowDataQuality;
        private int incompleteMaxGames = 6;
        private int incompleteMaxDifferential = 2;
        private String seriesPattern;
        private String seriesReplacement = "";
        private List<AliasRule> aliases = new ArrayList<>();

        public LeagueScoringRules scoringRules() {
            return new LeagueScoringRules(superTiebreakAlways, lowDataQuality, incompleteMaxGames, incompleteMaxDifferential);
        }

        /** Canonical series name: collapsed whitespace, then the league's prefix rewrite if one is configured. */
        public String canonicalSeriesName(String name) {
            if (name == null) return null;
            String collapsed = name.trim().replaceAll("\\s+", " ");
            if (seriesPattern == null || seriesPattern.isBlank()) return collapsed;
            String replacement = seriesReplacement == null ? "" : seriesReplacement;
            String rewritten = Pattern.compile(seriesPattern, Pattern.CASE_INSENSITIVE)
                    .matcher(collapsed)
                    .replaceFirst(replacement)
                    .trim();
            return rewritten.isEmpty() ? collapsed : rewritten;
        }

        public boolean isSuperTiebreakAlways() { return superTiebreakAlways; }
        public void setSuperTiebreakAlways(boolean superTiebreakAlways) { this.superTiebreakAlways = superTiebreakAlways; }
        public boolean isLowDataQuality() { return lowDataQuality; }
        public void setLowDataQuality(boolean lowDataQuality) { this.lowDataQuality = lowDataQuality; }
        public int getIncompleteMaxGames() { return incompleteMaxGames; }
        public void setIncompleteMaxGames(int incompleteMaxGames) { this.incompleteMaxGames = incompleteMaxGames; }
        public int getIncompleteMaxDifferential() { return incompleteMaxDifferential; }
        public void setIncompleteMaxDifferential(int incompleteMaxDifferential) { this.incompleteMaxDifferential = incompleteMaxDifferential; }
        public String getSeriesPattern() { return seriesPattern; }
        public void setSeriesPattern(String seriesPattern) { this.seriesPattern = seriesPattern; }
        public String getSeriesReplacement() { return seriesReplacement; }
        public void setSeriesReplacement(String seriesReplacement) { this.seriesReplacement = seriesReplacement; }
        public List<AliasRule> getAliases() { return aliases; }
        public void setAliases(List<AliasRule> aliases) { this.aliases = aliases; }
    }

    /** Regex rewrite applied to an unresolved source team name. */
    public static class AliasRule {
        private String pattern;
        private String replacement = "";
        // set only by setPattern
        private volatile Pattern compiled;

        public AliasRule() {}

        public AliasRule(String pattern, String replacement) {
            setPattern(pattern);
            this.replacement = replacement;
        }

        /** Returns the rewritten name, or null when the rule does not apply. */
        public String apply(String name) {
            Pattern p = compiled;
            if (name == null || p == null) return null;
            java.util.regex.Matcher m = p.matcher(name);
            if (!m.find()) return null;
            return m.replaceFirst(replacement == null ? "" : replacement).trim();
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) {
            this.compiled = pattern == null ? null : Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
            this.pattern = pattern;
        }
        public String getReplacement() { return replacement; }
        public void setReplacement(String replacement) { this.replacement = replacement; }
    }
}
