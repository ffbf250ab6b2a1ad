package com.rally.leaguesync.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces a scraped club or team label to the club's canonical name.
 *
 * "Glen Ellyn - 7 SW" becomes "Glen Ellyn", "Birchwood 12" becomes "Birchwood",
 * "skokie cc" becomes "Skokie CC".
 */
public final class ClubNameNormalizer {

    private static final Set<String> CLUB_TYPE_SUFFIXES = Set.of("CC", "GC", "RC", "PC", "TC", "AC");
    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)\\s*$");
    private static final Pattern ROMAN = Pattern.compile("(?i)^[ivx]+$");
    private static final Pattern NUMBERED = Pattern.compile("(?i)^\\d+[a-z]?$");
    private static final Pattern SERIES_CODE = Pattern.compile("(?i)^[a-z]\\d+[a-z]?$");
    private static final Pattern LETTER_COUNT = Pattern.compile("(?i)^[a-z]\\(\\d+\\)$");
    private static final Pattern SHORT_CAPS = Pattern.compile("^[A-Z]{1,2}$");

    private ClubNameNormalizer() {}

    public static String normalize(String raw) {
        String name = NameNormalizer.collapse(raw);
        if (name == null || name.isEmpty()) return "";
        int dash = name.indexOf(" - ");
        if (dash > 0) name = name.substring(0, dash);
        name = TRAILING_PARENTHETICAL.matcher(name).replaceFirst("");

        List<String> tokens = new ArrayList<>(Arrays.asList(name.split(" ")));
        while (tokens.size() > 1 && isSeriesToken(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }

        List<String> words = new ArrayList<>();
        for (String token : tokens) {
            String cleaned = token.replaceAll("[^\\p{L}\\p{N}&]", "");
            if (cleaned.isEmpty()) continue;
            words.add(titleCase(cleaned));
        }
        return String.join(" ", words);
    }

    private static boolean isSeriesToken(String token) {
        if (CLUB_TYPE_SUFFIXES.contains(token.toUpperCase(Locale.ROOT))) return false;
        return ROMAN.matcher(token).matches()
                || NUMBERED.matcher(token).matches()
                || SERIES_CODE.matcher(token).matches()
                || LETTER_COUNT.matcher(token).matches()
                || SHORT_CAPS.matcher(token).matches();
    }

    private static String titleCase(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        if (CLUB_TYPE_SUFFIXES.contains(upper)) return upper;
        return upper.charAt(0) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
