package com.rally.leaguesync.util;

import java.util.Locale;

public class NameNormalizer {
    public static String normalize(String name) {
        if (name == null) return null;
        return collapse(name).toLowerCase(Locale.ROOT);
    }

    public static String collapse(String name) {
        if (name == null) return null;
        return name.trim().replaceAll("\\s+", " ");
    }
}
