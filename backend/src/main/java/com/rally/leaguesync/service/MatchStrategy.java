package com.rally.leaguesync.service;

/** How a source team name was matched, in the order the strategies are tried. */
public enum MatchStrategy {
    EXACT,
    SUFFIX_NORMALIZED,
    TRAILING_NUMBER,
    PREFIX,
    ALIAS,
    UNRESOLVED
}
