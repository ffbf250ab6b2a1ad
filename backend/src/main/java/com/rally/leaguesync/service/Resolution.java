package com.rally.leaguesync.service;

/** Outcome of a team lookup. Not finding a team is a normal result, never an exception. */
public record Resolution(Long id, MatchStrategy strategy) {

    private static final Resolution UNRESOLVED = new Resolution(null, MatchStrategy.UNRESOLVED);

    public static Resolution unresolved() { return UNRESOLVED; }

    public boolean resolved() { return id != null; }
}
