package com.rally.leaguesync.service;

/** Structural problem with a league's input (missing file, malformed document, unknown league). */
public class LeagueDataException extends RuntimeException {
    public LeagueDataException(String message) {
        super(message);
    }

    public LeagueDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
