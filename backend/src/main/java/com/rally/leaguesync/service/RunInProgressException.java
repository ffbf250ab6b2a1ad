package com.rally.leaguesync.service;

public class RunInProgressException extends RuntimeException {
    public RunInProgressException(String leagueKey) {
        super("An import run is already in progress for league " + leagueKey);
    }
}
