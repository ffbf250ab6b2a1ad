package com.rally.leaguesync.service;

/** Duplicate series whose survivor cannot be chosen by name or size. */
public class ConsolidationException extends RuntimeException {
    public ConsolidationException(String message) {
        super(message);
    }
}
