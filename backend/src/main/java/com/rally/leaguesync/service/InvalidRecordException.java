package com.rally.leaguesync.service;

/** A single source record that cannot be used; the record is skipped, the run goes on. */
public class InvalidRecordException extends RuntimeException {
    public InvalidRecordException(String message) {
        super(message);
    }
}
