package com.rally.leaguesync.dto;

/** A resolved record ready to be written, remembering where it came from. */
public interface SourceRow {
    int rowNumber();
    String payload();
}
