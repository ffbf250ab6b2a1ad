package com.rally.leaguesync.dto;

/** Sampled record-level problem kept for the run report and {@code import_error}. */
public record RowProblem(String table, int rowNumber, String payload, String reason) {
}
