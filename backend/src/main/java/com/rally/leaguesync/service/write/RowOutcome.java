package com.rally.leaguesync.service.write;

public enum RowOutcome { INSERTED, UPDATED, SKIPPED }
