package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.SourceRow;
import com.rally.leaguesync.model.SyncTable;

/**
 * Upserts one resolved row by its natural key. Runs inside the batch transaction opened by
 * {@link UpsertBatchWriter}; any exception thrown counts the row as errored.
 */
public interface RowWriter<T extends SourceRow> {

    SyncTable table();

    RowOutcome write(T row);
}
