package com.rally.leaguesync.service.write;

import com.rally.leaguesync.config.LeagueSyncProperties;
import com.rally.leaguesync.dto.SourceRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Writes resolved rows in fixed-size batches, one transaction per batch.
 *
 * A failed batch is rolled back and replayed row by row, each row in its own transaction, so
 * the rows that really fail are counted. The ceiling applies to the whole run: errors already
 * counted on earlier tables are passed in, and once they plus this table's errors pass the
 * ceiling the writer stops and reports {@link WriteStats#isHalted()}. Cancellation is only
 * checked between batches.
 */
@Component
public class UpsertBatchWriter {
    private static final Logger log = LoggerFactory.getLogger(UpsertBatchWriter.class);

    private final TransactionTemplate transactionTemplate;
    private final int batchSize;
    private final int errorCeiling;
    private final int sampleLimit;

    @Autowired
    public UpsertBatchWriter(PlatformTransactionManager transactionManager, LeagueSyncProperties properties) {
        this(transactionManager, properties.getBatchSize(), properties.getErrorCeiling(), properties.getSampleLimit());
    }

    public UpsertBatchWriter(PlatformTransactionManager transactionManager, int batchSize, int errorCeiling, int sampleLimit) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.batchSize = batchSize;
        this.errorCeiling = errorCeiling;
        this.sampleLimit = sampleLimit;
    }

    public <T extends SourceRow> WriteStats write(List<T> rows, RowWriter<T> writer, BooleanSupplier cancelRequested) {
        return write(rows, writer, cancelRequested, 0);
    }

    /**
     * @param priorErrors rows already errored earlier in the same run
     */
    public <T extends SourceRow> WriteStats write(List<T> rows, RowWriter<T> writer, BooleanSupplier cancelRequested,
                                                  int priorErrors) {
        WriteStats stats = new WriteStats(writer.table(), sampleLimit);
        stats.setTotal(rows.size());
        String table = writer.table().tableName();

        for (int start = 0; start < rows.size(); start += batchSize) {
            if (cancelRequested.getAsBoolean()) {
                log.warn("[IMPORT][WRITE] {} cancelled after {} of {} rows", table, start, rows.size());
                stats.markCancelled();
                break;
            }
            List<T> batch = rows.subList(start, Math.min(start + batchSize, rows.size()));
            try {
                List<RowOutcome> outcomes = transactionTemplate.execute(status -> {
                    List<RowOutcome> done = new ArrayList<>(batch.size());
                    for (T row : batch) done.add(writer.write(row));
                    return done;
                });
                if (outcomes != null) outcomes.forEach(stats::count);
            } catch (RuntimeException batchEx) {
                log.warn("[IMPORT][WRITE] {} batch at row {} rolled back ({}); retrying rows individually",
                        table, start, batchEx.getMessage());
                if (!replayRowByRow(batch, writer, stats, priorErrors)) {
                    stats.markHalted();
                    log.error("[IMPORT][WRITE] {} halted: {} errored rows in run ({} here) exceed ceiling {}",
                            table, priorErrors + stats.getErrored(), stats.getErrored(), errorCeiling);
                    break;
                }
            }
        }
        log.info("[IMPORT][WRITE] {} total={} inserted={} updated={} skipped={} errored={}",
                table, stats.getTotal(), stats.getInserted(), stats.getUpdated(), stats.getSkipped(), stats.getErrored());
        return stats;
    }

    // false once the run's error ceiling is exceeded
    private <T extends SourceRow> boolean replayRowByRow(List<T> batch, RowWriter<T> writer, WriteStats stats,
                                                         int priorErrors) {
        for (T row : batch) {
            try {
                RowOutcome outcome = transactionTemplate.execute(status -> writer.write(row));
                if (outcome != null) stats.count(outcome);
            } catch (RuntimeException rowEx) {
                stats.error(row.rowNumber(), row.payload(), rootMessage(rowEx));
                if (priorErrors + stats.getErrored() > errorCeiling) return false;
            }
        }
        return true;
    }

    private static String rootMessage(Throwable t) {
        Throwable cur = t;
        while (cur.getCause() != null && cur.getCause() != cur) cur = cur.getCause();
        String msg = cur.getMessage();
        return msg != null ? msg : cur.getClass().getSimpleName();
    }
}
