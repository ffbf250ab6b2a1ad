package com.rally.leaguesync.service.write;

import com.rally.leaguesync.dto.SourceRow;
import com.rally.leaguesync.model.SyncTable;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

class UpsertBatchWriterTest {

    record Row(int rowNumber, String payload) implements SourceRow {}

    static class CountingTxManager implements PlatformTransactionManager {
        int commits;
        int rollbacks;

        @Override
        public TransactionStatus getTransaction(TransactionDefinition definition) { return new SimpleTransactionStatus(); }

        @Override
        public void commit(TransactionStatus status) { commits++; }

        @Override
        public void rollback(TransactionStatus status) { rollbacks++; }
    }

    static class StubWriter implements RowWriter<Row> {
        final AtomicInteger calls = new AtomicInteger();
        final Predicate<Row> fails;

        StubWriter(Predicate<Row> fails) { this.fails = fails; }

        @Override
        public SyncTable table() { return SyncTable.SCHEDULE; }

        @Override
        public RowOutcome write(Row row) {
            calls.incrementAndGet();
            if (fails.test(row)) throw new IllegalStateException("bad row " + row.rowNumber());
            return row.rowNumber() % 2 == 0 ? RowOutcome.UPDATED : RowOutcome.INSERTED;
        }
    }

    private static List<Row> rows(int n) {
        List<Row> rows = new ArrayList<>();
        for (int i = 1; i <= n; i++) rows.add(new Row(i, "{row=" + i + "}"));
        return rows;
    }

    @Test
    void writesAllRowsInBatchesOfConfiguredSize() {
        CountingTxManager tx = new CountingTxManager();
        UpsertBatchWriter writer = new UpsertBatchWriter(tx, 100, 500, 20);

        WriteStats stats = writer.write(rows(250), new StubWriter(r -> false), () -> false);

        assertThat(stats.getTotal()).isEqualTo(250);
        assertThat(stats.getInserted()).isEqualTo(125);
        assertThat(stats.getUpdated()).isEqualTo(125);
        assertThat(stats.getErrored()).isZero();
        assertThat(tx.commits).isEqualTo(3);
    }

    @Test
    void failedBatchIsReplayedRowByRowSoOnlyBadRowsError() {
        CountingTxManager tx = new CountingTxManager();
        UpsertBatchWriter writer = new UpsertBatchWriter(tx, 100, 500, 20);

        WriteStats stats = writer.write(rows(200), new StubWriter(r -> r.rowNumber() == 150), () -> false);

        assertThat(stats.getErrored()).isEqualTo(1);
        assertThat(stats.getInserted() + stats.getUpdated()).isEqualTo(199);
        assertThat(stats.getErrorSamples()).singleElement()
                .satisfies(p -> {
                    assertThat(p.rowNumber()).isEqualTo(150);
                    assertThat(p.table()).isEqualTo("schedule");
                    assertThat(p.reason()).contains("bad row 150");
                });
        assertThat(stats.isHalted()).isFalse();
    }

    @Test
    void haltsOnceErrorsExceedTheCeiling() {
        CountingTxManager tx = new CountingTxManager();
        UpsertBatchWriter writer = new UpsertBatchWriter(tx, 100, 500, 20);
        StubWriter stub = new StubWriter(r -> true);

        WriteStats stats = writer.write(rows(1000), stub, () -> false);

        assertThat(stats.isHalted()).isTrue();
        assertThat(stats.getErrored()).isEqualTo(501);
        assertThat(stats.getErrorSamples()).hasSize(20);
        // five full batches replayed, then the sixth stops at its first replayed row
        assertThat(stub.calls.get()).isEqualTo(5 * 101 + 2);
    }

    @Test
    void errorsFromEarlierTablesCountTowardsTheCeiling() {
        CountingTxManager tx = new CountingTxManager();
        UpsertBatchWriter writer = new UpsertBatchWriter(tx, 100, 500, 20);
        StubWriter stub = new StubWriter(r -> true);

        WriteStats stats = writer.write(rows(300), stub, () -> false, 450);

        assertThat(stats.isHalted()).isTrue();
        assertThat(stats.getErrored()).isEqualTo(51);
        assertThat(stub.calls.get()).isEqualTo(1 + 51);
    }

    @Test
    void errorsBelowTheRemainingBudgetDoNotHalt() {
        CountingTxManager tx = new CountingTxManager();
        UpsertBatchWriter writer = new UpsertBatchWriter(tx, 100, 500, 20);

        WriteStats stats = writer.write(rows(200), new StubWriter(r -> r.rowNumber() <= 100), () -> false, 400);

        assertThat(stats.isHalted()).isFalse();
        assertThat(stats.getErrored()).isEqualTo(100);
        assertThat(stats.getInserted() + stats.getUpdated()).isEqualTo(100);
    }

    @Test
    void cancellationStopsBetweenBatches() {
        CountingTxManager tx = new CountingTxManager();
        UpsertBatchWriter writer = new UpsertBatchWriter(tx, 100, 500, 20);
        StubWriter stub = new StubWriter(r -> false);
        AtomicInteger checks = new AtomicInteger();

        WriteStats stats = writer.write(rows(500), stub, () -> checks.incrementAndGet() > 2);

        assertThat(stats.isCancelled()).isTrue();
        assertThat(stub.calls.get()).isEqualTo(200);
        assertThat(stats.getInserted() + stats.getUpdated()).isEqualTo(200);
    }
}
