package io.kvstore.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class StoreMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter committed = registry.counter("kv.transactions.committed");
    private static final Counter aborted = registry.counter("kv.transactions.aborted");
    private static final Counter conflicts = Counter.builder("kv.transactions.conflicts")
            .description("Transaction attempts re-run after a write conflict")
            .register(registry);
    private static final Timer transactionTime = registry.timer("kv.transaction.time");
    private static final Counter batches = registry.counter("kv.batches.applied");
    private static final DistributionSummary batchSize = DistributionSummary.builder("kv.batch.size")
            .baseUnit("operations")
            .description("Operations per applied batch")
            .register(registry);

    private StoreMetrics() {}

    public static <T> T recordTransaction(Supplier<T> transactionLogic) {
        return transactionTime.record(transactionLogic);
    }

    public static void incrementCommitted() {
        committed.increment();
    }

    public static void incrementAborted() {
        aborted.increment();
    }

    public static void incrementConflicts() {
        conflicts.increment();
    }

    public static void recordBatch(int operations) {
        batches.increment();
        batchSize.record(operations);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
