package com.mediacheck.app.pipeline;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

public final class BatchMetrics {
    public final LongAdder itemsProcessed = new LongAdder();
    public final LongAdder aiDetected = new LongAdder();
    public final LongAdder genuine = new LongAdder();
    public final LongAdder failedAtLayer1 = new LongAdder();
    public final LongAdder failedAtLayer2 = new LongAdder();
    public final LongAdder failedAtLayer3 = new LongAdder();
    public final LongAdder genuineShortcuts = new LongAdder();
    public final LongAdder detectorCalls = new LongAdder();
    // recuperações fail-open (processo caiu, timeout, JSON inválido, success=false)
    public final LongAdder detectorFailures = new LongAdder();
    public final LongAdder unexpectedErrors = new LongAdder();
    public final AtomicBoolean running = new AtomicBoolean(false);

    // não pode ser "final Instant" porque o mesmo objeto acompanha vários lotes
    public volatile Instant start = Instant.EPOCH;

    void record(ItemVerdict verdict) {
        itemsProcessed.increment();
        if (verdict.aiGenerated()) {
            aiDetected.increment();
            switch (verdict.failedAtLayer()) {
                case 1 -> failedAtLayer1.increment();
                case 2 -> failedAtLayer2.increment();
                default -> failedAtLayer3.increment();
            }
        } else {
            genuine.increment();
        }
    }
}
