package com.mediacheck.app.pipeline;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Semaphore;

import com.mediacheck.app.detection.DeepDetector;
import com.mediacheck.app.detection.DetectorResult;

/**
 * Envolve o detector externo com um semáforo de uma vaga e a espera
 * aleatória pré-chamada. Pertence ao {@link BatchProcessor}: nunca há duas
 * chamadas simultâneas partindo do mesmo processador.
 */
final class ThrottledDetector implements DeepDetector {

    private final DeepDetector delegate;
    private final Pacer pacer;
    private final BatchMetrics metrics;
    private final Semaphore slot = new Semaphore(1, true);

    ThrottledDetector(DeepDetector delegate, Pacer pacer, BatchMetrics metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public DetectorResult detect(Path file, String originalName) {
        try {
            slot.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Pacer.PacingInterruptedException(e);
        }
        try {
            pacer.beforeDetector();
            metrics.detectorCalls.increment();
            DetectorResult result = delegate.detect(file, originalName);
            if (!result.isOk()) metrics.detectorFailures.increment();
            return result;
        } finally {
            slot.release();
        }
    }
}
