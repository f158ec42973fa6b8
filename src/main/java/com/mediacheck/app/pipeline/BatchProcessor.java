package com.mediacheck.app.pipeline;

import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediacheck.app.detection.DeepDetector;
import com.mediacheck.app.detection.DetectorInterruptedException;
import com.mediacheck.app.detection.MetadataAnalyzer;
import com.mediacheck.app.detection.NamePatternMatcher;

/**
 * Processa um lote item a item, na ordem de submissão e nunca em paralelo:
 * o detector externo tem limite de taxa não documentado. Entre itens há uma
 * espera aleatória maior; antes de cada chamada ao detector, outra menor
 * (ver {@link ThrottledDetector}).
 *
 * <p>Falha de um item não aborta o lote. Só erros de validação, antes de
 * qualquer item rodar, lançam {@link IllegalArgumentException}.
 */
public final class BatchProcessor {

    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private final Pipeline pipeline;
    private final ItemClassifier classifier;
    private final Pacer pacer;
    private final long maxItemBytes;
    private final Consumer<MediaItem> cleanup;
    private final BatchMetrics metrics = new BatchMetrics();

    public BatchProcessor(
            Pipeline pipeline,
            NamePatternMatcher names,
            MetadataAnalyzer metadata,
            DeepDetector detector,
            Pacer pacer,
            long maxItemBytes,
            Consumer<MediaItem> cleanup
    ) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.maxItemBytes = maxItemBytes;
        this.cleanup = cleanup == null ? item -> {} : cleanup;
        this.classifier = new ItemClassifier(pipeline, names, metadata, new ThrottledDetector(detector, pacer, metrics));
    }

    public BatchMetrics metrics() {
        return metrics;
    }

    public BatchReport process(String claimId, List<MediaItem> items, String notes) {
        return process(claimId, items, notes, msg -> {});
    }

    public BatchReport process(String claimId, List<MediaItem> items, String notes, Consumer<String> progress) {
        validate(items);

        metrics.start = Instant.now();
        metrics.running.set(true);
        long shortcutsBefore = metrics.genuineShortcuts.sum();

        List<ItemVerdict> results = new ArrayList<>(items.size());
        try {
            for (int i = 0; i < items.size(); i++) {
                MediaItem item = items.get(i);
                logger.info("=== Processando arquivo {}/{}: {} ===", i + 1, items.size(), item.name());
                progress.accept(">> [" + (i + 1) + "/" + items.size() + "] " + item.name());

                ItemVerdict verdict = classifySafely(item);
                results.add(verdict);
                metrics.record(verdict);
                if (isShortcut(verdict)) metrics.genuineShortcuts.increment();

                progress.accept("   " + verdict.authenticity().label()
                        + (verdict.failedAtLayer() == null ? "" : " (camada " + verdict.failedAtLayer() + ")"));

                runCleanup(item);

                if (i < items.size() - 1) {
                    pacer.betweenItems();
                }
            }
        } finally {
            metrics.running.set(false);
        }

        BatchReport report = BatchReport.aggregate(claimId, pipeline, items, results, notes);
        logger.info("Lote {} ({}) finalizado: {} arquivos, {} IA, {} genuínos, risco={}, atalhos={}",
                claimId, pipeline.label(), report.fileCount(), report.aiDetectedCount(),
                report.genuineCount(), report.riskScore().label(),
                metrics.genuineShortcuts.sum() - shortcutsBefore);
        return report;
    }

    private void validate(List<MediaItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("No files uploaded");
        }
        if (items.size() > pipeline.maxFiles()) {
            throw new IllegalArgumentException(
                    "Too many files: " + items.size() + " (max " + pipeline.maxFiles() + " per " + pipeline.label() + " batch)");
        }
        for (MediaItem item : items) {
            if (item == null) {
                throw new IllegalArgumentException("Null item in batch");
            }
            if (item.size() > maxItemBytes) {
                throw new IllegalArgumentException(
                        "File too large: " + item.name() + " (" + item.size() + " bytes, max " + maxItemBytes + ")");
            }
            if (!Files.isReadable(item.path())) {
                throw new IllegalArgumentException("File not readable: " + item.name());
            }
        }
    }

    private ItemVerdict classifySafely(MediaItem item) {
        try {
            return classifier.classify(item);
        } catch (Pacer.PacingInterruptedException | DetectorInterruptedException e) {
            runCleanup(item);
            throw e;
        } catch (RuntimeException e) {
            // fail-open também aqui: erro interno não pode virar "AI Generated"
            metrics.unexpectedErrors.increment();
            logger.error("Erro inesperado ao classificar {}", item.name(), e);
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new ItemVerdict(item.name(), item.size(), item.kind(), Authenticity.LIKELY_GENUINE, null,
                    List.of(), VerdictDetails.unexpectedFailure(msg));
        }
    }

    private void runCleanup(MediaItem item) {
        try {
            cleanup.accept(item);
        } catch (RuntimeException e) {
            logger.warn("Falha no cleanup de {}", item.name(), e);
        }
    }

    private static boolean isShortcut(ItemVerdict v) {
        return !v.aiGenerated()
                && v.layers().size() == 2
                && v.layers().get(1).physicalCapture();
    }
}
