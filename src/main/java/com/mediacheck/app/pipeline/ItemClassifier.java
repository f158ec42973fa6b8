package com.mediacheck.app.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediacheck.app.detection.DeepDetector;
import com.mediacheck.app.detection.DetectorResult;
import com.mediacheck.app.detection.LayerOutcome;
import com.mediacheck.app.detection.MetadataAnalyzer;
import com.mediacheck.app.detection.NamePatternMatcher;

/**
 * Classifica um item executando as camadas em ordem estrita com saída antecipada:
 * a camada k só roda se 1..k-1 passaram, e a primeira falha encerra o item.
 *
 * <pre>
 * Init -> L1 -> { Fail(1) | L2 }
 *       L2 -> { Fail(2) | GenuineShortcut (só vídeo) | L3 }
 *       L3 -> { Fail(3) | Pass }
 * </pre>
 */
public final class ItemClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ItemClassifier.class);

    private final Pipeline pipeline;
    private final NamePatternMatcher names;
    private final MetadataAnalyzer metadata;
    private final DeepDetector detector;

    public ItemClassifier(Pipeline pipeline, NamePatternMatcher names, MetadataAnalyzer metadata, DeepDetector detector) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.names = Objects.requireNonNull(names, "names");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    public ItemVerdict classify(MediaItem item) {
        List<LayerOutcome> layers = new ArrayList<>(3);

        LayerOutcome l1 = names.match(item.name());
        layers.add(l1);
        if (l1.failed()) {
            logger.info("[L1] {} reprovado: {}", item.name(), l1.generator());
            return aiGenerated(item, 1, layers);
        }

        LayerOutcome l2 = metadata.analyze(item.path(), item.name());
        layers.add(l2);
        if (l2.failed()) {
            logger.info("[L2] {} reprovado: {}", item.name(), l2.reason());
            return aiGenerated(item, 2, layers);
        }
        if (l2.hasError()) {
            logger.warn("[L2] Leitura de metadados degradada para {}: {}", item.name(), l2.error());
        }

        if (pipeline.genuineShortcut() && l2.physicalCapture()) {
            logger.info("[L2] {} corroborado como captura de câmera ({}); camada 3 dispensada", item.name(), l2.deviceInfo());
            return genuine(item, layers);
        }

        LayerOutcome l3 = failOpen(detector.detect(item.path(), item.name()), item);
        layers.add(l3);
        if (l3.failed()) {
            logger.info("[L3] {} reprovado: {}", item.name(), l3.reason());
            return aiGenerated(item, 3, layers);
        }
        return genuine(item, layers);
    }

    /**
     * Regra única de recuperação: falha de transporte do detector nunca vira
     * "AI Generated". A camada conta como aprovada e guarda o diagnóstico.
     */
    static LayerOutcome failOpen(DetectorResult result, MediaItem item) {
        if (result.isOk()) return result.outcome();
        logger.warn("[L3] Detector indisponível para {} ({}): {}; seguindo como aprovado",
                item.name(), result.error().kind(), result.error().message());
        return LayerOutcome.builder(DeepDetector.LAYER, DeepDetector.LAYER_NAME)
                .passed(true)
                .error(result.error().message())
                .build();
    }

    private static ItemVerdict aiGenerated(MediaItem item, int layer, List<LayerOutcome> layers) {
        return verdict(item, Authenticity.AI_GENERATED, layer, layers);
    }

    private static ItemVerdict genuine(MediaItem item, List<LayerOutcome> layers) {
        return verdict(item, Authenticity.LIKELY_GENUINE, null, layers);
    }

    private static ItemVerdict verdict(MediaItem item, Authenticity a, Integer failedAt, List<LayerOutcome> layers) {
        return new ItemVerdict(item.name(), item.size(), item.kind(), a, failedAt, layers, VerdictDetails.from(a, layers));
    }
}
