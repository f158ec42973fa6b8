package com.mediacheck.app.pipeline;

import java.util.List;

import com.mediacheck.app.detection.LayerOutcome;

/**
 * Projeção do veredito: evidência da camada que decidiu (a que falhou, ou a
 * última que passou) complementada pelo que a camada 2 soube do dispositivo.
 */
public record VerdictDetails(
        String layerName,
        String reason,
        String verdict,
        String generator,
        String confidence,
        Double aiPercentage,
        Double humanPercentage,
        String sourceType,
        String deviceInfo,
        Boolean screenshot,
        Boolean cameraPhoto,
        List<String> indicators,
        String error
) {

    public static final String CAMERA_SHORTCUT_VERDICT = "Real camera footage detected";

    public VerdictDetails {
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
    }

    static VerdictDetails from(Authenticity authenticity, List<LayerOutcome> layers) {
        LayerOutcome deciding = layers.get(layers.size() - 1);
        LayerOutcome metadata = layers.stream().filter(l -> l.layer() == 2).findFirst().orElse(null);

        String verdict = deciding.verdict();
        if (verdict == null) {
            verdict = deciding.physicalCapture() ? CAMERA_SHORTCUT_VERDICT : authenticity.label();
        }

        return new VerdictDetails(
                deciding.layerName(),
                deciding.reason(),
                verdict,
                deciding.generator(),
                deciding.confidence(),
                deciding.aiPercentage(),
                deciding.humanPercentage(),
                firstNonNull(deciding.sourceType(), metadata == null ? null : metadata.sourceType()),
                firstNonNull(deciding.deviceInfo(), metadata == null ? null : metadata.deviceInfo()),
                metadata == null ? null : metadata.screenshot(),
                metadata == null ? null : metadata.cameraPhoto(),
                deciding.indicators(),
                deciding.error()
        );
    }

    /** Item que não chegou a ser classificado por erro inesperado (fail-open). */
    static VerdictDetails unexpectedFailure(String error) {
        return new VerdictDetails(null, null, Authenticity.LIKELY_GENUINE.label(), null, null,
                null, null, null, null, null, null, List.of(), error);
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }
}
