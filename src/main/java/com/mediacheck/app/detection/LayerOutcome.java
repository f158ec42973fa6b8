package com.mediacheck.app.detection;

import java.util.ArrayList;
import java.util.List;

/**
 * Resultado de uma camada do classificador em cascata.
 *
 * <p>Campos opcionais ficam {@code null} quando a camada não os produz.
 * {@code aiPercentage}, {@code humanPercentage}, {@code verdict}, {@code heatmapUrl},
 * {@code detectionStep}, {@code analysis} e {@code metadata} só aparecem na camada 3.
 * Os dois últimos guardam o JSON bruto devolvido pelo detector.
 */
public record LayerOutcome(
        int layer,
        String layerName,
        boolean passed,
        String generator,
        String confidence,
        String reason,
        List<String> indicators,
        String sourceType,
        String deviceInfo,
        Boolean screenshot,
        Boolean cameraPhoto,
        String note,
        Double aiPercentage,
        Double humanPercentage,
        String verdict,
        String heatmapUrl,
        String detectionStep,
        String analysis,
        String metadata,
        String error
) {

    public static final String REAL_CAMERA_FOOTAGE = "Real Camera Footage";

    public LayerOutcome {
        if (layer < 1 || layer > 3) {
            throw new IllegalArgumentException("layer fora do intervalo 1..3: " + layer);
        }
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
    }

    public boolean failed() {
        return !passed;
    }

    /** Camada 2 (variante de vídeo) corroborou captura por câmera física. */
    public boolean physicalCapture() {
        return passed && REAL_CAMERA_FOOTAGE.equals(sourceType);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public static Builder builder(int layer, String layerName) {
        return new Builder(layer, layerName);
    }

    public static final class Builder {
        private final int layer;
        private final String layerName;
        private boolean passed = true;
        private String generator;
        private String confidence;
        private String reason;
        private final List<String> indicators = new ArrayList<>();
        private String sourceType;
        private String deviceInfo;
        private Boolean screenshot;
        private Boolean cameraPhoto;
        private String note;
        private Double aiPercentage;
        private Double humanPercentage;
        private String verdict;
        private String heatmapUrl;
        private String detectionStep;
        private String analysis;
        private String metadata;
        private String error;

        private Builder(int layer, String layerName) {
            this.layer = layer;
            this.layerName = layerName;
        }

        public Builder passed(boolean v) { this.passed = v; return this; }
        public Builder generator(String v) { this.generator = v; return this; }
        public Builder confidence(String v) { this.confidence = v; return this; }
        public Builder confidence(ConfidenceLevel v) { this.confidence = v == null ? null : v.label(); return this; }
        public Builder reason(String v) { this.reason = v; return this; }
        public Builder indicator(String v) { if (v != null) this.indicators.add(v); return this; }
        public Builder indicators(List<String> v) { if (v != null) this.indicators.addAll(v); return this; }
        public Builder sourceType(String v) { this.sourceType = v; return this; }
        public Builder deviceInfo(String v) { this.deviceInfo = v; return this; }
        public Builder screenshot(Boolean v) { this.screenshot = v; return this; }
        public Builder cameraPhoto(Boolean v) { this.cameraPhoto = v; return this; }
        public Builder note(String v) { this.note = v; return this; }
        public Builder aiPercentage(Double v) { this.aiPercentage = v; return this; }
        public Builder humanPercentage(Double v) { this.humanPercentage = v; return this; }
        public Builder verdict(String v) { this.verdict = v; return this; }
        public Builder heatmapUrl(String v) { this.heatmapUrl = v; return this; }
        public Builder detectionStep(String v) { this.detectionStep = v; return this; }
        public Builder analysis(String v) { this.analysis = v; return this; }
        public Builder metadata(String v) { this.metadata = v; return this; }
        public Builder error(String v) { this.error = v; return this; }

        public LayerOutcome build() {
            return new LayerOutcome(
                    layer, layerName, passed, generator, confidence, reason, indicators,
                    sourceType, deviceInfo, screenshot, cameraPhoto, note,
                    aiPercentage, humanPercentage, verdict, heatmapUrl, detectionStep, analysis, metadata, error
            );
        }
    }
}
