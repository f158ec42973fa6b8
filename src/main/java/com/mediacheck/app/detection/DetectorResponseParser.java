package com.mediacheck.app.detection;

import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Interpreta a resposta JSON do detector externo:
 * {@code {success, error?, is_ai_generated?, verdict?, ai_percentage?, human_percentage?, confidence?,
 * heatmap_url?, detection_step?, analysis?, metadata?}}. {@code analysis} e {@code metadata} seguem
 * adiante como JSON bruto.
 */
public final class DetectorResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DetectorResponseParser() {}

    public static DetectorResult parse(String stdout) {
        JsonNode root = readJson(stdout);
        if (root == null || !root.isObject()) {
            return DetectorResult.failed(AdapterError.Kind.MALFORMED_OUTPUT,
                    "Failed to parse TruthScan results: " + preview(stdout));
        }

        if (!root.path("success").asBoolean(false)) {
            String err = text(root, "error");
            return DetectorResult.failed(AdapterError.Kind.INCOMPLETE,
                    err == null ? "TruthScan analysis incomplete" : err);
        }

        boolean ai = root.path("is_ai_generated").asBoolean(false);
        Double aiPct = number(root, "ai_percentage");

        LayerOutcome.Builder b = LayerOutcome.builder(DeepDetector.LAYER, DeepDetector.LAYER_NAME)
                .passed(!ai)
                .verdict(text(root, "verdict"))
                .aiPercentage(aiPct)
                .humanPercentage(number(root, "human_percentage"))
                .confidence(text(root, "confidence"))
                .heatmapUrl(text(root, "heatmap_url"))
                .detectionStep(text(root, "detection_step"))
                .analysis(text(root, "analysis"))
                .metadata(text(root, "metadata"));

        if (ai) {
            b.reason("TruthScan detected AI generation with " + formatPercent(aiPct) + "% AI probability");
        }
        return DetectorResult.ok(b.build());
    }

    // Aceita o documento inteiro ou, se houver ruído antes, a última linha não vazia.
    private static JsonNode readJson(String stdout) {
        if (stdout == null || stdout.isBlank()) return null;
        String trimmed = stdout.trim();
        try {
            return MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            int idx = trimmed.lastIndexOf('\n');
            if (idx < 0) return null;
            try {
                return MAPPER.readTree(trimmed.substring(idx + 1).trim());
            } catch (JsonProcessingException again) {
                return null;
            }
        }
    }

    static String text(JsonNode body, String field) {
        JsonNode n = body == null ? null : body.get(field);
        if (n == null || n.isNull()) return null;
        return n.isValueNode() ? n.asText(null) : n.toString();
    }

    static Double number(JsonNode body, String field) {
        JsonNode n = body == null ? null : body.get(field);
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.asDouble();
        try {
            String raw = n.asText();
            if (raw == null || raw.isBlank()) return null;
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    static String formatPercent(Double v) {
        if (v == null) return "unknown";
        if (v == Math.rint(v)) return String.valueOf(v.longValue());
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private static String preview(String s) {
        if (s == null || s.isBlank()) return "empty output";
        String t = s.trim();
        return t.length() > 200 ? t.substring(0, 200) + "..." : t;
    }
}
