package com.mediacheck.app.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mediacheck.app.detection.LayerOutcome;
import com.mediacheck.app.pipeline.BatchReport;
import com.mediacheck.app.pipeline.ItemVerdict;
import com.mediacheck.app.pipeline.VerdictDetails;

/** Projeção JSON do {@link BatchReport} entregue ao chamador. */
public final class ReportJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportJson() {}

    public static String write(JsonNode node) throws JsonProcessingException {
        return MAPPER.writeValueAsString(node);
    }

    public static ObjectNode toJson(BatchReport report) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("success", true);
        putNullable(out, "claimId", report.claimId());
        out.put("processedAt", report.processedAt().toString());
        out.put("pipeline", report.pipeline().label());
        out.put("fileCount", report.fileCount());
        out.put("imageCount", report.imageCount());
        out.put("videoCount", report.videoCount());
        out.put("riskScore", report.riskScore().label());
        out.put("confidence", report.confidence());
        out.put("aiDetectedCount", report.aiDetectedCount());
        out.put("genuineCount", report.genuineCount());

        ArrayNode results = out.putArray("results");
        for (ItemVerdict v : report.results()) {
            results.add(toJson(v));
        }

        putNullable(out, "notes", report.notes());
        return out;
    }

    static ObjectNode toJson(ItemVerdict v) {
        ObjectNode it = MAPPER.createObjectNode();
        it.put("filename", v.name());
        it.put("size", v.size());
        it.put("type", v.kind().label());
        it.put("authenticity", v.authenticity().label());
        it.put("finalStatus", v.finalStatus());
        if (v.failedAtLayer() == null) it.putNull("failedAtLayer"); else it.put("failedAtLayer", v.failedAtLayer());

        ArrayNode layers = it.putArray("layerResults");
        for (LayerOutcome l : v.layers()) {
            layers.add(toJson(l));
        }

        it.set("details", toJson(v.details()));
        return it;
    }

    static ObjectNode toJson(LayerOutcome l) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put("layer", l.layer());
        o.put("name", l.layerName());
        o.put("passed", l.passed());
        putIfPresent(o, "generator", l.generator());
        putIfPresent(o, "confidence", l.confidence());
        putIfPresent(o, "reason", l.reason());
        putIfPresent(o, "sourceType", l.sourceType());
        putIfPresent(o, "deviceInfo", l.deviceInfo());
        if (l.screenshot() != null) o.put("isScreenshot", l.screenshot());
        if (l.cameraPhoto() != null) o.put("isCameraPhoto", l.cameraPhoto());
        putIfPresent(o, "note", l.note());
        if (l.aiPercentage() != null) o.put("aiPercentage", l.aiPercentage());
        if (l.humanPercentage() != null) o.put("humanPercentage", l.humanPercentage());
        putIfPresent(o, "verdict", l.verdict());
        putIfPresent(o, "heatmapUrl", l.heatmapUrl());
        putIfPresent(o, "detectionStep", l.detectionStep());
        putRawJson(o, "analysis", l.analysis());
        putRawJson(o, "metadata", l.metadata());
        putIfPresent(o, "error", l.error());
        ArrayNode ind = o.putArray("indicators");
        l.indicators().forEach(ind::add);
        return o;
    }

    static ObjectNode toJson(VerdictDetails d) {
        ObjectNode o = MAPPER.createObjectNode();
        putIfPresent(o, "layerName", d.layerName());
        putIfPresent(o, "reason", d.reason());
        putIfPresent(o, "verdict", d.verdict());
        putIfPresent(o, "generator", d.generator());
        putIfPresent(o, "confidence", d.confidence());
        if (d.aiPercentage() != null) o.put("aiPercentage", d.aiPercentage());
        if (d.humanPercentage() != null) o.put("humanPercentage", d.humanPercentage());
        putIfPresent(o, "sourceType", d.sourceType());
        putIfPresent(o, "deviceInfo", d.deviceInfo());
        if (d.screenshot() != null) o.put("isScreenshot", d.screenshot());
        if (d.cameraPhoto() != null) o.put("isCameraPhoto", d.cameraPhoto());
        ArrayNode ind = o.putArray("indicators");
        d.indicators().forEach(ind::add);
        putIfPresent(o, "error", d.error());
        return o;
    }

    /** Corpo de erro no mesmo formato de sempre: {@code {ok:false, error:{code, message}}}. */
    public static ObjectNode error(String code, String message) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("ok", false);
        ObjectNode err = out.putObject("error");
        err.put("code", code);
        err.put("message", message);
        return out;
    }

    private static void putNullable(ObjectNode obj, String key, String value) {
        if (value == null) obj.putNull(key);
        else obj.put(key, value);
    }

    private static void putIfPresent(ObjectNode obj, String key, String value) {
        if (value != null) obj.put(key, value);
    }

    // repassa o JSON do detector como objeto; se não for JSON válido, vai como texto
    private static void putRawJson(ObjectNode obj, String key, String raw) {
        if (raw == null) return;
        if (raw.isBlank()) {
            obj.put(key, raw);
            return;
        }
        try {
            obj.set(key, MAPPER.readTree(raw));
        } catch (JsonProcessingException e) {
            obj.put(key, raw);
        }
    }
}
