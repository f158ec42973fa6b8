package com.mediacheck.app.pipeline;

import java.time.Instant;
import java.util.List;

/** Relatório agregado de um lote (uma reclamação). */
public record BatchReport(
        String claimId,
        Instant processedAt,
        Pipeline pipeline,
        List<ItemVerdict> results,
        int fileCount,
        int imageCount,
        int videoCount,
        int aiDetectedCount,
        int genuineCount,
        RiskScore riskScore,
        int confidence,
        String notes
) {

    public BatchReport {
        results = List.copyOf(results);
    }

    static BatchReport aggregate(String claimId, Pipeline pipeline, List<MediaItem> items,
                                 List<ItemVerdict> results, String notes) {
        int fileCount = items.size();
        int images = (int) items.stream().filter(i -> i.kind() == MediaKind.IMAGE).count();
        int ai = (int) results.stream().filter(ItemVerdict::aiGenerated).count();
        int genuine = results.size() - ai;

        return new BatchReport(
                claimId,
                Instant.now(),
                pipeline,
                results,
                fileCount,
                images,
                fileCount - images,
                ai,
                genuine,
                pipeline.riskPolicy().assess(ai, genuine, fileCount),
                RiskPolicies.confidence(genuine, fileCount),
                notes
        );
    }
}
