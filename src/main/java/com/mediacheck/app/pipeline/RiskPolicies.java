package com.mediacheck.app.pipeline;

/**
 * As duas políticas de risco em uso. Elas divergem de propósito e ficam
 * separadas: imagens usam a fração de itens com IA, vídeos comparam contagens.
 */
public final class RiskPolicies {

    private RiskPolicies() {}

    /** High se fração de IA >= 0.5, Medium se houver qualquer IA, senão Low. */
    public static RiskPolicy imageRiskPolicy() {
        return (ai, genuine, fileCount) -> {
            if (ai <= 0 || fileCount <= 0) return RiskScore.LOW;
            double fraction = (double) ai / fileCount;
            return fraction >= 0.5 ? RiskScore.HIGH : RiskScore.MEDIUM;
        };
    }

    /** High se há mais itens com IA do que genuínos, Medium se houver qualquer IA, senão Low. */
    public static RiskPolicy videoRiskPolicy() {
        return (ai, genuine, fileCount) -> {
            if (ai > genuine) return RiskScore.HIGH;
            if (ai > 0) return RiskScore.MEDIUM;
            return RiskScore.LOW;
        };
    }

    /** round(genuine / fileCount * 100); lote vazio dá 0. */
    public static int confidence(int genuineCount, int fileCount) {
        if (fileCount <= 0) return 0;
        return (int) Math.round(genuineCount * 100.0 / fileCount);
    }
}
