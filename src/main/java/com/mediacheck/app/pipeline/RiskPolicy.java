package com.mediacheck.app.pipeline;

/** Converte as contagens de um lote em um nível de risco. */
@FunctionalInterface
public interface RiskPolicy {

    RiskScore assess(int aiDetectedCount, int genuineCount, int fileCount);
}
