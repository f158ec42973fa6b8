package com.mediacheck.app.detection;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Camada 2: heurísticas sobre o prefixo de metadados do arquivo.
 * Implementações são sem estado; a mesma amostra gera sempre o mesmo resultado.
 */
public interface MetadataAnalyzer {

    int LAYER = 2;

    /** Bytes lidos do início do arquivo. */
    int scanBytes();

    LayerOutcome analyze(MetadataSample sample, String filename);

    /** Resultado inconclusivo usado quando a leitura falha. */
    LayerOutcome degraded(String error);

    default LayerOutcome analyze(Path file, String filename) {
        MetadataSample sample;
        try {
            sample = MetadataSample.read(file, scanBytes());
        } catch (IOException e) {
            return degraded(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        return analyze(sample, filename);
    }
}
