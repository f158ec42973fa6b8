package com.mediacheck.app.detection;

import java.nio.file.Path;

/**
 * Camada 3: detector probabilístico externo, tratado como caixa preta.
 * Implementações não lançam exceção por falha de transporte: devolvem
 * {@link DetectorResult#failed(AdapterError)}. Interrupção da espera é a
 * exceção: lança {@link DetectorInterruptedException}.
 */
public interface DeepDetector {

    int LAYER = 3;
    String LAYER_NAME = "TruthScan Deep Analysis";

    DetectorResult detect(Path file, String originalName);
}
