package com.mediacheck.app.detection;

/**
 * Thread interrompida enquanto esperava o detector externo. Não é falha de
 * transporte: o item não foi analisado e o lote deve ser abortado.
 */
public final class DetectorInterruptedException extends RuntimeException {

    public DetectorInterruptedException(String item, InterruptedException cause) {
        super("Análise profunda interrompida: " + item, cause);
    }
}
