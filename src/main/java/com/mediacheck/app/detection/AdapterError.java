package com.mediacheck.app.detection;

import java.util.Objects;

/** Falha de infraestrutura ao consultar o detector externo. */
public record AdapterError(Kind kind, String message) {

    public enum Kind {
        /** Processo não pôde ser iniciado. */
        LAUNCH_FAILED,
        NON_ZERO_EXIT,
        TIMEOUT,
        /** Saída padrão vazia ou JSON inválido. */
        MALFORMED_OUTPUT,
        /** Detector respondeu {@code success: false}. */
        INCOMPLETE
    }

    public AdapterError {
        Objects.requireNonNull(kind, "kind");
        message = message == null || message.isBlank() ? kind.name() : message;
    }
}
