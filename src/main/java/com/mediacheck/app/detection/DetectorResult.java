package com.mediacheck.app.detection;

/**
 * Resultado do detector externo: ou um {@link LayerOutcome} classificado,
 * ou um {@link AdapterError}. Nunca os dois.
 */
public record DetectorResult(LayerOutcome outcome, AdapterError error) {

    public DetectorResult {
        if ((outcome == null) == (error == null)) {
            throw new IllegalArgumentException("DetectorResult exige exatamente um de outcome/error");
        }
    }

    public static DetectorResult ok(LayerOutcome outcome) {
        return new DetectorResult(outcome, null);
    }

    public static DetectorResult failed(AdapterError error) {
        return new DetectorResult(null, error);
    }

    public static DetectorResult failed(AdapterError.Kind kind, String message) {
        return failed(new AdapterError(kind, message));
    }

    public boolean isOk() {
        return outcome != null;
    }
}
