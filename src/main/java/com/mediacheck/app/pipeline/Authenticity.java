package com.mediacheck.app.pipeline;

public enum Authenticity {
    LIKELY_GENUINE("Likely Genuine", "PASSED"),
    AI_GENERATED("AI Generated", "AI_DETECTED");

    private final String label;
    private final String finalStatus;

    Authenticity(String label, String finalStatus) {
        this.label = label;
        this.finalStatus = finalStatus;
    }

    public String label() {
        return label;
    }

    public String finalStatus() {
        return finalStatus;
    }
}
