package com.mediacheck.app.pipeline;

public enum RiskScore {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskScore(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
