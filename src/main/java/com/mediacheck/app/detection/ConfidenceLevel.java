package com.mediacheck.app.detection;

/**
 * Nível qualitativo de confiança usado pelas camadas locais (1 e 2).
 * A camada 3 repassa o texto do detector externo sem converter.
 */
public enum ConfidenceLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    VERY_HIGH("very high");

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
