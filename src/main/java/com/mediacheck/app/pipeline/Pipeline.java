package com.mediacheck.app.pipeline;

/**
 * Variantes do pipeline. Só a de vídeo aceita o atalho de câmera física
 * (camada 2 corrobora captura real e a camada 3 não é chamada).
 */
public enum Pipeline {
    IMAGE("image", false, 8, RiskPolicies.imageRiskPolicy()),
    VIDEO("video", true, 10, RiskPolicies.videoRiskPolicy());

    private final String label;
    private final boolean genuineShortcut;
    private final int maxFiles;
    private final RiskPolicy riskPolicy;

    Pipeline(String label, boolean genuineShortcut, int maxFiles, RiskPolicy riskPolicy) {
        this.label = label;
        this.genuineShortcut = genuineShortcut;
        this.maxFiles = maxFiles;
        this.riskPolicy = riskPolicy;
    }

    public String label() { return label; }

    public boolean genuineShortcut() { return genuineShortcut; }

    public int maxFiles() { return maxFiles; }

    public RiskPolicy riskPolicy() { return riskPolicy; }
}
