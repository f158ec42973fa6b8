package com.mediacheck.app.detection;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Camada 1: compara o nome do arquivo com uma tabela ordenada de assinaturas
 * de nome conhecidas de geradores. A primeira regra que casa vence, então a
 * ordem da tabela é o critério de desempate.
 *
 * <p>Função pura: sem I/O. Nome nulo ou vazio conta como "sem match".
 */
public final class NamePatternMatcher {

    public static final int LAYER = 1;

    public record NameRule(String fragment, Pattern pattern, String generator, ConfidenceLevel confidence) {
        public NameRule {
            Objects.requireNonNull(fragment, "fragment");
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(generator, "generator");
        }

        /** Fragmento literal, comparado sem diferenciar maiúsculas. */
        public static NameRule fragment(String fragment, String generator, ConfidenceLevel confidence) {
            return new NameRule(fragment, Pattern.compile(Pattern.quote(fragment), Pattern.CASE_INSENSITIVE), generator, confidence);
        }

        public static NameRule regex(String regex, String generator, ConfidenceLevel confidence) {
            return new NameRule(regex, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), generator, confidence);
        }

        boolean matches(String filename) {
            return pattern.matcher(filename).find();
        }
    }

    // ordem importa: "runwayml" precisa vir antes de "runway"
    public static final List<NameRule> VIDEO_RULES = List.of(
            NameRule.fragment("kling", "Kling AI", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("pixverse", "PixVerse", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("gen-4", "Runway Gen-4", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("gen4", "Runway Gen-4", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("grok", "Grok Imagine", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("imagine", "Grok Imagine", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("chatgpt", "ChatGPT", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("veo3", "Veo 3", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("veo-3", "Veo 3", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("runwayml", "Runway ML", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("runway", "Runway ML", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("sora", "OpenAI Sora", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("minimax", "Hailuo MiniMax", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("hailuo", "Hailuo MiniMax", ConfidenceLevel.VERY_HIGH),
            NameRule.fragment("heygen", "HeyGen AI", ConfidenceLevel.VERY_HIGH)
    );

    public static final List<NameRule> IMAGE_RULES = List.of(
            NameRule.regex("gemini[_\\s]generated[_\\s]image", "Gemini", ConfidenceLevel.HIGH),
            NameRule.regex("chatgpt[_\\s]image|dall[-_]?e", "ChatGPT/DALL-E", ConfidenceLevel.HIGH),
            NameRule.regex("midjourney|_MJ_", "Midjourney", ConfidenceLevel.HIGH),
            NameRule.regex("stable[_\\s]diffusion|sd[_\\s]|sdxl", "Stable Diffusion", ConfidenceLevel.HIGH),
            NameRule.regex("firefly[_\\s]", "Firefly", ConfidenceLevel.HIGH),
            NameRule.regex("flux[_\\s]", "Flux", ConfidenceLevel.HIGH),
            NameRule.regex("grok[_\\s]", "Grok", ConfidenceLevel.HIGH),
            NameRule.regex("leonardo[_\\s]ai", "Leonardo AI", ConfidenceLevel.HIGH),
            NameRule.regex("bing[_\\s]image|image[_\\s]creator", "Bing Image Creator", ConfidenceLevel.HIGH),
            NameRule.regex("ideogram", "Ideogram", ConfidenceLevel.HIGH),
            NameRule.regex("craiyon", "Craiyon", ConfidenceLevel.HIGH),
            NameRule.regex("ai[_\\s]generated|generated[_\\s]by[_\\s]ai|ai[_\\s]art", "Generic AI", ConfidenceLevel.MEDIUM)
    );

    private final String layerName;
    private final List<NameRule> rules;

    public NamePatternMatcher(String layerName, List<NameRule> rules) {
        this.layerName = Objects.requireNonNull(layerName, "layerName");
        this.rules = List.copyOf(rules);
    }

    public static NamePatternMatcher forVideos() {
        return new NamePatternMatcher("Filename Analysis", VIDEO_RULES);
    }

    public static NamePatternMatcher forImages() {
        return new NamePatternMatcher("Filename Pattern Detection", IMAGE_RULES);
    }

    public String layerName() {
        return layerName;
    }

    public LayerOutcome match(String filename) {
        if (filename != null && !filename.isBlank()) {
            for (NameRule rule : rules) {
                if (rule.matches(filename)) {
                    return LayerOutcome.builder(LAYER, layerName)
                            .passed(false)
                            .generator(rule.generator())
                            .confidence(rule.confidence())
                            .reason(rule.generator() + " naming pattern detected in filename")
                            .indicator("Pattern \"" + rule.fragment() + "\" found in filename")
                            .build();
                }
            }
        }
        return LayerOutcome.builder(LAYER, layerName)
                .passed(true)
                .indicator("No AI generator pattern found in filename")
                .build();
    }
}
