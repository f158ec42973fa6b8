package com.mediacheck.app.detection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Camada 2 do pipeline de imagens. Diferente da variante de vídeo, não para
 * na primeira regra: acumula todos os indícios (gerador, screenshot, EXIF de
 * câmera, dispositivo) e só então decide.
 */
public final class ImageMetadataAnalyzer implements MetadataAnalyzer {

    public static final String LAYER_NAME = "Metadata Analysis";
    public static final int DEFAULT_SCAN_BYTES = 1024 * 1024;
    public static final int MIN_CAMERA_MARKERS = 3;

    record Signature(String name, Pattern pattern) {
        static Signature of(String name, String regex) {
            return new Signature(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }

        boolean foundIn(String text) {
            return pattern.matcher(text).find();
        }
    }

    static final List<String> GROK_MARKERS = List.of(
            "Grok Image Prompt",
            "GrokImagePrompt",
            "Grok Image Upsampled",
            "GrokImageUpsampled",
            "xmp:GrokImage"
    );

    static final List<Signature> GENERATORS = List.of(
            Signature.of("Google AI", "Made with Google AI|Google Generative AI|Google C2PA"),
            Signature.of("ChatGPT/GPT-4", "ChatGPT|GPT-4o"),
            Signature.of("Adobe Firefly", "Adobe_Firefly|Adobe Firefly"),
            Signature.of("Gemini", "Gemini Flash|gemini-flash"),
            Signature.of("Flux", "flux|fluxPro"),
            Signature.of("DALL-E", "DALL-E|dalle"),
            Signature.of("Midjourney", "midjourney"),
            Signature.of("Stable Diffusion", "stable.?diffusion")
    );

    static final List<Pattern> SCREENSHOT_NAMES = List.of(
            Pattern.compile("Screenshot_\\d{4}-\\d{2}-\\d{2}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Screenshot[\\s_-]\\d", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Screen[_-]?shot", Pattern.CASE_INSENSITIVE),
            Pattern.compile("SCR[\\d-]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("SS_\\d", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern MOBILE_SOFTWARE =
            Pattern.compile("Android CPH|Android|MIUI|ColorOS|OneUI|OxygenOS", Pattern.CASE_INSENSITIVE);

    // exposição, abertura, distância focal, ISO, flash, medição, balanço de branco
    static final List<Signature> CAMERA_MARKERS = List.of(
            Signature.of("exposure", "ExposureTime|ExposureProgram|ExposureMode"),
            Signature.of("aperture", "Aperture|FNumber|ApertureValue"),
            Signature.of("focalLength", "FocalLength"),
            Signature.of("iso", "ISO[\\s:]|ISOSpeedRatings"),
            Signature.of("flash", "Flash[\\s:]"),
            Signature.of("meteringMode", "MeteringMode"),
            Signature.of("whiteBalance", "WhiteBalance")
    );

    private static final String AI_SOURCE_TYPE = "trainedAlgorithmicMedia";

    private static final Pattern MAKE = Pattern.compile("Make[\\s:]+([^\\n\\r]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MODEL = Pattern.compile("Model[\\s:]+([^\\n\\r]+?)(?:\\n|\\r|$)", Pattern.CASE_INSENSITIVE);

    private final int scanBytes;

    public ImageMetadataAnalyzer() {
        this(DEFAULT_SCAN_BYTES);
    }

    public ImageMetadataAnalyzer(int scanBytes) {
        this.scanBytes = Math.max(1, scanBytes);
    }

    @Override
    public int scanBytes() {
        return scanBytes;
    }

    @Override
    public LayerOutcome analyze(MetadataSample sample, String filename) {
        String text = sample.text();
        String name = filename == null ? "" : filename;
        List<String> indicators = new ArrayList<>();

        boolean ai = false;
        String generator = null;
        String sourceType = null;

        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : GROK_MARKERS) {
            if (lower.contains(marker.toLowerCase(Locale.ROOT))) {
                ai = true;
                generator = "Grok AI (X/xAI)";
                sourceType = "Grok AI Generated";
                indicators.add("Grok AI metadata detected");
                break;
            }
        }

        if (text.contains("XMP Toolkit") || text.contains("Adobe XMP Core")) {
            indicators.add("XMP metadata present");
        }

        boolean screenshot = isScreenshot(text, name);
        if (screenshot) {
            sourceType = "Screenshot";
            indicators.add("Screenshot detected");
        }

        int cameraMarkers = countCameraMarkers(text);
        boolean cameraPhoto = cameraMarkers >= MIN_CAMERA_MARKERS;
        if (cameraPhoto) {
            sourceType = "Camera Photo";
            indicators.add("Camera EXIF data present (" + cameraMarkers + " indicators)");
        }

        if (StringUtils.containsIgnoreCase(text, "c2pa")) {
            indicators.add("C2PA standard detected");
        }

        if (text.contains(AI_SOURCE_TYPE)) {
            ai = true;
            sourceType = "Trained Algorithmic Media (AI)";
            indicators.add("Digital source type: AI-generated");
        }

        if (generator == null) {
            for (Signature sig : GENERATORS) {
                if (sig.foundIn(text)) {
                    generator = sig.name();
                    ai = true;
                    indicators.add("Generator: " + sig.name());
                    break;
                }
            }
        }

        String deviceInfo = extractDevice(text);
        if (deviceInfo != null) {
            indicators.add("Device: " + deviceInfo);
        }

        if (ai) {
            return LayerOutcome.builder(LAYER, LAYER_NAME)
                    .passed(false)
                    .generator(generator)
                    .sourceType(sourceType)
                    .indicators(indicators)
                    .reason("AI-generated metadata detected: " + (generator == null ? "Unknown Generator" : generator))
                    .build();
        }

        return LayerOutcome.builder(LAYER, LAYER_NAME)
                .passed(true)
                .screenshot(screenshot)
                .cameraPhoto(cameraPhoto)
                .deviceInfo(deviceInfo)
                .sourceType(sourceType)
                .indicators(indicators)
                .build();
    }

    @Override
    public LayerOutcome degraded(String error) {
        return LayerOutcome.builder(LAYER, LAYER_NAME)
                .passed(true)
                .screenshot(false)
                .cameraPhoto(false)
                .error(error)
                .build();
    }

    static boolean isScreenshot(String text, String filename) {
        for (Pattern p : SCREENSHOT_NAMES) {
            if (p.matcher(filename).find()) return true;
        }
        return MOBILE_SOFTWARE.matcher(text).find()
                && filename.toLowerCase(Locale.ROOT).contains("screenshot");
    }

    static int countCameraMarkers(String text) {
        int count = 0;
        for (Signature marker : CAMERA_MARKERS) {
            if (marker.foundIn(text)) count++;
        }
        return count;
    }

    static String extractDevice(String text) {
        List<String> parts = new ArrayList<>(2);
        addDevicePart(parts, MAKE.matcher(text));
        addDevicePart(parts, MODEL.matcher(text));
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private static void addDevicePart(List<String> parts, Matcher m) {
        if (!m.find()) return;
        String value = m.group(1).trim();
        if (!value.isEmpty() && !value.contains("Unknown")) {
            parts.add(value);
        }
    }
}
