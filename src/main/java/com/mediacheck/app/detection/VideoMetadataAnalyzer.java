package com.mediacheck.app.detection;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Camada 2 do pipeline de vídeo. Aplica uma tabela ordenada de regras;
 * a primeira que casa decide. Marcadores de proveniência de geradores vêm
 * antes da corroboração de câmera física.
 */
public final class VideoMetadataAnalyzer implements MetadataAnalyzer {

    public static final String LAYER_NAME = "Metadata Analysis";
    public static final int DEFAULT_SCAN_BYTES = 50_000;

    private static final Logger logger = LoggerFactory.getLogger(VideoMetadataAnalyzer.class);

    private static final Pattern PRODUCE_ID = Pattern.compile("ProduceID['\":\\s]+(\\d+)");
    private static final Pattern IPHONE_MODEL = Pattern.compile("iPhone \\d+");
    private static final Pattern IPHONE_LENS = Pattern.compile("iPhone \\d+ back camera [\\d.]+mm f/[\\d.]+");
    private static final Pattern ANDROID_VERSION = Pattern.compile("Android Version.*?(\\d+)");
    private static final Pattern ANDROID_FPS = Pattern.compile("Android Capture FPS.*?(\\d+)");

    record MetadataRule(String name, Predicate<MetadataSample> when, Function<MetadataSample, LayerOutcome> then) {}

    static final List<MetadataRule> RULES = List.of(
            new MetadataRule("runway-c2pa", VideoMetadataAnalyzer::isRunwayC2pa, s -> runwayOutcome()),
            new MetadataRule("minimax-aigc", VideoMetadataAnalyzer::isMiniMaxAigc, VideoMetadataAnalyzer::miniMaxOutcome),
            new MetadataRule("openai-sora", VideoMetadataAnalyzer::isSoraProject, s -> soraOutcome()),
            new MetadataRule("iphone-camera", VideoMetadataAnalyzer::isIphoneCapture, VideoMetadataAnalyzer::iphoneOutcome),
            new MetadataRule("android-camera", VideoMetadataAnalyzer::isAndroidCapture, VideoMetadataAnalyzer::androidOutcome)
    );

    private final int scanBytes;

    public VideoMetadataAnalyzer() {
        this(DEFAULT_SCAN_BYTES);
    }

    public VideoMetadataAnalyzer(int scanBytes) {
        this.scanBytes = Math.max(1, scanBytes);
    }

    @Override
    public int scanBytes() {
        return scanBytes;
    }

    @Override
    public LayerOutcome analyze(MetadataSample sample, String filename) {
        for (MetadataRule rule : RULES) {
            if (rule.when().test(sample)) {
                logger.debug("Regra de metadados '{}' casou para {}", rule.name(), filename);
                return rule.then().apply(sample);
            }
        }
        return base()
                .indicator("No distinctive AI or camera metadata found")
                .note("Proceeding to final verification layer")
                .build();
    }

    @Override
    public LayerOutcome degraded(String error) {
        return base()
                .indicator("Metadata analysis completed")
                .note("Standard metadata check performed")
                .error(error)
                .build();
    }

    // ----------------- geradores -----------------

    private static boolean isRunwayC2pa(MetadataSample s) {
        return (s.textContains("RunwayML") || s.textContains("Runway"))
                && (s.textContains("c2pa") || s.textContains("C2PA"))
                && (s.textContains("trainedAlgorithmicMedia") || s.textContains("Video Generation"));
    }

    private static LayerOutcome runwayOutcome() {
        return aiDetected("Runway ML", "Runway ML Video Generation detected with C2PA provenance")
                .indicator("RunwayML Video Generation detected")
                .indicator("C2PA provenance standard present")
                .indicator("JUMBF metadata structure detected")
                .indicator("Digital Source Type: trainedAlgorithmicMedia")
                .indicator("Cryptographic content signatures present")
                .build();
    }

    private static boolean isMiniMaxAigc(MetadataSample s) {
        return s.textContains("AIGC")
                && (s.textContains("MiniMax") || s.textContains("minimax"))
                && s.textContains("ContentProducer");
    }

    private static LayerOutcome miniMaxOutcome(MetadataSample s) {
        LayerOutcome.Builder b = aiDetected("Hailuo MiniMax", "Hailuo MiniMax AI generation signatures detected")
                .indicator("AIGC (AI Generated Content) field detected")
                .indicator("ContentProducer: MiniMax")
                .indicator("Chinese TC260PG standard for AI content marking")
                .indicator("Cryptographic signatures present");
        Matcher m = PRODUCE_ID.matcher(s.text());
        if (m.find()) {
            b.indicator("Production ID: " + m.group(1));
        }
        return b.build();
    }

    // identificadores binários exatos: checa bytes, não o texto decodificado
    private static boolean isSoraProject(MetadataSample s) {
        return s.bytesContain("OpenAI")
                || s.bytesContain("OAICA-L")
                || s.bytesContain("Rafiki_Production")
                || (s.textContains("Adobe Photoshop 23.2") && s.textContains(".aep"));
    }

    private static LayerOutcome soraOutcome() {
        return aiDetected("OpenAI Sora", "OpenAI Sora project identifiers detected")
                .indicator("OpenAI project identifiers detected")
                .indicator("Adobe After Effects project file reference found")
                .indicator("OAICA project code detected")
                .build();
    }

    // ----------------- câmeras físicas -----------------

    private static boolean isIphoneCapture(MetadataSample s) {
        return s.textContains("iPhone")
                && (s.textContains("back camera") || s.textContains("Lens Model"))
                && s.textContains("GPS Coordinates");
    }

    private static LayerOutcome iphoneOutcome(MetadataSample s) {
        LayerOutcome.Builder b = cameraCapture()
                .indicator("GPS location data present")
                .indicator("Apple QuickTime format")
                .indicator("Physical camera metadata detected");

        Matcher model = IPHONE_MODEL.matcher(s.text());
        String device = "iPhone";
        if (model.find()) {
            device = model.group();
            b.indicator("Device: " + device);
        }
        Matcher lens = IPHONE_LENS.matcher(s.text());
        if (lens.find()) {
            b.indicator("Lens: " + lens.group());
        }
        return b.deviceInfo(device).build();
    }

    private static boolean isAndroidCapture(MetadataSample s) {
        return s.textContains("Android Version") && s.textContains("Android Capture FPS");
    }

    private static LayerOutcome androidOutcome(MetadataSample s) {
        LayerOutcome.Builder b = cameraCapture()
                .indicator("Android device metadata detected")
                .indicator("Physical camera capture settings present");

        Matcher version = ANDROID_VERSION.matcher(s.text());
        String device = "Android";
        if (version.find()) {
            device = "Android " + version.group(1);
            b.indicator("Android Version: " + version.group(1));
        }
        Matcher fps = ANDROID_FPS.matcher(s.text());
        if (fps.find()) {
            b.indicator("Capture FPS: " + fps.group(1));
        }
        return b.deviceInfo(device).build();
    }

    // ----------------- helpers -----------------

    private static LayerOutcome.Builder base() {
        return LayerOutcome.builder(LAYER, LAYER_NAME).passed(true);
    }

    private static LayerOutcome.Builder aiDetected(String generator, String reason) {
        return LayerOutcome.builder(LAYER, LAYER_NAME)
                .passed(false)
                .generator(generator)
                .confidence(ConfidenceLevel.VERY_HIGH)
                .reason(reason);
    }

    private static LayerOutcome.Builder cameraCapture() {
        return base()
                .sourceType(LayerOutcome.REAL_CAMERA_FOOTAGE)
                .confidence(ConfidenceLevel.VERY_HIGH);
    }
}
