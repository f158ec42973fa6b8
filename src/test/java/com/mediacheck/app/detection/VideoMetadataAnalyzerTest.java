package com.mediacheck.app.detection;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class VideoMetadataAnalyzerTest {

    private final VideoMetadataAnalyzer analyzer = new VideoMetadataAnalyzer();

    private LayerOutcome analyze(String content) {
        return analyzer.analyze(MetadataSample.of(content.getBytes(StandardCharsets.UTF_8), analyzer.scanBytes()), "clip.mp4");
    }

    @Test
    void runwayProvenanceBundleFailsLayer() {
        LayerOutcome out = analyze("ftyp....jumb c2pa.manifest RunwayML ... trainedAlgorithmicMedia");

        assertTrue(out.failed());
        assertEquals(2, out.layer());
        assertEquals("Runway ML", out.generator());
        assertEquals("very high", out.confidence());
        assertEquals(5, out.indicators().size());
    }

    @Test
    void runwayWithoutGenerationMarkerIsNotConclusive() {
        LayerOutcome out = analyze("Runway C2PA");
        assertTrue(out.passed());
        assertFalse(out.physicalCapture());
    }

    @Test
    void miniMaxAigcExtractsProductionId() {
        LayerOutcome out = analyze("AIGC {\"ContentProducer\":\"MiniMax\",\"ProduceID\":\"884213\"}");

        assertTrue(out.failed());
        assertEquals("Hailuo MiniMax", out.generator());
        assertTrue(out.indicators().contains("Production ID: 884213"), "indicators: " + out.indicators());
    }

    @Test
    void soraIdentifiersMatchOnRawBytes() {
        byte[] data = new byte[64];
        data[0] = (byte) 0xFF;
        data[1] = (byte) 0xC3;
        byte[] marker = "OAICA-L".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(marker, 0, data, 10, marker.length);

        LayerOutcome out = analyzer.analyze(MetadataSample.of(data, analyzer.scanBytes()), "clip.mp4");
        assertTrue(out.failed());
        assertEquals("OpenAI Sora", out.generator());
    }

    @Test
    void generatorMarkersWinOverCameraEvidence() {
        LayerOutcome out = analyze("iPhone 13 back camera 5.1mm f/1.6 GPS Coordinates RunwayML c2pa Video Generation");
        assertTrue(out.failed());
        assertEquals("Runway ML", out.generator());
    }

    @Test
    void iphoneCaptureIsPhysicalCapture() {
        LayerOutcome out = analyze("com.apple.quicktime.model iPhone 13 Lens Model: iPhone 13 back camera 5.1mm f/1.6 "
                + "GPS Coordinates +37.33-122.03");

        assertTrue(out.passed());
        assertTrue(out.physicalCapture());
        assertEquals(LayerOutcome.REAL_CAMERA_FOOTAGE, out.sourceType());
        assertEquals("iPhone 13", out.deviceInfo());
        assertTrue(out.indicators().contains("Lens: iPhone 13 back camera 5.1mm f/1.6"), "indicators: " + out.indicators());
    }

    @Test
    void androidCaptureExtractsVersionAndFps() {
        LayerOutcome out = analyze("Android Version: 14\nAndroid Capture FPS: 30\n");

        assertTrue(out.physicalCapture());
        assertEquals("Android 14", out.deviceInfo());
        assertTrue(out.indicators().contains("Android Version: 14"));
        assertTrue(out.indicators().contains("Capture FPS: 30"));
    }

    @Test
    void noDistinctiveMetadataPassesToNextLayer() {
        LayerOutcome out = analyze("ftypisom moov mvhd trak");

        assertTrue(out.passed());
        assertFalse(out.physicalCapture());
        assertEquals("Proceeding to final verification layer", out.note());
        assertEquals("No distinctive AI or camera metadata found", out.indicators().get(0));
    }

    @Test
    void markerBeyondScanPrefixIsIgnored() {
        StringBuilder sb = new StringBuilder();
        sb.append("x".repeat(VideoMetadataAnalyzer.DEFAULT_SCAN_BYTES + 100));
        sb.append("OpenAI");
        assertTrue(analyze(sb.toString()).passed());
    }

    @Test
    void unreadableFileDegradesToPass() {
        Path missing = Path.of(System.getProperty("java.io.tmpdir"), "mediacheck-missing-" + System.nanoTime() + ".mp4");

        LayerOutcome out = analyzer.analyze(missing, "clip.mp4");
        assertTrue(out.passed());
        assertTrue(out.hasError());
        assertEquals("Standard metadata check performed", out.note());
    }

    @Test
    void readsOnlyPrefixFromDisk() throws Exception {
        Path dir = Files.createTempDirectory("mediacheck-video-");
        Path file = dir.resolve("clip.mp4");
        Files.writeString(file, "Android Version: 12 Android Capture FPS: 60", StandardCharsets.UTF_8);

        LayerOutcome first = analyzer.analyze(file, "clip.mp4");
        LayerOutcome second = analyzer.analyze(file, "clip.mp4");

        assertEquals("Android 12", first.deviceInfo());
        assertEquals(first, second, "Same bytes must give the same outcome");
    }
}
