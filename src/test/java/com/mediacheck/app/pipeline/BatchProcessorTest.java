package com.mediacheck.app.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.mediacheck.app.detection.AdapterError;
import com.mediacheck.app.detection.DetectorInterruptedException;

import static org.junit.jupiter.api.Assertions.*;

public class BatchProcessorTest {

    private Path dir;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("mediacheck-batch-");
    }

    private static BatchProcessor processor(Pipeline pipeline, FakeDetector detector) {
        return Pipelines.create(pipeline, PipelineSettings.defaults(), detector, Pacer.immediate(), item -> {});
    }

    private List<MediaItem> items(String... names) throws Exception {
        List<MediaItem> out = new ArrayList<>();
        for (String n : names) out.add(MediaFiles.write(dir, n, "plain bytes"));
        return out;
    }

    @Test
    void imageBatchWithMajorityAiIsHighRisk() throws Exception {
        BatchReport r = processor(Pipeline.IMAGE, FakeDetector.alwaysHuman())
                .process("CLM-1", items("midjourney_1.png", "dall-e_2.png", "IMG_3.jpg"), "rear bumper");

        assertEquals(3, r.fileCount());
        assertEquals(3, r.imageCount());
        assertEquals(0, r.videoCount());
        assertEquals(2, r.aiDetectedCount());
        assertEquals(1, r.genuineCount());
        assertEquals(RiskScore.HIGH, r.riskScore());
        assertEquals(33, r.confidence());
        assertEquals("rear bumper", r.notes());
        assertEquals("CLM-1", r.claimId());
    }

    @Test
    void imageBatchWithMinorityAiIsMediumRisk() throws Exception {
        BatchReport r = processor(Pipeline.IMAGE, FakeDetector.alwaysHuman())
                .process("CLM-2", items("IMG_1.jpg", "IMG_2.jpg", "IMG_3.jpg", "craiyon_4.png"), null);

        assertEquals(RiskScore.MEDIUM, r.riskScore());
        assertEquals(75, r.confidence());
    }

    @Test
    void cleanImageBatchIsLowRisk() throws Exception {
        BatchReport r = processor(Pipeline.IMAGE, FakeDetector.alwaysHuman())
                .process("CLM-3", items("IMG_1.jpg", "IMG_2.jpg", "IMG_3.jpg", "IMG_4.jpg"), null);

        assertEquals(RiskScore.LOW, r.riskScore());
        assertEquals(100, r.confidence());
        assertNull(r.notes());
    }

    @Test
    void videoBatchComparesCountsInsteadOfFraction() throws Exception {
        // 2 de 4 com IA: imagem daria High, vídeo dá Medium
        BatchReport r = processor(Pipeline.VIDEO, FakeDetector.alwaysHuman())
                .process("V-1", items("kling_1.mp4", "sora_2.mp4", "clip_3.mp4", "clip_4.mov"), null);

        assertEquals(2, r.aiDetectedCount());
        assertEquals(4, r.videoCount());
        assertEquals(RiskScore.MEDIUM, r.riskScore());
        assertEquals(50, r.confidence());
    }

    @Test
    void resultsKeepSubmissionOrder() throws Exception {
        BatchReport r = processor(Pipeline.IMAGE, FakeDetector.alwaysHuman())
                .process("CLM-4", items("c.jpg", "a.jpg", "b.jpg"), null);

        assertEquals(List.of("c.jpg", "a.jpg", "b.jpg"), r.results().stream().map(ItemVerdict::name).toList());
    }

    @Test
    void detectorIsNeverCalledConcurrently() throws Exception {
        FakeDetector detector = new FakeDetector(name -> FakeDetector.human(), 20);
        BatchProcessor p = processor(Pipeline.IMAGE, detector);

        p.process("CLM-5", items("IMG_1.jpg", "IMG_2.jpg", "IMG_3.jpg", "IMG_4.jpg", "midjourney_5.png"), null);

        assertEquals(1, detector.maxInFlight.get());
        assertEquals(4, detector.callCount(), "item rejected at layer 1 must not reach the detector");
        assertEquals(4, p.metrics().detectorCalls.sum());
    }

    @Test
    void pacingSleepsBeforeDetectorAndBetweenItems() throws Exception {
        List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());
        Pacer pacer = new Pacer(new JitteredDelay(3_000, 2_000), new JitteredDelay(5_000, 2_000), sleeps::add, new Random(7));
        BatchProcessor p = Pipelines.create(Pipeline.IMAGE, PipelineSettings.defaults(), FakeDetector.alwaysHuman(),
                pacer, item -> {});

        p.process("CLM-6", items("IMG_1.jpg", "kling_ai_generated.jpg", "IMG_3.jpg"), null);

        long before = sleeps.stream().filter(ms -> ms >= 3_000 && ms < 5_000).count();
        long between = sleeps.stream().filter(ms -> ms >= 5_000 && ms < 7_000).count();
        assertEquals(2, before, "one pre-detector wait per detector call: " + sleeps);
        assertEquals(2, between, "one wait between successive items: " + sleeps);
        assertEquals(4, sleeps.size());
    }

    @Test
    void emptyBatchIsRejected() {
        BatchProcessor p = processor(Pipeline.IMAGE, FakeDetector.alwaysHuman());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> p.process("X", List.of(), null));
        assertEquals("No files uploaded", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> p.process("X", null, null));
    }

    @Test
    void tooManyFilesIsRejectedBeforeAnyWork() throws Exception {
        FakeDetector detector = FakeDetector.alwaysHuman();
        BatchProcessor p = processor(Pipeline.IMAGE, detector);
        List<MediaItem> nine = items("1.jpg", "2.jpg", "3.jpg", "4.jpg", "5.jpg", "6.jpg", "7.jpg", "8.jpg", "9.jpg");

        assertThrows(IllegalArgumentException.class, () -> p.process("X", nine, null));
        assertEquals(0, detector.callCount());

        // vídeo aceita até 10
        BatchProcessor videos = processor(Pipeline.VIDEO, detector);
        List<MediaItem> ten = items("1.mp4", "2.mp4", "3.mp4", "4.mp4", "5.mp4", "6.mp4", "7.mp4", "8.mp4", "9.mp4", "10.mp4");
        assertEquals(10, videos.process("V", ten, null).fileCount());
    }

    @Test
    void oversizedItemIsRejected() throws Exception {
        FakeDetector detector = FakeDetector.alwaysHuman();
        BatchProcessor p = new BatchProcessor(Pipeline.IMAGE, Pipelines.nameMatcher(Pipeline.IMAGE),
                Pipelines.metadataAnalyzer(Pipeline.IMAGE, 4096), detector, Pacer.immediate(), 5, item -> {});

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> p.process("X", items("IMG_1.jpg"), null));
        assertTrue(e.getMessage().startsWith("File too large"), e.getMessage());
        assertEquals(0, detector.callCount());
    }

    @Test
    void unreadableItemIsRejected() {
        MediaItem ghost = new MediaItem("ghost.jpg", 1, dir.resolve("ghost.jpg"), MediaKind.IMAGE);
        BatchProcessor p = processor(Pipeline.IMAGE, FakeDetector.alwaysHuman());

        assertThrows(IllegalArgumentException.class, () -> p.process("X", List.of(ghost), null));
    }

    @Test
    void detectorOutageLeavesEveryItemGenuine() throws Exception {
        BatchProcessor p = processor(Pipeline.IMAGE, FakeDetector.alwaysFailing(AdapterError.Kind.NON_ZERO_EXIT));

        BatchReport r = p.process("CLM-7", items("IMG_1.jpg", "IMG_2.jpg"), null);

        assertEquals(0, r.aiDetectedCount());
        assertEquals(RiskScore.LOW, r.riskScore());
        assertEquals(2, p.metrics().detectorFailures.sum());
        r.results().forEach(v -> assertEquals("detector down", v.details().error()));
    }

    @Test
    void unexpectedExceptionBecomesGenuineVerdict() throws Exception {
        FakeDetector detector = new FakeDetector(name -> {
            if (name.equals("IMG_1.jpg")) throw new IllegalStateException("boom");
            return FakeDetector.ai();
        }, 0);
        BatchProcessor p = processor(Pipeline.IMAGE, detector);

        BatchReport r = p.process("CLM-8", items("IMG_1.jpg", "IMG_2.jpg"), null);

        ItemVerdict first = r.results().get(0);
        assertEquals(Authenticity.LIKELY_GENUINE, first.authenticity());
        assertEquals("boom", first.details().error());
        assertTrue(first.layers().isEmpty());
        assertEquals(Authenticity.AI_GENERATED, r.results().get(1).authenticity());
        assertEquals(1, p.metrics().unexpectedErrors.sum());
    }

    @Test
    void cleanupRunsOncePerItemInOrder() throws Exception {
        List<String> cleaned = new ArrayList<>();
        BatchProcessor p = Pipelines.create(Pipeline.VIDEO, PipelineSettings.defaults(), FakeDetector.alwaysHuman(),
                Pacer.immediate(), item -> cleaned.add(item.name()));

        p.process("V-2", items("kling.mp4", "clip.mp4", "sora.mp4"), null);

        assertEquals(List.of("kling.mp4", "clip.mp4", "sora.mp4"), cleaned);
    }

    @Test
    void deleteOnCleanupRemovesTemporaryCopies() throws Exception {
        BatchProcessor p = Pipelines.create(Pipeline.IMAGE, PipelineSettings.defaults(), FakeDetector.alwaysHuman(),
                Pacer.immediate(), MediaItem::deleteOnCleanup);
        List<MediaItem> batch = items("IMG_1.jpg", "IMG_2.jpg");

        p.process("CLM-9", batch, null);

        batch.forEach(i -> assertFalse(Files.exists(i.path()), "temporary file must be gone: " + i.path()));
    }

    @Test
    void interruptedPacingAbortsBatch() throws Exception {
        Pacer pacer = new Pacer(JitteredDelay.NONE, new JitteredDelay(10, 0), ms -> {
            throw new InterruptedException("shutdown");
        }, new Random(1));
        List<String> cleaned = new ArrayList<>();
        BatchProcessor p = Pipelines.create(Pipeline.IMAGE, PipelineSettings.defaults(), FakeDetector.alwaysHuman(),
                pacer, item -> cleaned.add(item.name()));

        try {
            assertThrows(Pacer.PacingInterruptedException.class,
                    () -> p.process("CLM-10", items("IMG_1.jpg", "IMG_2.jpg"), null));
            assertEquals(List.of("IMG_1.jpg"), cleaned);
            assertFalse(p.metrics().running.get());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void interruptedDetectorAbortsBatchWithoutFailingOpen() throws Exception {
        FakeDetector detector = new FakeDetector(name -> {
            throw new DetectorInterruptedException(name, new InterruptedException("shutdown"));
        }, 0);
        List<String> cleaned = new ArrayList<>();
        BatchProcessor p = Pipelines.create(Pipeline.IMAGE, PipelineSettings.defaults(), detector,
                Pacer.immediate(), item -> cleaned.add(item.name()));

        assertThrows(DetectorInterruptedException.class,
                () -> p.process("CLM-11", items("IMG_1.jpg", "IMG_2.jpg"), null));
        assertEquals(List.of("IMG_1.jpg"), detector.calls);
        assertEquals(List.of("IMG_1.jpg"), cleaned);
        assertEquals(0, p.metrics().unexpectedErrors.sum());
        assertFalse(p.metrics().running.get());
    }

    @Test
    void metricsTrackLayersAndShortcuts() throws Exception {
        BatchProcessor p = processor(Pipeline.VIDEO, FakeDetector.alwaysHuman());
        List<MediaItem> batch = new ArrayList<>(items("kling.mp4", "clip.mp4"));
        batch.add(MediaFiles.write(dir, "runway_free.mov", "nothing"));
        batch.add(MediaFiles.write(dir, "phone.mov", MediaFiles.IPHONE_METADATA));
        batch.add(MediaFiles.write(dir, "render.mp4", MediaFiles.RUNWAY_METADATA));

        p.process("V-3", batch, null);

        BatchMetrics m = p.metrics();
        assertEquals(5, m.itemsProcessed.sum());
        assertEquals(2, m.failedAtLayer1.sum());
        assertEquals(1, m.failedAtLayer2.sum());
        assertEquals(1, m.genuineShortcuts.sum());
        assertEquals(1, m.detectorCalls.sum());
        assertEquals(2, m.genuine.sum());
    }
}
