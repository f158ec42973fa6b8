package com.mediacheck.app.pipeline;

import java.util.Random;
import java.util.function.Consumer;

import com.mediacheck.app.detection.DeepDetector;
import com.mediacheck.app.detection.ImageMetadataAnalyzer;
import com.mediacheck.app.detection.MetadataAnalyzer;
import com.mediacheck.app.detection.NamePatternMatcher;
import com.mediacheck.app.detection.ProcessDeepDetector;
import com.mediacheck.app.detection.VideoMetadataAnalyzer;

/** Monta o {@link BatchProcessor} de cada variante com as camadas certas. */
public final class Pipelines {

    private Pipelines() {}

    public static BatchProcessor create(Pipeline pipeline, PipelineSettings settings, Consumer<MediaItem> cleanup) {
        DeepDetector detector = new ProcessDeepDetector(settings.detectorCommand(pipeline), settings.detectorTimeout());
        Pacer pacer = new Pacer(settings.preDetectorDelay(), settings.interItemDelay(), Pacer.Sleeper.THREAD, new Random());
        return create(pipeline, settings, detector, pacer, cleanup);
    }

    public static BatchProcessor create(
            Pipeline pipeline,
            PipelineSettings settings,
            DeepDetector detector,
            Pacer pacer,
            Consumer<MediaItem> cleanup
    ) {
        return new BatchProcessor(
                pipeline,
                nameMatcher(pipeline),
                metadataAnalyzer(pipeline, settings.scanBytes(pipeline)),
                detector,
                pacer,
                settings.maxItemBytes(),
                cleanup
        );
    }

    public static NamePatternMatcher nameMatcher(Pipeline pipeline) {
        return pipeline == Pipeline.VIDEO ? NamePatternMatcher.forVideos() : NamePatternMatcher.forImages();
    }

    public static MetadataAnalyzer metadataAnalyzer(Pipeline pipeline, int scanBytes) {
        return pipeline == Pipeline.VIDEO ? new VideoMetadataAnalyzer(scanBytes) : new ImageMetadataAnalyzer(scanBytes);
    }
}
