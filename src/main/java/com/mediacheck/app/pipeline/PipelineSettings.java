package com.mediacheck.app.pipeline;

import java.time.Duration;
import java.util.List;

import com.mediacheck.app.detection.ImageMetadataAnalyzer;
import com.mediacheck.app.detection.VideoMetadataAnalyzer;

public record PipelineSettings(
        List<String> imageDetectorCommand,
        List<String> videoDetectorCommand,
        Duration detectorTimeout,
        JitteredDelay preDetectorDelay,
        JitteredDelay interItemDelay,
        long maxItemBytes,
        int metadataScanBytes,
        int imageMetadataScanBytes
) {

    public static final long DEFAULT_MAX_ITEM_BYTES = 50L * 1024 * 1024;

    public PipelineSettings {
        imageDetectorCommand = List.copyOf(imageDetectorCommand);
        videoDetectorCommand = List.copyOf(videoDetectorCommand);
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
                List.of("python3", "scripts/truthscan_analyzer.py"),
                List.of("python3", "scripts/truthscan_analyzer_video.py"),
                Duration.ofSeconds(90),
                new JitteredDelay(3_000, 2_000),
                new JitteredDelay(5_000, 2_000),
                DEFAULT_MAX_ITEM_BYTES,
                VideoMetadataAnalyzer.DEFAULT_SCAN_BYTES,
                ImageMetadataAnalyzer.DEFAULT_SCAN_BYTES
        );
    }

    public List<String> detectorCommand(Pipeline pipeline) {
        return pipeline == Pipeline.VIDEO ? videoDetectorCommand : imageDetectorCommand;
    }

    public int scanBytes(Pipeline pipeline) {
        return pipeline == Pipeline.VIDEO ? metadataScanBytes : imageMetadataScanBytes;
    }
}
