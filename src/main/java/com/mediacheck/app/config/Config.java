package com.mediacheck.app.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mediacheck.app.pipeline.JitteredDelay;
import com.mediacheck.app.pipeline.PipelineSettings;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração central do MediaCheck.
 * Ordem de resolução: system property (testes/CI), variável de ambiente, arquivo .env.
 */
public final class Config {

    // Variáveis de ambiente
    static final String ENV_IMAGE_DETECTOR_CMD = "MEDIACHECK_IMAGE_DETECTOR_CMD";
    static final String ENV_VIDEO_DETECTOR_CMD = "MEDIACHECK_VIDEO_DETECTOR_CMD";
    static final String ENV_DETECTOR_TIMEOUT = "MEDIACHECK_DETECTOR_TIMEOUT_SECONDS";
    static final String ENV_PRE_DETECTOR_DELAY = "MEDIACHECK_PRE_DETECTOR_DELAY_MS";
    static final String ENV_PRE_DETECTOR_JITTER = "MEDIACHECK_PRE_DETECTOR_JITTER_MS";
    static final String ENV_INTER_ITEM_DELAY = "MEDIACHECK_INTER_ITEM_DELAY_MS";
    static final String ENV_INTER_ITEM_JITTER = "MEDIACHECK_INTER_ITEM_JITTER_MS";
    static final String ENV_MAX_ITEM_BYTES = "MEDIACHECK_MAX_ITEM_BYTES";
    static final String ENV_METADATA_SCAN_BYTES = "MEDIACHECK_METADATA_SCAN_BYTES";
    static final String ENV_IMAGE_METADATA_SCAN_BYTES = "MEDIACHECK_IMAGE_METADATA_SCAN_BYTES";

    // System property overrides (useful for tests/CI)
    static final String PROP_IMAGE_DETECTOR_CMD = "mediacheck.imageDetectorCmd";
    static final String PROP_VIDEO_DETECTOR_CMD = "mediacheck.videoDetectorCmd";
    static final String PROP_DETECTOR_TIMEOUT = "mediacheck.detectorTimeoutSeconds";
    static final String PROP_PRE_DETECTOR_DELAY = "mediacheck.preDetectorDelayMs";
    static final String PROP_PRE_DETECTOR_JITTER = "mediacheck.preDetectorJitterMs";
    static final String PROP_INTER_ITEM_DELAY = "mediacheck.interItemDelayMs";
    static final String PROP_INTER_ITEM_JITTER = "mediacheck.interItemJitterMs";
    static final String PROP_MAX_ITEM_BYTES = "mediacheck.maxItemBytes";
    static final String PROP_METADATA_SCAN_BYTES = "mediacheck.metadataScanBytes";
    static final String PROP_IMAGE_METADATA_SCAN_BYTES = "mediacheck.imageMetadataScanBytes";

    private static final long MAX_DELAY_MS = 60_000;

    // Logger must be initialized before any static initializer that may use it
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    // Construtor privado para impedir instanciação (Utility Class)
    private Config() {}

    /**
     * Settings do pipeline resolvidos do ambiente; o que faltar vem de
     * {@link PipelineSettings#defaults()}.
     */
    public static PipelineSettings loadPipelineSettings() {
        PipelineSettings d = PipelineSettings.defaults();

        long timeout = clamp(getLong(ENV_DETECTOR_TIMEOUT, d.detectorTimeout().toSeconds()), 1, 600);

        JitteredDelay pre = new JitteredDelay(
                clamp(getLong(ENV_PRE_DETECTOR_DELAY, d.preDetectorDelay().baseMillis()), 0, MAX_DELAY_MS),
                clamp(getLong(ENV_PRE_DETECTOR_JITTER, d.preDetectorDelay().jitterMillis()), 0, MAX_DELAY_MS)
        );
        JitteredDelay between = new JitteredDelay(
                clamp(getLong(ENV_INTER_ITEM_DELAY, d.interItemDelay().baseMillis()), 0, MAX_DELAY_MS),
                clamp(getLong(ENV_INTER_ITEM_JITTER, d.interItemDelay().jitterMillis()), 0, MAX_DELAY_MS)
        );

        return new PipelineSettings(
                getCommand(ENV_IMAGE_DETECTOR_CMD, d.imageDetectorCommand()),
                getCommand(ENV_VIDEO_DETECTOR_CMD, d.videoDetectorCommand()),
                Duration.ofSeconds(timeout),
                pre,
                between,
                clamp(getLong(ENV_MAX_ITEM_BYTES, d.maxItemBytes()), 1, Long.MAX_VALUE),
                (int) clamp(getLong(ENV_METADATA_SCAN_BYTES, d.metadataScanBytes()), 1_024, 16L * 1024 * 1024),
                (int) clamp(getLong(ENV_IMAGE_METADATA_SCAN_BYTES, d.imageMetadataScanBytes()), 1_024, 64L * 1024 * 1024)
        );
    }

    // --- Lógica de Resolução ---

    /** Comando separado por espaços; o caminho do arquivo é anexado depois. */
    static List<String> getCommand(String key, List<String> fallback) {
        String raw = getEnvOrDotenv(key);
        if (raw == null) return fallback;
        return Arrays.stream(raw.trim().split("\\s+")).filter(s -> !s.isEmpty()).toList();
    }

    static long getLong(String key, long fallback) {
        String raw = getEnvOrDotenv(key);
        if (raw == null) return fallback;
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            logger.warn("Valor inválido para {}: '{}'. Usando padrão {}", key, raw, fallback);
            return fallback;
        }
    }

    private static long clamp(long v, long min, long max) {
        return Math.max(min, Math.min(max, v));
    }

    /**
     * Tenta obter o valor de uma variável de ambiente.
     * Se não existir, tenta ler do arquivo .env local via dotenv-java.
     */
    static String getEnvOrDotenv(String key) {
        // 0. System properties override (tests/CI)
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        // 1. Tenta Variável de Ambiente do SO
        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        // 2. Tenta ler do arquivo .env
        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_IMAGE_DETECTOR_CMD -> PROP_IMAGE_DETECTOR_CMD;
            case ENV_VIDEO_DETECTOR_CMD -> PROP_VIDEO_DETECTOR_CMD;
            case ENV_DETECTOR_TIMEOUT -> PROP_DETECTOR_TIMEOUT;
            case ENV_PRE_DETECTOR_DELAY -> PROP_PRE_DETECTOR_DELAY;
            case ENV_PRE_DETECTOR_JITTER -> PROP_PRE_DETECTOR_JITTER;
            case ENV_INTER_ITEM_DELAY -> PROP_INTER_ITEM_DELAY;
            case ENV_INTER_ITEM_JITTER -> PROP_INTER_ITEM_JITTER;
            case ENV_MAX_ITEM_BYTES -> PROP_MAX_ITEM_BYTES;
            case ENV_METADATA_SCAN_BYTES -> PROP_METADATA_SCAN_BYTES;
            case ENV_IMAGE_METADATA_SCAN_BYTES -> PROP_IMAGE_METADATA_SCAN_BYTES;
            default -> null;
        };
    }
}
