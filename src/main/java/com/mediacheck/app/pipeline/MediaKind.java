package com.mediacheck.app.pipeline;

import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    IMAGE,
    VIDEO;

    private static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "mp4", "mov", "m4v", "avi", "webm", "mkv", "3gp", "mpeg", "mpg"
    );

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Tudo que não for extensão de vídeo conhecida é tratado como imagem. */
    public static MediaKind fromFilename(String filename) {
        if (filename == null) return IMAGE;
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return IMAGE;
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return VIDEO_EXTENSIONS.contains(ext) ? VIDEO : IMAGE;
    }
}
