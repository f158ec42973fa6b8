package com.mediacheck.app.detection;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Prefixo limitado dos bytes brutos de um arquivo, mais a sua decodificação
 * permissiva como texto UTF-8 (sequências inválidas viram U+FFFD, nunca erro).
 */
public final class MetadataSample {

    private final byte[] bytes;
    private final String text;

    private MetadataSample(byte[] bytes) {
        this.bytes = bytes;
        this.text = new String(bytes, StandardCharsets.UTF_8);
    }

    public static MetadataSample of(byte[] data, int maxBytes) {
        if (data == null) return new MetadataSample(new byte[0]);
        int n = Math.min(data.length, Math.max(0, maxBytes));
        return new MetadataSample(Arrays.copyOf(data, n));
    }

    /** Lê no máximo {@code maxBytes} do início do arquivo, sem carregar o resto. */
    public static MetadataSample read(Path file, int maxBytes) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return new MetadataSample(in.readNBytes(Math.max(0, maxBytes)));
        }
    }

    public String text() {
        return text;
    }

    public boolean textContains(String s) {
        return text.contains(s);
    }

    /** Busca binária exata no prefixo, independente da decodificação. */
    public boolean bytesContain(String ascii) {
        byte[] needle = ascii.getBytes(StandardCharsets.ISO_8859_1);
        if (needle.length == 0) return true;
        outer:
        for (int i = 0; i <= bytes.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (bytes[i + j] != needle[j]) continue outer;
            }
            return true;
        }
        return false;
    }
}
