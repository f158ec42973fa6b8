package com.mediacheck.app.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arquivo já materializado em disco, com o nome original declarado pelo cliente.
 * {@code path} pode ter outro nome (ex.: cópia temporária de upload).
 */
public record MediaItem(String name, long size, Path path, MediaKind kind) {

    private static final Logger logger = LoggerFactory.getLogger(MediaItem.class);

    public MediaItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        if (size < 0) throw new IllegalArgumentException("size negativo: " + size);
    }

    /** Item a partir de um arquivo local; tipo inferido pela extensão. */
    public static MediaItem ofFile(Path file) throws IOException {
        String name = file.getFileName().toString();
        return new MediaItem(name, Files.size(file), file, MediaKind.fromFilename(name));
    }

    /** Hook de limpeza para cópias temporárias: apaga o arquivo, best-effort. */
    public static void deleteOnCleanup(MediaItem item) {
        try {
            Files.deleteIfExists(item.path());
        } catch (IOException e) {
            logger.warn("Falha ao remover arquivo temporário {}", item.path(), e);
        }
    }
}
