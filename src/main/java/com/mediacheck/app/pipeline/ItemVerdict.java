package com.mediacheck.app.pipeline;

import java.util.List;
import java.util.Objects;

import com.mediacheck.app.detection.LayerOutcome;

/**
 * Veredito final de um item. {@code failedAtLayer} é preenchido se e somente
 * se a autenticidade for {@link Authenticity#AI_GENERATED}; {@code layers}
 * contém só as camadas de fato executadas, em ordem.
 */
public record ItemVerdict(
        String name,
        long size,
        MediaKind kind,
        Authenticity authenticity,
        Integer failedAtLayer,
        List<LayerOutcome> layers,
        VerdictDetails details
) {

    public ItemVerdict {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(authenticity, "authenticity");
        layers = layers == null ? List.of() : List.copyOf(layers);
        if ((authenticity == Authenticity.AI_GENERATED) != (failedAtLayer != null)) {
            throw new IllegalArgumentException("failedAtLayer deve existir apenas para AI Generated");
        }
    }

    public boolean aiGenerated() {
        return authenticity == Authenticity.AI_GENERATED;
    }

    public String finalStatus() {
        return authenticity.finalStatus();
    }
}
