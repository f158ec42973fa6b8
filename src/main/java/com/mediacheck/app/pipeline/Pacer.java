package com.mediacheck.app.pipeline;

import java.util.Objects;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Esperas aleatórias que espaçam as chamadas ao detector externo.
 * É toda a estratégia de backpressure: sem fila, sem token bucket.
 */
public final class Pacer {

    private static final Logger logger = LoggerFactory.getLogger(Pacer.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;

        Sleeper THREAD = Thread::sleep;
    }

    /** Espera interrompida; aborta o lote inteiro. */
    public static final class PacingInterruptedException extends RuntimeException {
        PacingInterruptedException(InterruptedException cause) {
            super("Processamento interrompido durante espera", cause);
        }
    }

    private final JitteredDelay beforeDetector;
    private final JitteredDelay betweenItems;
    private final Sleeper sleeper;
    private final Random random;

    public Pacer(JitteredDelay beforeDetector, JitteredDelay betweenItems, Sleeper sleeper, Random random) {
        this.beforeDetector = Objects.requireNonNull(beforeDetector, "beforeDetector");
        this.betweenItems = Objects.requireNonNull(betweenItems, "betweenItems");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    public static Pacer immediate() {
        return new Pacer(JitteredDelay.NONE, JitteredDelay.NONE, millis -> {}, new Random(0));
    }

    public void beforeDetector() {
        pause(beforeDetector, "antes da análise profunda");
    }

    public void betweenItems() {
        pause(betweenItems, "antes do próximo arquivo");
    }

    private void pause(JitteredDelay delay, String what) {
        long ms = delay.sample(random);
        if (ms <= 0) return;
        logger.debug("Aguardando {} ms {}", ms, what);
        try {
            sleeper.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PacingInterruptedException(e);
        }
    }
}
