package com.mediacheck.app.pipeline;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class PacerTest {

    @Test
    void jitteredSamplesStayInsideWindow() {
        JitteredDelay d = new JitteredDelay(5_000, 2_000);
        Random random = new Random(42);
        for (int i = 0; i < 1_000; i++) {
            long ms = d.sample(random);
            assertTrue(ms >= 5_000 && ms < 7_000, "out of window: " + ms);
        }
        assertEquals(7_000, d.maxMillis());
    }

    @Test
    void zeroJitterIsConstant() {
        assertEquals(250, new JitteredDelay(250, 0).sample(new Random()));
        assertEquals(0, JitteredDelay.NONE.sample(new Random()));
    }

    @Test
    void negativeDelaysAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JitteredDelay(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new JitteredDelay(0, -5));
    }

    @Test
    void zeroDelayDoesNotCallSleeper() {
        List<Long> sleeps = new ArrayList<>();
        Pacer pacer = new Pacer(JitteredDelay.NONE, new JitteredDelay(100, 0), sleeps::add, new Random(0));

        pacer.beforeDetector();
        pacer.betweenItems();

        assertEquals(List.of(100L), sleeps);
    }

    @Test
    void interruptionIsRethrownAndFlagRestored() {
        Pacer pacer = new Pacer(new JitteredDelay(1, 0), JitteredDelay.NONE, ms -> {
            throw new InterruptedException();
        }, new Random(0));

        try {
            assertThrows(Pacer.PacingInterruptedException.class, pacer::beforeDetector);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
