package com.mediacheck.app.pipeline;

import java.util.Random;

/** Atraso base mais jitter uniforme em {@code [0, jitterMillis)}. */
public record JitteredDelay(long baseMillis, long jitterMillis) {

    public static final JitteredDelay NONE = new JitteredDelay(0, 0);

    public JitteredDelay {
        if (baseMillis < 0 || jitterMillis < 0) {
            throw new IllegalArgumentException("atrasos não podem ser negativos");
        }
    }

    public long sample(Random random) {
        if (jitterMillis == 0) return baseMillis;
        return baseMillis + (long) (random.nextDouble() * jitterMillis);
    }

    public long maxMillis() {
        return baseMillis + jitterMillis;
    }
}
