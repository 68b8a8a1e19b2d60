package com.simsci.cvd.util;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.core.source64.SplitMix64;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Counter-based random streams for one draw.
 *
 * <p>
 * Every random number of a draw is derived from a 64-bit key mixing
 * (seed, location, draw, stream, simulant id, and up to two extra counters such
 * as cause and step). Nothing depends on the order in which simulants or
 * threads consume numbers, so a draw is reproducible under any chunking and a
 * counterfactual run sees exactly the numbers of the observed run.
 */
public final class RandomKeys {

    /** Independent purposes random numbers are drawn for. */
    public enum Stream {
        PROPENSITY, CORRELATION, TRANSITION, DEMOGRAPHY, SPLIT
    }

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long base;

    public RandomKeys(long seed, String location, int draw) {
        long h = mix(seed);
        h = mix(h ^ location.hashCode());
        this.base = mix(h + GOLDEN_GAMMA * (draw + 1L));
    }

    /** 64-bit key of one random number. */
    public long key(Stream stream, long simulantId, long a, long b) {
        long h = mix(base ^ (stream.ordinal() + 1L) * GOLDEN_GAMMA);
        h = mix(h + simulantId);
        h = mix(h + a * GOLDEN_GAMMA);
        return mix(h + b);
    }

    /** Uniform in the open interval (0, 1). */
    public double uniform(Stream stream, long simulantId, long a, long b) {
        long bits = new SplitMix64(key(stream, simulantId, a, b)).nextLong();
        return ((bits >>> 11) + 0.5) * 0x1.0p-53;
    }

    /** Provider seeded from a key, for draws that need several numbers. */
    public UniformRandomProvider provider(Stream stream, long simulantId, long a) {
        return RandomSource.XO_SHI_RO_256_PP.create(key(stream, simulantId, a, 0));
    }

    // Stafford variant 13 finalizer
    static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
