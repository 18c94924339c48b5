package com.cutlinesight.core.ingest;

/**
 * Small deterministic pseudo-random generator (Mulberry32).
 *
 * <p>
 * Same seed, same sequence, on every JVM: all arithmetic is 32-bit integer
 * math with wraparound. Not suitable for anything security related.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeededRandom {

    private static final int INCREMENT = 0x6D2B79F5;
    private static final double TWO_POW_32 = 4294967296.0;

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 16777619;

    private int state;

    public SeededRandom(int seed) {
        this.state = seed;
    }

    /**
     * @param seed any string; hashed with {@link #hash(String)}
     * @return a generator seeded from the string
     */
    public static SeededRandom fromString(String seed) {
        return new SeededRandom(hash(seed));
    }

    /**
     * 32-bit FNV-1a over the UTF-16 code units of {@code s}. Order-dependent:
     * {@code "ab"} and {@code "ba"} hash differently.
     *
     * @param s the seed string; must not be {@code null}
     * @return the hash as a signed int (bit pattern of the unsigned value)
     */
    public static int hash(String s) {
        int h = FNV_OFFSET_BASIS;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= FNV_PRIME;
        }
        return h;
    }

    /**
     * @return the next uniform value in {@code [0, 1)}
     */
    public double nextDouble() {
        state += INCREMENT;
        int x = state;
        x = (x ^ (x >>> 15)) * (x | 1);
        x ^= x + (x ^ (x >>> 7)) * (x | 61);
        return Integer.toUnsignedLong(x ^ (x >>> 14)) / TWO_POW_32;
    }
}
