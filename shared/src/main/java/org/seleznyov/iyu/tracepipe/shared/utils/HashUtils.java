package org.seleznyov.iyu.tracepipe.shared.utils;

/**
 * 64-bit hashing for content signatures: FNV-1a over the bytes, then the
 * MurmurHash3 fmix64 finalizer for avalanche.
 */
public class HashUtils {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private HashUtils() {

    }

    public static long hash64(byte[] bytes) {
        if (bytes == null) {
            return 0L;
        }
        long hash = FNV_OFFSET_BASIS;
        for (byte b : bytes) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return fmix64(hash);
    }

    /**
     * MurmurHash3 финализация для равномерного распределения
     */
    public static long fmix64(long hash) {
        hash ^= (hash >>> 33);
        hash *= 0xff51afd7ed558ccdL;
        hash ^= (hash >>> 33);
        hash *= 0xc4ceb9fe1a85ec53L;
        hash ^= (hash >>> 33);
        return hash;
    }
}
