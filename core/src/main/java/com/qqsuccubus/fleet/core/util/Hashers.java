package com.qqsuccubus.fleet.core.util;

import com.google.common.hash.Hashing;

/**
 * Content digests for state payloads.
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes the SHA-256 digest of {@code data} as lowercase hex.
     *
     * @param data Input bytes, null treated as empty
     * @return 64-character hex string
     */
    public static String sha256Hex(byte[] data) {
        return Hashing.sha256().hashBytes(data == null ? new byte[0] : data).toString();
    }
}
