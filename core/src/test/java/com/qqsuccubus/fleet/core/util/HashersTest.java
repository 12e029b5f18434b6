package com.qqsuccubus.fleet.core.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HashersTest {

    @Test
    void sha256Hex_matchesKnownDigest() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            Hashers.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void nullInput_hashesAsEmpty() {
        assertEquals(Hashers.sha256Hex(new byte[0]), Hashers.sha256Hex(null));
    }
}
