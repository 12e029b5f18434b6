package com.qqsuccubus.fleet.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NodeAddressTest {

    @Test
    void rejectsBlankHostAndBadPort() {
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.of(" ", 80));
        assertThrows(IllegalArgumentException.class, () -> NodeAddress.of("host", 70000));
    }

    @Test
    void rendersAsHostPort() {
        assertEquals("10.0.0.1:7000", NodeAddress.of("10.0.0.1", 7000).toString());
    }
}
