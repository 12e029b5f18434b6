package com.qqsuccubus.fleet.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Host and port a node is reachable at.
 */
@Value
public class NodeAddress {
    @JsonProperty("host")
    String host;

    @JsonProperty("port")
    int port;

    @JsonCreator
    public NodeAddress(
        @JsonProperty("host") String host,
        @JsonProperty("port") int port
    ) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.host = host;
        this.port = port;
    }

    public static NodeAddress of(String host, int port) {
        return new NodeAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
