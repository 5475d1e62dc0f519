package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NetworkCounters(
        @JsonProperty("bytes_sent") long bytesSent,
        @JsonProperty("bytes_recv") long bytesReceived,
        @JsonProperty("packets_sent") long packetsSent,
        @JsonProperty("packets_recv") long packetsReceived,
        @JsonProperty("errin") long errorsIn,
        @JsonProperty("errout") long errorsOut,
        @JsonProperty("dropin") long dropsIn,
        @JsonProperty("dropout") long dropsOut
) {
    public NetworkCounters plus(NetworkCounters other) {
        return new NetworkCounters(
                bytesSent + other.bytesSent,
                bytesReceived + other.bytesReceived,
                packetsSent + other.packetsSent,
                packetsReceived + other.packetsReceived,
                errorsIn + other.errorsIn,
                errorsOut + other.errorsOut,
                dropsIn + other.dropsIn,
                dropsOut + other.dropsOut
        );
    }

    public static NetworkCounters zero() {
        return new NetworkCounters(0, 0, 0, 0, 0, 0, 0, 0);
    }
}
