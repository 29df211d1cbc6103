package com.questrail.busanomaly.api;

import java.util.Objects;

/**
 * Plain {@link TrafficRecord} value with an arrival timestamp in seconds.
 */
public record BusMessage(double timestamp, String identifier, String payloadBits) implements TrafficRecord
{
    public BusMessage {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(payloadBits, "payloadBits");
    }
}
