package com.intteq.reliable.message.broker.inspection;

/**
 * Which directions of traffic are logged.
 */
public enum InspectTraffic {
    NONE,
    INBOUND,
    OUTBOUND,
    ALL;

    public boolean includesInbound() {
        return this == INBOUND || this == ALL;
    }

    public boolean includesOutbound() {
        return this == OUTBOUND || this == ALL;
    }
}
