package com.example.sop_generator.model;

/** A split gateway found by walking backwards. */
public final class SplitPoint {
    private final String gatewayId;
    private final GatewayType type;

    public SplitPoint(String gatewayId, GatewayType type) {
        this.gatewayId = gatewayId;
        this.type = type;
    }

    public String getGatewayId() { return gatewayId; }
    public GatewayType getType() { return type; }
}
