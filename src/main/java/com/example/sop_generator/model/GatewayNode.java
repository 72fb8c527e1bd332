package com.example.sop_generator.model;

import java.util.List;

public final class GatewayNode {
    private final String id;
    private final GatewayType type;
    private final List<String> incoming;
    private final List<String> outgoing;

    public GatewayNode(String id, GatewayType type, List<String> incoming, List<String> outgoing) {
        this.id = id;
        this.type = type;
        this.incoming = List.copyOf(incoming);
        this.outgoing = List.copyOf(outgoing);
    }

    public String getId() { return id; }
    public GatewayType getType() { return type; }
    public List<String> getIncoming() { return incoming; }
    public List<String> getOutgoing() { return outgoing; }

    /** Exactly one incoming and more than one outgoing flow. */
    public boolean isSplit() {
        return incoming.size() == 1 && outgoing.size() > 1;
    }

    public boolean isJoin() {
        return incoming.size() > 1;
    }

    /** AND/OR gateway fanning out, including join-then-split shapes. */
    public boolean isParallelFanOut() {
        return type.isParallelOrInclusive() && outgoing.size() > 1;
    }
}
