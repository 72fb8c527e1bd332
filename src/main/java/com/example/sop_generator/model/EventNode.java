package com.example.sop_generator.model;

import java.util.List;

public final class EventNode {
    private final String id;
    private final String name;
    private final EventType type;
    private final List<String> incoming;
    private final List<String> outgoing;

    public EventNode(String id, String name, EventType type, List<String> incoming, List<String> outgoing) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.type = type;
        this.incoming = List.copyOf(incoming);
        this.outgoing = List.copyOf(outgoing);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public EventType getType() { return type; }
    public List<String> getIncoming() { return incoming; }
    public List<String> getOutgoing() { return outgoing; }

    public boolean hasName() {
        return !name.isEmpty();
    }
}
