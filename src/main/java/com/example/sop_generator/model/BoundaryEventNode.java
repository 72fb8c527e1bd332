package com.example.sop_generator.model;

import java.util.List;

public final class BoundaryEventNode {
    private final String id;
    private final String name;
    private final String attachedTo;
    private final boolean interrupting;
    private final BoundaryKind kind;
    private final List<String> outgoing;

    public BoundaryEventNode(String id, String name, String attachedTo, boolean interrupting,
                             BoundaryKind kind, List<String> outgoing) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.attachedTo = attachedTo;
        this.interrupting = interrupting;
        this.kind = kind;
        this.outgoing = List.copyOf(outgoing);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getAttachedTo() { return attachedTo; }
    public boolean isInterrupting() { return interrupting; }
    public BoundaryKind getKind() { return kind; }
    public List<String> getOutgoing() { return outgoing; }
}
