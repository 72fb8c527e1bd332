package com.example.sop_generator.model;

/** A sequence flow. Name and documentation are empty / null when absent. */
public final class FlowEdge {
    private final String id;
    private final String sourceId;
    private final String targetId;
    private final String name;
    private final String documentation;

    public FlowEdge(String id, String sourceId, String targetId, String name, String documentation) {
        this.id = id;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.name = name == null ? "" : name;
        this.documentation = documentation;
    }

    public String getId() { return id; }
    public String getSourceId() { return sourceId; }
    public String getTargetId() { return targetId; }
    public String getName() { return name; }
    public String getDocumentation() { return documentation; }
}
