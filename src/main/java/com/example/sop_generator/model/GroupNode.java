package com.example.sop_generator.model;

/** A BPMN group carrying an SLA; its members are found by shape containment. */
public final class GroupNode {
    private final String id;
    private final String sla;

    public GroupNode(String id, String sla) {
        this.id = id;
        this.sla = sla;
    }

    public String getId() { return id; }
    public String getSla() { return sla; }
}
