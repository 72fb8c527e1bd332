package com.example.sop_generator.model;

/** SLA of a task: its own value (group null) or the value of the group containing it. */
public final class SlaAssignment {
    public static final SlaAssignment NONE = new SlaAssignment(null, null);

    private final String sla;
    private final String groupId;

    public SlaAssignment(String sla, String groupId) {
        this.sla = sla;
        this.groupId = groupId;
    }

    public String getSla() { return sla; }
    public String getGroupId() { return groupId; }
}
