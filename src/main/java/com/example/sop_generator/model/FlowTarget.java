package com.example.sop_generator.model;

/**
 * One resolved successor of a node: the kind of element an outgoing flow reaches and the
 * value that matters for it (step number, node id or end-event name) plus the flow's label.
 */
public final class FlowTarget {
    private final TargetKind kind;
    private final String nodeId;
    private final Integer step;
    private final String endName;
    private final String flowId;
    private final String flowName;

    private FlowTarget(TargetKind kind, String nodeId, Integer step, String endName, String flowId, String flowName) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.step = step;
        this.endName = endName;
        this.flowId = flowId;
        this.flowName = flowName == null ? "" : flowName;
    }

    public static FlowTarget task(String nodeId, int step, FlowEdge via) {
        return new FlowTarget(TargetKind.TASK, nodeId, step, null, via.getId(), via.getName());
    }

    public static FlowTarget node(TargetKind kind, String nodeId, FlowEdge via) {
        return new FlowTarget(kind, nodeId, null, null, via.getId(), via.getName());
    }

    public static FlowTarget end(String nodeId, String endName, FlowEdge via) {
        return new FlowTarget(TargetKind.END, nodeId, null, endName, via.getId(), via.getName());
    }

    public TargetKind getKind() { return kind; }
    public String getNodeId() { return nodeId; }
    /** Step number; only set for {@link TargetKind#TASK}. */
    public Integer getStep() { return step; }
    /** End-event display name; only set for {@link TargetKind#END}. */
    public String getEndName() { return endName; }
    public String getFlowId() { return flowId; }
    public String getFlowName() { return flowName; }

    public boolean is(TargetKind k) {
        return kind == k;
    }
}
