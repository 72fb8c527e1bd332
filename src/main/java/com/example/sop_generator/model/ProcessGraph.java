package com.example.sop_generator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Immutable entity tables of one parsed BPMN document, keyed by element id.
 * All maps keep document order. A new graph is built for every document; nothing is shared.
 */
public final class ProcessGraph {

    private final Map<String, TaskNode> tasks;
    private final Map<String, GatewayNode> gateways;
    private final Map<String, FlowEdge> flows;
    private final Map<String, LaneNode> lanes;
    private final Map<String, SubprocessNode> subprocesses;
    private final Map<String, EventNode> events;
    private final Map<String, List<BoundaryEventNode>> boundaryByHost;
    private final Map<String, GroupNode> groups;
    private final Map<String, ShapeBounds> shapes;

    public ProcessGraph(Map<String, TaskNode> tasks,
                        Map<String, GatewayNode> gateways,
                        Map<String, FlowEdge> flows,
                        Map<String, LaneNode> lanes,
                        Map<String, SubprocessNode> subprocesses,
                        Map<String, EventNode> events,
                        Map<String, List<BoundaryEventNode>> boundaryByHost,
                        Map<String, GroupNode> groups,
                        Map<String, ShapeBounds> shapes) {
        this.tasks = Collections.unmodifiableMap(tasks);
        this.gateways = Collections.unmodifiableMap(gateways);
        this.flows = Collections.unmodifiableMap(flows);
        this.lanes = Collections.unmodifiableMap(lanes);
        this.subprocesses = Collections.unmodifiableMap(subprocesses);
        this.events = Collections.unmodifiableMap(events);
        this.boundaryByHost = Collections.unmodifiableMap(boundaryByHost);
        this.groups = Collections.unmodifiableMap(groups);
        this.shapes = Collections.unmodifiableMap(shapes);
    }

    /* ===================== Lookups ===================== */

    public TaskNode task(String id) { return tasks.get(id); }
    public GatewayNode gateway(String id) { return gateways.get(id); }
    public FlowEdge flow(String id) { return flows.get(id); }
    public SubprocessNode subprocess(String id) { return subprocesses.get(id); }
    public EventNode event(String id) { return events.get(id); }
    public ShapeBounds shape(String id) { return shapes.get(id); }

    public boolean isTask(String id) { return tasks.containsKey(id); }
    public boolean isGateway(String id) { return gateways.containsKey(id); }
    public boolean isSubprocess(String id) { return subprocesses.containsKey(id); }
    public boolean isEvent(String id) { return events.containsKey(id); }

    public Collection<TaskNode> getTasks() { return tasks.values(); }
    public Collection<GatewayNode> getGateways() { return gateways.values(); }
    public Collection<FlowEdge> getFlows() { return flows.values(); }
    public Collection<LaneNode> getLanes() { return lanes.values(); }
    public Collection<SubprocessNode> getSubprocesses() { return subprocesses.values(); }
    public Collection<EventNode> getEvents() { return events.values(); }
    public Collection<GroupNode> getGroups() { return groups.values(); }

    public List<BoundaryEventNode> boundaryEventsOf(String hostId) {
        return boundaryByHost.getOrDefault(hostId, List.of());
    }

    /** Numbered tasks in ascending step order; ties keep document order. */
    public List<TaskNode> numberedTasks() {
        List<TaskNode> out = new ArrayList<>();
        for (TaskNode t : tasks.values()) if (t.hasStep()) out.add(t);
        out.sort(Comparator.comparingInt(TaskNode::getStep));
        return out;
    }

    public List<EventNode> eventsOfType(EventType type) {
        List<EventNode> out = new ArrayList<>();
        for (EventNode e : events.values()) if (e.getType() == type) out.add(e);
        return out;
    }

    /* ===================== Adjacency ===================== */

    /** Outgoing flow ids of a task, gateway, subprocess or event; empty for anything else. */
    public List<String> outgoingOf(String id) {
        if (tasks.containsKey(id)) return tasks.get(id).getOutgoing();
        if (gateways.containsKey(id)) return gateways.get(id).getOutgoing();
        if (subprocesses.containsKey(id)) return subprocesses.get(id).getOutgoing();
        if (events.containsKey(id)) return events.get(id).getOutgoing();
        return List.of();
    }

    public List<String> incomingOf(String id) {
        if (tasks.containsKey(id)) return tasks.get(id).getIncoming();
        if (gateways.containsKey(id)) return gateways.get(id).getIncoming();
        if (subprocesses.containsKey(id)) return subprocesses.get(id).getIncoming();
        if (events.containsKey(id)) return events.get(id).getIncoming();
        return List.of();
    }

    /* ===================== SLA ===================== */

    /**
     * The task's own SLA wins. Otherwise the first SLA group whose bounds contain the
     * centre of the task's shape.
     */
    public SlaAssignment slaOf(String taskId) {
        TaskNode task = tasks.get(taskId);
        if (task == null) return SlaAssignment.NONE;
        if (task.getSla() != null) return new SlaAssignment(task.getSla(), null);

        ShapeBounds b = shapes.get(taskId);
        if (b == null) return SlaAssignment.NONE;
        double cx = b.centerX();
        double cy = b.centerY();
        for (GroupNode group : groups.values()) {
            ShapeBounds gb = shapes.get(group.getId());
            if (gb != null && gb.contains(cx, cy)) return new SlaAssignment(group.getSla(), group.getId());
        }
        return SlaAssignment.NONE;
    }
}
