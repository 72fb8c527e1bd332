package com.example.sop_generator.service;

import com.example.sop_generator.model.*;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Forward and backward walks over a {@link ProcessGraph}.
 * Every walk owns its visited set, so cycles end the branch with "no result".
 */
@Service
public class TraversalService {

    /** Step key used to order start events that never reach a numbered task. */
    static final int UNREACHED_STEP = 9999;
    static final String DEFAULT_END_NAME = "Process Complete";

    /* ===================== Forward ===================== */

    /**
     * Resolved successors of a task, gateway, subprocess or event, in outgoing-flow order.
     * Unnumbered tasks, start events and unknown targets are left out.
     */
    public List<FlowTarget> targetsOf(ProcessGraph g, String nodeId) {
        List<FlowTarget> out = new ArrayList<>();
        for (String flowId : g.outgoingOf(nodeId)) {
            FlowEdge flow = g.flow(flowId);
            if (flow == null) continue;
            String target = flow.getTargetId();

            if (g.isTask(target)) {
                TaskNode t = g.task(target);
                if (t.hasStep()) out.add(FlowTarget.task(target, t.getStep(), flow));
            } else if (g.isGateway(target)) {
                out.add(FlowTarget.node(TargetKind.GATEWAY, target, flow));
            } else if (g.isSubprocess(target)) {
                out.add(FlowTarget.node(TargetKind.SUBPROCESS, target, flow));
            } else if (g.isEvent(target)) {
                EventNode ev = g.event(target);
                if (ev.getType() == EventType.END) {
                    out.add(FlowTarget.end(target, ev.hasName() ? ev.getName() : DEFAULT_END_NAME, flow));
                } else if (ev.getType() == EventType.INTERMEDIATE) {
                    out.add(FlowTarget.node(TargetKind.INTERMEDIATE, target, flow));
                }
            }
        }
        return out;
    }

    /**
     * Step number of the first numbered task reached from {@code nodeId}, walking forward
     * through gateways and events only.
     */
    public Optional<Integer> nearestTaskForward(ProcessGraph g, String nodeId) {
        return Optional.ofNullable(nearestTaskForward(g, nodeId, new HashSet<>()));
    }

    private Integer nearestTaskForward(ProcessGraph g, String nodeId, Set<String> visited) {
        if (!visited.add(nodeId)) return null;
        if (!g.isEvent(nodeId) && !g.isGateway(nodeId)) return null;

        for (String flowId : g.outgoingOf(nodeId)) {
            FlowEdge flow = g.flow(flowId);
            if (flow == null) continue;
            String target = flow.getTargetId();
            if (g.isTask(target)) {
                TaskNode t = g.task(target);
                if (t.hasStep()) return t.getStep();
            } else if (g.isGateway(target) || g.isEvent(target)) {
                Integer found = nearestTaskForward(g, target, visited);
                if (found != null) return found;
            }
        }
        return null;
    }

    /**
     * Input number of every start event: events are ordered by the step they first reach
     * (document order on ties) and numbered from 1.
     */
    public Map<String, Integer> startEventNumbers(ProcessGraph g) {
        List<EventNode> starts = g.eventsOfType(EventType.START);
        Map<String, Integer> reach = new HashMap<>();
        for (EventNode s : starts) reach.put(s.getId(), nearestTaskForward(g, s.getId()).orElse(UNREACHED_STEP));

        List<EventNode> ordered = new ArrayList<>(starts);
        ordered.sort(Comparator.comparingInt(s -> reach.get(s.getId())));

        Map<String, Integer> numbers = new LinkedHashMap<>();
        int n = 1;
        for (EventNode s : ordered) numbers.put(s.getId(), n++);
        return numbers;
    }

    /* ===================== Backward ===================== */

    /**
     * Walks back along single-incoming tasks and gateways until a split gateway
     * (one incoming, several outgoing) is met. Joins, dead ends and other node kinds give empty.
     */
    public Optional<SplitPoint> traceBackToSplit(ProcessGraph g, String nodeId) {
        return Optional.ofNullable(traceBackToSplit(g, nodeId, new HashSet<>()));
    }

    private SplitPoint traceBackToSplit(ProcessGraph g, String nodeId, Set<String> visited) {
        if (!visited.add(nodeId)) return null;

        List<String> incoming;
        if (g.isGateway(nodeId)) {
            GatewayNode gw = g.gateway(nodeId);
            if (gw.isSplit()) return new SplitPoint(gw.getId(), gw.getType());
            incoming = gw.getIncoming();
        } else if (g.isTask(nodeId)) {
            incoming = g.task(nodeId).getIncoming();
        } else {
            return null;
        }

        if (incoming.size() != 1) return null;
        FlowEdge flow = g.flow(incoming.get(0));
        if (flow == null) return null;
        return traceBackToSplit(g, flow.getSourceId(), visited);
    }

    /** First numbered task feeding a gateway, looking through upstream gateways. */
    public Optional<Integer> traceGatewayToTask(ProcessGraph g, String gatewayId) {
        return Optional.ofNullable(traceGatewayToTask(g, gatewayId, new HashSet<>()));
    }

    private Integer traceGatewayToTask(ProcessGraph g, String gatewayId, Set<String> visited) {
        if (!visited.add(gatewayId)) return null;
        GatewayNode gw = g.gateway(gatewayId);
        if (gw == null) return null;

        for (String flowId : gw.getIncoming()) {
            FlowEdge flow = g.flow(flowId);
            if (flow == null) continue;
            String source = flow.getSourceId();
            if (g.isTask(source)) {
                TaskNode t = g.task(source);
                if (t.hasStep()) return t.getStep();
            } else if (g.isGateway(source)) {
                Integer found = traceGatewayToTask(g, source, visited);
                if (found != null) return found;
            }
        }
        return null;
    }

    /**
     * Earlier steps and start-event inputs that lead into a task, walking back through gateways,
     * intermediate events and subprocesses. Steps numbered at or above {@code currentStep}
     * are loop-backs and are not collected. Each incoming flow is traced with a fresh visited set.
     */
    public UpstreamSources upstreamSources(ProcessGraph g, String taskId, int currentStep) {
        UpstreamSources acc = new UpstreamSources();
        TaskNode task = g.task(taskId);
        if (task == null) return acc;

        Map<String, Integer> inputs = startEventNumbers(g);
        for (String flowId : task.getIncoming()) {
            FlowEdge flow = g.flow(flowId);
            if (flow == null) continue;
            traceUpstream(g, flow.getSourceId(), currentStep, inputs, new HashSet<>(), acc);
        }
        return acc;
    }

    private void traceUpstream(ProcessGraph g, String nodeId, int currentStep, Map<String, Integer> inputs,
                               Set<String> visited, UpstreamSources acc) {
        if (!visited.add(nodeId)) return;

        if (g.isTask(nodeId)) {
            TaskNode t = g.task(nodeId);
            if (t.hasStep() && t.getStep() < currentStep) acc.steps.add(t.getStep());
            return;
        }
        if (g.isEvent(nodeId) && g.event(nodeId).getType() == EventType.START) {
            Integer input = inputs.get(nodeId);
            if (input != null) acc.inputs.add(input);
            return;
        }
        if (g.isEvent(nodeId) || g.isGateway(nodeId) || g.isSubprocess(nodeId)) {
            for (String flowId : g.incomingOf(nodeId)) {
                FlowEdge flow = g.flow(flowId);
                if (flow != null) traceUpstream(g, flow.getSourceId(), currentStep, inputs, visited, acc);
            }
        }
    }

    /** Result of {@link #upstreamSources}: sorted step numbers and sorted input numbers. */
    public static final class UpstreamSources {
        private final SortedSet<Integer> steps = new TreeSet<>();
        private final SortedSet<Integer> inputs = new TreeSet<>();

        public SortedSet<Integer> getSteps() { return steps; }
        public SortedSet<Integer> getInputs() { return inputs; }
    }
}
