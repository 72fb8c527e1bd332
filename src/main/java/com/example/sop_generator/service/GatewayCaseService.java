package com.example.sop_generator.service;

import com.example.sop_generator.dto.Paragraph;
import com.example.sop_generator.dto.Raci;
import com.example.sop_generator.dto.StepRecord;
import com.example.sop_generator.model.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.example.sop_generator.service.RoutingText.*;

/**
 * Turns the branches of an exclusive gateway into lettered case rows ("12A", "12B", ...).
 * <p>
 * Cases are ordered end destinations first, then reverts (farthest back first),
 * then proceeds (farthest forward first).
 */
@Service
public class GatewayCaseService {

    static final String UNLABELED = "[CONDITION UNLABELED]";
    static final String END_LABEL = "Complete";
    static final String SUBPROCESS_LABEL = "Proceed";
    static final String DEFAULT_EVENT_NAME = "Event";

    private static final int LATE_PROCEED = 5000;

    @Autowired
    private TraversalService traversal;

    /* ===================== Public API ===================== */

    public List<StepRecord> resolveCases(ProcessGraph g, int parentStep, String gatewayId, Raci parentRaci) {
        if (g.gateway(gatewayId) == null) return List.of();
        List<FlowTarget> targets = traversal.targetsOf(g, gatewayId);

        List<GatewayCase> cases = new ArrayList<>();
        for (FlowTarget t : targets) {
            String doc = flowDocumentation(g, t);
            if (t.is(TargetKind.TASK)) {
                cases.add(taskCase(labelOf(t, UNLABELED), doc, t.getStep(), isRevert(t.getStep(), parentStep), null));
            } else if (t.is(TargetKind.END)) {
                cases.add(endCase(labelOf(t, END_LABEL), doc, t.getEndName(), null));
            } else if (t.is(TargetKind.SUBPROCESS)) {
                cases.add(subprocessCase(g, labelOf(t, SUBPROCESS_LABEL), doc, t.getNodeId(), parentStep, null));
            } else if (t.is(TargetKind.GATEWAY)) {
                addNestedGatewayCases(g, t, doc, parentStep, cases);
            } else if (t.is(TargetKind.INTERMEDIATE)) {
                addEventCase(g, t, doc, parentStep, cases);
            }
        }

        // List.sort is stable, so equal keys keep flow order
        cases.sort(Comparator.comparingInt((GatewayCase c) -> c.orderGroup).thenComparingInt(c -> c.orderValue));

        List<StepRecord> rows = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            GatewayCase c = cases.get(i);
            char letter = (char) ('A' + i);
            List<Paragraph> paragraphs = List.of(
                    Paragraph.heading("Case " + letter + ": " + c.label),
                    Paragraph.blank(),
                    Paragraph.body(c.documentation != null ? c.documentation : "[Condition explanation for " + c.label + "]"),
                    Paragraph.blank(),
                    Paragraph.heading(routing(g, c, parentStep)));
            rows.add(new StepRecord(parentStep + String.valueOf(letter), true, null, null, parentRaci, paragraphs));
        }
        return rows;
    }

    /* ===================== Destinations ===================== */

    /** AND/OR fan-out behind the gateway gives one parallel case; anything else one case per task or end. */
    private void addNestedGatewayCases(ProcessGraph g, FlowTarget t, String doc, int parentStep, List<GatewayCase> cases) {
        GatewayNode nested = g.gateway(t.getNodeId());
        List<FlowTarget> nestedTargets = traversal.targetsOf(g, t.getNodeId());

        if (nested != null && nested.isParallelFanOut()) {
            List<Integer> steps = taskSteps(nestedTargets);
            if (!steps.isEmpty()) {
                cases.add(parallelCase(labelOf(t, UNLABELED), doc, steps, nested.getType(), steps.get(0) < parentStep, null));
            }
            return;
        }
        for (FlowTarget nt : nestedTargets) {
            if (nt.is(TargetKind.TASK)) {
                cases.add(taskCase(labelOf(t, UNLABELED), doc, nt.getStep(), nt.getStep() < parentStep, null));
            } else if (nt.is(TargetKind.END)) {
                cases.add(endCase(labelOf(t, END_LABEL), doc, nt.getEndName(), null));
            }
        }
    }

    /** Branch into an intermediate event, resolved through the event's first successor. */
    private void addEventCase(ProcessGraph g, FlowTarget t, String doc, int parentStep, List<GatewayCase> cases) {
        EventNode ev = g.event(t.getNodeId());
        String eventName = ev.hasName() ? ev.getName() : DEFAULT_EVENT_NAME;
        FlowTarget next = first(traversal.targetsOf(g, ev.getId()));
        if (next == null) return;

        if (next.is(TargetKind.TASK)) {
            cases.add(taskCase(labelOf(t, UNLABELED), doc, next.getStep(), isRevert(next.getStep(), parentStep), eventName));
        } else if (next.is(TargetKind.END)) {
            cases.add(endCase(labelOf(t, END_LABEL), doc, next.getEndName(), eventName));
        } else if (next.is(TargetKind.SUBPROCESS)) {
            cases.add(subprocessCase(g, labelOf(t, SUBPROCESS_LABEL), doc, next.getNodeId(), parentStep, eventName));
        } else if (next.is(TargetKind.GATEWAY)) {
            GatewayNode gw = g.gateway(next.getNodeId());
            List<FlowTarget> gwTargets = traversal.targetsOf(g, next.getNodeId());
            if (gw != null && gw.isParallelFanOut()) {
                List<Integer> steps = taskSteps(gwTargets);
                if (!steps.isEmpty()) {
                    cases.add(parallelCase(labelOf(t, UNLABELED), doc, steps, gw.getType(), steps.get(0) < parentStep, eventName));
                }
                return;
            }
            for (FlowTarget gt : gwTargets) {
                if (gt.is(TargetKind.TASK)) {
                    cases.add(taskCase(labelOf(t, UNLABELED), doc, gt.getStep(), gt.getStep() < parentStep, eventName));
                    return;
                }
                if (gt.is(TargetKind.END)) {
                    cases.add(endCase(labelOf(t, END_LABEL), doc, gt.getEndName(), eventName));
                    return;
                }
            }
        }
    }

    private GatewayCase taskCase(String label, String doc, int step, boolean revert, String eventName) {
        GatewayCase c = new GatewayCase(eventName == null ? CaseKind.TASK : CaseKind.EVENT_TASK, label, doc, eventName);
        c.targetStep = step;
        c.revert = revert;
        c.order(revert ? 0 : 1, revert ? step : -step);
        return c;
    }

    private GatewayCase endCase(String label, String doc, String endName, String eventName) {
        GatewayCase c = new GatewayCase(eventName == null ? CaseKind.END : CaseKind.EVENT_END, label, doc, eventName);
        c.endName = endName;
        c.order(-1, 0);
        return c;
    }

    private GatewayCase parallelCase(String label, String doc, List<Integer> steps, GatewayType type,
                                     boolean revert, String eventName) {
        GatewayCase c = new GatewayCase(eventName == null ? CaseKind.PARALLEL : CaseKind.EVENT_PARALLEL, label, doc, eventName);
        c.parallelSteps = steps;
        c.parallelType = type;
        c.revert = revert;
        int firstStep = steps.get(0);
        c.order(revert ? 0 : 1, revert ? firstStep : -firstStep);
        return c;
    }

    /**
     * Subprocess branches sort late among proceeds, unless the subprocess ends the process
     * or loops back, in which case they sort with ends / reverts.
     */
    private GatewayCase subprocessCase(ProcessGraph g, String label, String doc, String subprocessId,
                                       int parentStep, String eventName) {
        GatewayCase c = new GatewayCase(eventName == null ? CaseKind.SUBPROCESS : CaseKind.EVENT_SUBPROCESS, label, doc, eventName);
        c.subprocessId = subprocessId;
        FlowTarget after = first(traversal.targetsOf(g, subprocessId));
        if (after != null && after.is(TargetKind.END)) {
            c.order(-1, 0);
        } else if (after != null && after.is(TargetKind.TASK) && isRevert(after.getStep(), parentStep)) {
            c.order(0, after.getStep());
        } else {
            c.order(1, LATE_PROCEED);
        }
        return c;
    }

    /* ===================== Routing text ===================== */

    private String routing(ProcessGraph g, GatewayCase c, int parentStep) {
        switch (c.kind) {
            case TASK:
                return (c.revert ? "Revert to" : "Proceed to") + " Step " + c.targetStep;
            case END:
                return processEnds(c.endName);
            case PARALLEL:
                return (c.revert ? "Revert to" : "Proceed to") + " Step " + steps(c.parallelSteps, c.parallelType.stepConnector());
            case SUBPROCESS:
                return subprocessRouting(g, c.subprocessId, parentStep);
            case EVENT_TASK:
                return "Wait until " + c.eventName + " Then " + (c.revert ? "Revert to" : "Proceed to") + " Step " + c.targetStep;
            case EVENT_END:
                return "Wait until " + c.eventName + ", then " + processEnds(c.endName);
            case EVENT_PARALLEL:
                return "Wait until " + c.eventName + " Then " + (c.revert ? "Revert to" : "Proceed to")
                        + " Step " + steps(c.parallelSteps, c.parallelType.stepConnector());
            case EVENT_SUBPROCESS:
                return eventSubprocessRouting(g, c.eventName, c.subprocessId, parentStep);
            default:
                throw new IllegalStateException("Unhandled case kind " + c.kind);
        }
    }

    private String subprocessRouting(ProcessGraph g, String subprocessId, int parentStep) {
        String start = "Start " + g.subprocess(subprocessId).getName() + " Process";
        FlowTarget after = first(traversal.targetsOf(g, subprocessId));
        if (after == null) return start;

        if (after.is(TargetKind.TASK)) {
            return start + ", then " + verb(after.getStep(), parentStep) + " to Step " + after.getStep();
        }
        if (after.is(TargetKind.END)) {
            return start + ", then " + processEnds(after.getEndName());
        }
        if (after.is(TargetKind.GATEWAY)) {
            GatewayNode gw = g.gateway(after.getNodeId());
            if (gw != null && gw.isParallelFanOut()) {
                List<Integer> stepList = taskSteps(traversal.targetsOf(g, gw.getId()));
                if (!stepList.isEmpty()) {
                    return start + ", then " + verb(stepList.get(0), parentStep) + " to Step "
                            + steps(stepList, gw.getType().stepConnector());
                }
            }
        }
        return start;
    }

    private String eventSubprocessRouting(ProcessGraph g, String eventName, String subprocessId, int parentStep) {
        SubprocessNode sp = g.subprocess(subprocessId);
        String lead = "Wait until " + eventName + " Then Start " + sp.getName() + sp.processSuffix();
        FlowTarget after = first(traversal.targetsOf(g, subprocessId));
        if (after != null && after.is(TargetKind.TASK)) {
            return lead + ", then " + verb(after.getStep(), parentStep) + " to Step " + after.getStep();
        }
        if (after != null && after.is(TargetKind.END)) {
            return lead + ", then " + processEnds(after.getEndName());
        }
        return lead;
    }

    /* ===================== Helpers ===================== */

    private static String labelOf(FlowTarget t, String fallback) {
        return t.getFlowName().isEmpty() ? fallback : t.getFlowName();
    }

    private static String flowDocumentation(ProcessGraph g, FlowTarget t) {
        FlowEdge flow = g.flow(t.getFlowId());
        return flow == null ? null : flow.getDocumentation();
    }

    private enum CaseKind {
        TASK, END, SUBPROCESS, PARALLEL,
        EVENT_TASK, EVENT_END, EVENT_SUBPROCESS, EVENT_PARALLEL
    }

    private static final class GatewayCase {
        final CaseKind kind;
        final String label;
        final String documentation;
        final String eventName;
        int orderGroup;
        int orderValue;
        int targetStep;
        boolean revert;
        String endName;
        String subprocessId;
        List<Integer> parallelSteps;
        GatewayType parallelType;

        GatewayCase(CaseKind kind, String label, String documentation, String eventName) {
            this.kind = kind;
            this.label = label;
            this.documentation = documentation;
            this.eventName = eventName;
        }

        void order(int group, int value) {
            this.orderGroup = group;
            this.orderValue = value;
        }
    }
}
