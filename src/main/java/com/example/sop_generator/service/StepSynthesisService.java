package com.example.sop_generator.service;

import com.example.sop_generator.dto.Paragraph;
import com.example.sop_generator.dto.StepRecord;
import com.example.sop_generator.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.example.sop_generator.service.RoutingText.*;

/**
 * Builds the SOP step rows: one row per numbered task in ascending step order, followed by
 * the case rows of any exclusive gateway the task leads into.
 */
@Service
public class StepSynthesisService {

    private static final Logger log = LoggerFactory.getLogger(StepSynthesisService.class);

    @Autowired
    private TraversalService traversal;

    @Autowired
    private GatewayCaseService gatewayCases;

    public List<StepRecord> synthesize(ProcessGraph g) {
        List<StepRecord> rows = new ArrayList<>();
        for (TaskNode task : g.numberedTasks()) {
            int step = task.getStep();
            List<FlowTarget> targets = traversal.targetsOf(g, task.getId());

            StepRecord row = taskRow(g, task, step, targets);
            rows.add(row);
            appendRouting(g, task, step, targets, row, rows);
        }
        return rows;
    }

    /* ===================== Task row ===================== */

    private StepRecord taskRow(ProcessGraph g, TaskNode task, int step, List<FlowTarget> targets) {
        String chain = intermediateChain(g, targets, step);
        String waitEvent = chain == null ? intermediateEventBefore(g, task.getIncoming()) : null;
        String multiInput = multiInput(g, task, step);

        List<String> docLines = new ArrayList<>();
        if (task.getDocumentation() != null) {
            for (String line : task.getDocumentation().split("\n", -1)) docLines.add(line.stripTrailing());
        }
        String firstLine = docLines.isEmpty() ? "" : docLines.get(0).strip();

        List<Paragraph> paragraphs = new ArrayList<>();
        paragraphs.add(Paragraph.heading(multiInput == null ? task.getLabel() : task.getLabel() + " " + multiInput));
        paragraphs.add(Paragraph.blank());
        paragraphs.add(Paragraph.body(description(task, firstLine, waitEvent)));

        if (docLines.size() > 1) {
            paragraphs.add(Paragraph.blank());
            for (String extra : docLines.subList(1, docLines.size())) {
                if (!extra.isEmpty()) paragraphs.add(Paragraph.body(extra));
            }
            Paragraph last = paragraphs.get(paragraphs.size() - 1);
            if (!last.getText().isEmpty()) paragraphs.set(paragraphs.size() - 1, last.withText(ensurePeriod(last.getText())));
        }

        if (chain != null) {
            paragraphs.add(Paragraph.blank());
            paragraphs.add(Paragraph.heading(chain));
        }

        for (String sentence : boundaryEvents(g, task, targets)) {
            paragraphs.add(Paragraph.blank());
            paragraphs.add(Paragraph.emphasis(sentence));
        }

        for (FlowTarget t : targets) {
            if (t.is(TargetKind.TASK) && t.getStep() < step) {
                paragraphs.add(Paragraph.blank());
                paragraphs.add(Paragraph.heading("Revert to Step " + t.getStep()));
                break;
            }
        }

        SlaAssignment sla = g.slaOf(task.getId());
        return new StepRecord(String.valueOf(step), false, sla.getSla(), sla.getGroupId(), task.getRaci(), paragraphs);
    }

    /** "The Ops shall review the request." with an optional "wait until E Then" in front of the action. */
    private String description(TaskNode task, String firstLine, String waitEvent) {
        String actor = "The " + task.getLaneName();
        String fallback = task.getLabel().toLowerCase(Locale.ROOT);
        boolean hasShall = startsWithIgnoreCase(firstLine, "shall ");
        String text;
        if (waitEvent != null) {
            String action = firstLine.isEmpty() ? fallback : (hasShall ? firstLine.substring(6).strip() : firstLine);
            text = actor + " shall wait until " + waitEvent + " Then " + action;
        } else if (firstLine.isEmpty()) {
            text = actor + " shall " + fallback;
        } else {
            text = hasShall ? actor + " " + firstLine : actor + " shall " + firstLine;
        }
        return ensurePeriod(text);
    }

    /* ===================== Routing ===================== */

    private void appendRouting(ProcessGraph g, TaskNode task, int step, List<FlowTarget> targets,
                               StepRecord row, List<StepRecord> rows) {
        if (targets.isEmpty()) return;
        if (appendJoinToEnd(g, task, targets, row)) return;

        if (targets.size() == 1) {
            FlowTarget only = targets.get(0);
            if (only.is(TargetKind.GATEWAY)) {
                GatewayNode gw = g.gateway(only.getNodeId());
                if (gw.getType().isParallelOrInclusive() && gw.isSplit()) {
                    List<Integer> stepList = taskSteps(traversal.targetsOf(g, gw.getId()));
                    if (stepList.size() > 1) {
                        appendBold(row, "Proceed to Step " + steps(stepList, gw.getType().stepConnector()));
                    }
                } else if (gw.getType() == GatewayType.XOR) {
                    rows.addAll(gatewayCases.resolveCases(g, step, gw.getId(), task.getRaci()));
                }
            } else if (only.is(TargetKind.SUBPROCESS)) {
                appendBold(row, subprocessRouting(g, only.getNodeId(), step));
            } else if (only.is(TargetKind.END)) {
                appendBold(row, processEnds(only.getEndName()));
            }
        } else if (targets.stream().allMatch(t -> t.is(TargetKind.TASK))) {
            appendBold(row, "Proceed to Step " + steps(taskSteps(targets), " and Step "));
        }
    }

    /**
     * Branch task feeding an AND/OR join that goes straight to an end event: the row waits for the
     * other branches instead of routing on. Only the first such join is looked at.
     */
    private boolean appendJoinToEnd(ProcessGraph g, TaskNode task, List<FlowTarget> targets, StepRecord row) {
        Set<String> seen = new HashSet<>();
        for (FlowTarget t : targets) {
            if (!t.is(TargetKind.GATEWAY) || !seen.add(t.getNodeId())) continue;
            GatewayNode join = g.gateway(t.getNodeId());
            if (!join.getType().isParallelOrInclusive() || !join.isJoin()) continue;

            List<FlowTarget> after = traversal.targetsOf(g, join.getId());
            FlowTarget end = after.stream().filter(a -> a.is(TargetKind.END)).findFirst().orElse(null);
            boolean reachesTask = after.stream().anyMatch(a -> a.is(TargetKind.TASK));
            if (end == null || reachesTask) continue;

            SortedSet<Integer> others = new TreeSet<>();
            for (String flowId : join.getIncoming()) {
                FlowEdge flow = g.flow(flowId);
                if (flow == null || flow.getSourceId().equals(task.getId())) continue;
                String source = flow.getSourceId();
                if (g.isTask(source)) {
                    if (g.task(source).hasStep()) others.add(g.task(source).getStep());
                } else if (g.isGateway(source)) {
                    traversal.traceGatewayToTask(g, source).ifPresent(others::add);
                }
            }
            if (others.isEmpty()) return false;
            appendBold(row, "Wait until step " + steps(others, " and step ") + " completed then " + processEnds(end.getEndName()));
            return true;
        }
        return false;
    }

    private String subprocessRouting(ProcessGraph g, String subprocessId, int step) {
        SubprocessNode sp = g.subprocess(subprocessId);
        String start = "Start " + sp.getName() + sp.processSuffix();
        String event = intermediateEventBefore(g, sp.getIncoming());
        String text = event != null ? "Wait for " + event + " and Then " + start : start;

        FlowTarget after = first(traversal.targetsOf(g, subprocessId));
        if (after != null && after.is(TargetKind.TASK)) {
            return text + " Then " + verb(after.getStep(), step) + " to Step " + after.getStep();
        }
        if (after != null && after.is(TargetKind.END)) {
            return text + ", then " + processEnds(after.getEndName());
        }
        return text;
    }

    private static void appendBold(StepRecord row, String text) {
        row.append(Paragraph.blank());
        row.append(Paragraph.heading(text));
    }

    /* ===================== Intermediate events ===================== */

    /** Name of the first named intermediate event feeding into the given incoming flows. */
    private String intermediateEventBefore(ProcessGraph g, List<String> incoming) {
        for (String flowId : incoming) {
            FlowEdge flow = g.flow(flowId);
            if (flow == null) continue;
            EventNode ev = g.event(flow.getSourceId());
            if (ev != null && ev.getType() == EventType.INTERMEDIATE && ev.hasName()) return ev.getName();
        }
        return null;
    }

    /**
     * Routing sentence for a task whose first successor is an intermediate event,
     * e.g. "Wait for Approval and Then Start Billing Process Then Proceed to Step 5".
     */
    private String intermediateChain(ProcessGraph g, List<FlowTarget> targets, int step) {
        FlowTarget firstTarget = first(targets);
        if (firstTarget == null || !firstTarget.is(TargetKind.INTERMEDIATE)) return null;

        EventNode ev = g.event(firstTarget.getNodeId());
        String name = ev.getName();
        boolean alreadyWaits = startsWithIgnoreCase(name, "wait for ") || startsWithIgnoreCase(name, "wait until ");
        String wait = alreadyWaits ? name : "Wait for " + name;

        FlowTarget next = first(traversal.targetsOf(g, ev.getId()));
        if (next == null) return wait;

        if (next.is(TargetKind.SUBPROCESS)) {
            SubprocessNode sp = g.subprocess(next.getNodeId());
            String lead = wait + " and Then Start " + sp.getName() + sp.processSuffix();
            FlowTarget after = first(traversal.targetsOf(g, sp.getId()));
            if (after != null && after.is(TargetKind.TASK)) {
                return lead + " Then " + verb(after.getStep(), step) + " to Step " + after.getStep();
            }
            if (after != null && after.is(TargetKind.END)) return lead + ", then " + processEnds(after.getEndName());
            return lead;
        }
        if (next.is(TargetKind.GATEWAY)) {
            GatewayNode gw = g.gateway(next.getNodeId());
            List<FlowTarget> gwTargets = traversal.targetsOf(g, gw.getId());
            if (gw.isParallelFanOut()) {
                List<Integer> stepList = taskSteps(gwTargets);
                if (!stepList.isEmpty()) {
                    return wait + " and Then Proceed to Step " + steps(stepList, gw.getType().stepConnector());
                }
            }
            for (FlowTarget gt : gwTargets) {
                if (gt.is(TargetKind.TASK)) return wait + " and Then " + verb(gt.getStep(), step) + " to Step " + gt.getStep();
                if (gt.is(TargetKind.END)) return wait + ", then " + processEnds(gt.getEndName());
            }
            return wait;
        }
        if (next.is(TargetKind.TASK)) return wait + " and Then " + verb(next.getStep(), step) + " to Step " + next.getStep();
        if (next.is(TargetKind.END)) return wait + ", then " + processEnds(next.getEndName());
        return wait;
    }

    /* ===================== Boundary events ===================== */

    private List<String> boundaryEvents(ProcessGraph g, TaskNode task, List<FlowTarget> targets) {
        List<String> out = new ArrayList<>();
        for (BoundaryEventNode be : g.boundaryEventsOf(task.getId())) {
            if (be.getName().isEmpty()) {
                log.debug("Boundary event {} on {} has no name, skipped", be.getId(), task.getId());
                continue;
            }
            Integer target = boundaryTarget(g, be);
            if (target == null) {
                log.debug("Boundary event {} on {} does not lead to a numbered task, skipped", be.getId(), task.getId());
                continue;
            }

            String condition = be.getKind() == BoundaryKind.TIMER
                    ? "performing the activity took more than " + be.getName()
                    : be.getName() + " during performing the activity";

            if (be.isInterrupting()) {
                out.add("If " + condition + ", stop the activity and proceed to step " + target);
                continue;
            }
            String text = "If " + condition + ", proceed to step " + target + " and complete the activity";
            FlowTarget normal = normalContinuation(g, targets);
            if (normal != null && normal.is(TargetKind.TASK)) {
                text += ", then proceed to step " + normal.getStep();
            } else if (normal != null && normal.is(TargetKind.END)) {
                text += ", then " + processEnds(normal.getEndName());
            }
            out.add(text);
        }
        return out;
    }

    private Integer boundaryTarget(ProcessGraph g, BoundaryEventNode be) {
        if (be.getOutgoing().isEmpty()) return null;
        FlowEdge flow = g.flow(be.getOutgoing().get(0));
        if (flow == null) return null;
        TaskNode t = g.task(flow.getTargetId());
        return t == null ? null : t.getStep();
    }

    /** Task or end event the task normally continues to, looking through at most one gateway. */
    private FlowTarget normalContinuation(ProcessGraph g, List<FlowTarget> targets) {
        for (FlowTarget t : targets) {
            if (t.is(TargetKind.TASK) || t.is(TargetKind.END)) return t;
            if (t.is(TargetKind.GATEWAY)) {
                for (FlowTarget gt : traversal.targetsOf(g, t.getNodeId())) {
                    if (gt.is(TargetKind.TASK) || gt.is(TargetKind.END)) return gt;
                }
                return null;
            }
        }
        return null;
    }

    /* ===================== Multi-input ===================== */

    /**
     * "Step Input: ..." suffix for the title, or null.
     * A direct AND/OR join lists the steps feeding it; otherwise the task needs both an earlier
     * step and a start-event input among its upstream sources.
     */
    private String multiInput(ProcessGraph g, TaskNode task, int step) {
        if (task.getIncoming().isEmpty()) return null;

        List<GatewayNode> joins = new ArrayList<>();
        boolean exclusiveOnly = true;
        for (String flowId : task.getIncoming()) {
            FlowEdge flow = g.flow(flowId);
            if (flow == null) continue;
            String source = flow.getSourceId();
            if (g.isGateway(source)) {
                GatewayNode gw = g.gateway(source);
                if (gw.getType().isParallelOrInclusive()) {
                    joins.add(gw);
                    exclusiveOnly = false;
                }
            } else if (g.isTask(source)) {
                Optional<SplitPoint> split = traversal.traceBackToSplit(g, source);
                if (split.isEmpty() || split.get().getType() != GatewayType.XOR) exclusiveOnly = false;
            } else {
                exclusiveOnly = false;
            }
        }

        if (!joins.isEmpty()) {
            GatewayType joinType = joins.get(joins.size() - 1).getType();
            SortedSet<Integer> sources = new TreeSet<>();
            for (GatewayNode join : joins) {
                for (String flowId : join.getIncoming()) {
                    FlowEdge flow = g.flow(flowId);
                    if (flow == null) continue;
                    String source = flow.getSourceId();
                    if (g.isTask(source)) {
                        if (g.task(source).hasStep()) sources.add(g.task(source).getStep());
                    } else if (g.isGateway(source)) {
                        traversal.traceGatewayToTask(g, source).ifPresent(sources::add);
                    }
                }
            }
            if (sources.size() > 1) return "Step Input: Step " + steps(sources, joinType.stepConnector());
        } else if (exclusiveOnly) {
            log.debug("Step {} is entered from exclusive branches only", step);
        }
        return stepAndTriggerInput(g, task, step);
    }

    private String stepAndTriggerInput(ProcessGraph g, TaskNode task, int step) {
        TraversalService.UpstreamSources upstream = traversal.upstreamSources(g, task.getId(), step);
        if (upstream.getSteps().isEmpty() || upstream.getInputs().isEmpty()) return null;

        StringJoiner parts = new StringJoiner(" or ", "Step Input: ", "");
        for (Integer s : upstream.getSteps()) parts.add("Step " + s);
        for (Integer i : upstream.getInputs()) parts.add("Input " + i);
        return parts.toString();
    }
}
