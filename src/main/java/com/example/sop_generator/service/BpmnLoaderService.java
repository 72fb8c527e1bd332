package com.example.sop_generator.service;

import com.example.sop_generator.dto.Raci;
import com.example.sop_generator.exception.MalformedBpmnException;
import com.example.sop_generator.exception.SopGenerationException;
import com.example.sop_generator.model.*;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.impl.BpmnModelConstants;
import org.camunda.bpm.model.bpmn.instance.*;
import org.camunda.bpm.model.xml.ModelException;
import org.camunda.bpm.model.xml.instance.DomElement;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.TransformerException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a BPMN 2.0 document with the Camunda model API and flattens it into a {@link ProcessGraph}.
 * <p>
 * Elements are collected in document order by walking the DOM, then classified through their typed
 * model instances. Flow references ({@code incoming}, {@code outgoing}, {@code flowNodeRef}) are read
 * as raw ids so a dangling reference is kept as text and skipped later instead of failing the load.
 * Flows and boundary events whose id references name no element are removed before schema
 * validation by {@link DanglingReferenceFilter}.
 */
@Service
public class BpmnLoaderService {

    private static final Logger log = LoggerFactory.getLogger(BpmnLoaderService.class);

    static final String BPMN_NS = BpmnModelConstants.BPMN20_NS;
    static final String ZEEBE_NS = "http://camunda.org/schema/zeebe/1.0";

    static final String PLAIN_TEXT = "text/plain";
    static final String SLA_FORMAT = "application/x-sla";

    static final String LANE_UNREADABLE = "[LANE UNREADABLE]";
    static final String UNNAMED_SUBPROCESS = "Unnamed Process";

    private static final Pattern STEP_PREFIX =
            Pattern.compile("^\\s*(\\d+)\\s*[.:\\-]?\\s*", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\n\\r\\t]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");

    /* ===================== Parse ===================== */

    public BpmnModelInstance read(String xml) {
        if (xml == null || xml.isBlank()) throw new MalformedBpmnException("BPMN document is empty");
        return read(xml.getBytes(StandardCharsets.UTF_8));
    }

    public BpmnModelInstance read(byte[] xml) {
        if (xml == null || xml.length == 0) throw new MalformedBpmnException("BPMN document is empty");
        byte[] cleaned;
        try {
            cleaned = DanglingReferenceFilter.filter(xml);
        } catch (SAXException | IOException e) {
            log.warn("Rejected BPMN document: {}", e.getMessage());
            throw new MalformedBpmnException("BPMN document could not be parsed: " + e.getMessage(), e);
        } catch (ParserConfigurationException | TransformerException e) {
            throw new SopGenerationException("BPMN document could not be prepared: " + e.getMessage(), e);
        }
        try {
            return Bpmn.readModelFromStream(new ByteArrayInputStream(cleaned));
        } catch (ModelException e) {
            log.warn("Rejected BPMN document: {}", e.getMessage());
            throw new MalformedBpmnException("BPMN document could not be parsed: " + rootMessage(e), e);
        }
    }

    public ProcessGraph load(String xml) {
        return buildGraph(read(xml));
    }

    /* ===================== Graph ===================== */

    public ProcessGraph buildGraph(BpmnModelInstance model) {
        List<ModelElementInstance> elements = new ArrayList<>(256);
        Map<String, ShapeBounds> shapes = new LinkedHashMap<>();
        collect(model, model.getDocument().getRootElement(), elements, shapes);

        Map<String, LaneNode> lanes = new LinkedHashMap<>();
        Map<String, String> laneOfElement = new HashMap<>();
        for (ModelElementInstance el : elements) {
            if (el instanceof Lane) {
                LaneNode lane = toLane((Lane) el);
                lanes.put(lane.getId(), lane);
                for (String member : lane.getMemberIds()) laneOfElement.putIfAbsent(member, lane.getId());
            }
        }

        Map<String, TaskNode> tasks = new LinkedHashMap<>();
        Map<String, GatewayNode> gateways = new LinkedHashMap<>();
        Map<String, FlowEdge> flows = new LinkedHashMap<>();
        Map<String, SubprocessNode> subprocesses = new LinkedHashMap<>();
        Map<String, EventNode> events = new LinkedHashMap<>();
        Map<String, List<BoundaryEventNode>> boundary = new LinkedHashMap<>();
        Map<String, GroupNode> groups = new LinkedHashMap<>();

        for (ModelElementInstance el : elements) {
            if (el instanceof BoundaryEvent) {
                BoundaryEventNode be = toBoundaryEvent((BoundaryEvent) el);
                if (!isBlank(be.getAttachedTo())) {
                    boundary.computeIfAbsent(be.getAttachedTo(), k -> new ArrayList<>()).add(be);
                }
            } else if (el instanceof Task || el instanceof CallActivity) {
                TaskNode t = toTask((Activity) el, lanes.get(laneOfElement.get(((Activity) el).getId())));
                tasks.put(t.getId(), t);
            } else if (el instanceof SubProcess) {
                SubProcess sp = (SubProcess) el;
                subprocesses.put(sp.getId(), new SubprocessNode(sp.getId(), subprocessName(sp.getName()),
                        flowRefs(sp, "incoming"), flowRefs(sp, "outgoing")));
            } else if (el instanceof Gateway) {
                GatewayType type = gatewayType((Gateway) el);
                if (type != null) {
                    Gateway gw = (Gateway) el;
                    gateways.put(gw.getId(), new GatewayNode(gw.getId(), type, flowRefs(gw, "incoming"), flowRefs(gw, "outgoing")));
                }
            } else if (el instanceof Event) {
                EventType type = eventType((Event) el);
                if (type != null) {
                    Event ev = (Event) el;
                    events.put(ev.getId(), new EventNode(ev.getId(), ev.getName(), type,
                            flowRefs(ev, "incoming"), flowRefs(ev, "outgoing")));
                }
            } else if (el instanceof SequenceFlow) {
                SequenceFlow sf = (SequenceFlow) el;
                flows.put(sf.getId(), new FlowEdge(sf.getId(), sf.getAttributeValue("sourceRef"),
                        sf.getAttributeValue("targetRef"), sf.getName(), firstDocumentation(sf)));
            } else if (el instanceof BaseElement && "group".equals(el.getElementType().getTypeName())) {
                BaseElement group = (BaseElement) el;
                String sla = documentation(group, SLA_FORMAT);
                if (sla != null) groups.put(group.getId(), new GroupNode(group.getId(), sla));
            }
        }

        ProcessGraph g = new ProcessGraph(tasks, gateways, flows, lanes, subprocesses, events, boundary, groups, shapes);
        if (log.isDebugEnabled()) {
            log.debug("Loaded BPMN graph: {} tasks, {} gateways, {} flows, {} lanes, {} subprocesses, {} events, {} groups",
                    tasks.size(), gateways.size(), flows.size(), lanes.size(), subprocesses.size(), events.size(), groups.size());
            logDanglingReferences(g);
        }
        return g;
    }

    private void collect(BpmnModelInstance model, DomElement parent,
                         List<ModelElementInstance> out, Map<String, ShapeBounds> shapes) {
        for (DomElement child : parent.getChildElements()) {
            if (BpmnModelConstants.BPMNDI_NS.equals(child.getNamespaceURI())
                    && "BPMNShape".equals(child.getLocalName())) {
                readShape(child, shapes);
                continue;
            }
            String id = child.getAttribute("id");
            if (!isBlank(id)) {
                ModelElementInstance el = model.getModelElementById(id);
                if (el != null) out.add(el);
            }
            collect(model, child, out, shapes);
        }
    }

    private void readShape(DomElement shape, Map<String, ShapeBounds> shapes) {
        String ref = shape.getAttribute("bpmnElement");
        List<DomElement> bounds = shape.getChildElementsByNameNs(BpmnModelConstants.DC_NS, "Bounds");
        if (isBlank(ref) || bounds.isEmpty()) return;
        DomElement b = bounds.get(0);
        shapes.put(ref, new ShapeBounds(number(b, "x"), number(b, "y"), number(b, "width"), number(b, "height")));
    }

    private static double number(DomElement el, String attr) {
        String v = el.getAttribute(attr);
        return isBlank(v) ? 0d : Double.parseDouble(v.trim());
    }

    /* ===================== Element mapping ===================== */

    private LaneNode toLane(Lane lane) {
        Raci raci = new Raci(
                documentation(lane, "application/x-responsible"),
                documentation(lane, "application/x-accountable"),
                documentation(lane, "application/x-consulted"),
                documentation(lane, "application/x-informed"));
        return new LaneNode(lane.getId(), lane.getName(), raci, flowRefs(lane, "flowNodeRef"));
    }

    private TaskNode toTask(Activity task, LaneNode lane) {
        String name = task.getName() == null ? "" : task.getName();
        String laneName = LANE_UNREADABLE;
        Raci raci = Raci.NONE;
        if (lane != null) {
            laneName = lane.getName() == null ? LANE_UNREADABLE : COMBINING_MARKS.matcher(lane.getName()).replaceAll("");
            raci = lane.getRaci();
        }
        return new TaskNode(task.getId(), name, cleanLabel(name), stepNumber(name), laneName, raci,
                flowRefs(task, "incoming"), flowRefs(task, "outgoing"),
                plainDocumentation(task), documentation(task, SLA_FORMAT));
    }

    private BoundaryEventNode toBoundaryEvent(BoundaryEvent be) {
        return new BoundaryEventNode(be.getId(), be.getName(), be.getAttributeValue("attachedToRef"),
                be.cancelActivity(), boundaryKind(be), flowRefs(be, "outgoing"));
    }

    private static BoundaryKind boundaryKind(BoundaryEvent be) {
        Collection<EventDefinition> defs = be.getEventDefinitions();
        if (defs.stream().anyMatch(d -> d instanceof TimerEventDefinition)) return BoundaryKind.TIMER;
        if (defs.stream().anyMatch(d -> d instanceof MessageEventDefinition)) return BoundaryKind.MESSAGE;
        if (defs.stream().anyMatch(d -> d instanceof SignalEventDefinition)) return BoundaryKind.SIGNAL;
        if (defs.stream().anyMatch(d -> d instanceof ErrorEventDefinition)) return BoundaryKind.ERROR;
        return BoundaryKind.OTHER;
    }

    private static GatewayType gatewayType(Gateway gw) {
        if (gw instanceof ExclusiveGateway) return GatewayType.XOR;
        if (gw instanceof ParallelGateway) return GatewayType.AND;
        if (gw instanceof InclusiveGateway) return GatewayType.OR;
        return null; // event-based / complex gateways are not part of the SOP vocabulary
    }

    private static EventType eventType(Event ev) {
        if (ev instanceof StartEvent) return EventType.START;
        if (ev instanceof EndEvent) return EventType.END;
        if (ev instanceof IntermediateCatchEvent || ev instanceof IntermediateThrowEvent) return EventType.INTERMEDIATE;
        return null;
    }

    /* ===================== Names & documentation ===================== */

    /** Leading step number of a task name, e.g. "12. Do X" gives 12; null when absent. */
    static Integer stepNumber(String name) {
        if (name == null) return null;
        Matcher m = STEP_PREFIX.matcher(name);
        if (!m.lookingAt()) return null;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            log.debug("Step prefix '{}' is out of range, task treated as unnumbered", m.group(1));
            return null;
        }
    }

    /** Task name without line breaks, step prefix and repeated whitespace. */
    static String cleanLabel(String name) {
        if (name == null) return "";
        String s = LINE_BREAKS.matcher(name).replaceAll(" ");
        s = STEP_PREFIX.matcher(s).replaceFirst("");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    static String subprocessName(String name) {
        if (name == null) return UNNAMED_SUBPROCESS;
        String s = LINE_BREAKS.matcher(name).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /** First documentation whose textFormat matches; trimmed, null when missing or empty. */
    static String documentation(BaseElement el, String textFormat) {
        for (Documentation d : el.getDocumentations()) {
            if (textFormat.equals(d.getAttributeValue("textFormat"))) return trimToNull(d.getTextContent());
        }
        return null;
    }

    /** First documentation without a custom textFormat. */
    static String plainDocumentation(BaseElement el) {
        for (Documentation d : el.getDocumentations()) {
            String format = d.getAttributeValue("textFormat");
            if (isBlank(format) || PLAIN_TEXT.equals(format)) return trimToNull(d.getTextContent());
        }
        return null;
    }

    static String firstDocumentation(BaseElement el) {
        for (Documentation d : el.getDocumentations()) return trimToNull(d.getTextContent());
        return null;
    }

    /** Text of the direct BPMN children with the given local name, e.g. the flow ids under incoming. */
    static List<String> flowRefs(ModelElementInstance el, String childName) {
        List<String> out = new ArrayList<>();
        for (DomElement ref : el.getDomElement().getChildElementsByNameNs(BPMN_NS, childName)) {
            String v = trimToNull(ref.getTextContent());
            if (v != null) out.add(v);
        }
        return out;
    }

    private void logDanglingReferences(ProcessGraph g) {
        for (TaskNode t : g.getTasks()) {
            for (String f : t.getOutgoing()) {
                if (g.flow(f) == null) log.debug("Task {} lists unknown outgoing flow {}, skipped", t.getId(), f);
            }
        }
        for (GatewayNode gw : g.getGateways()) {
            for (String f : gw.getOutgoing()) {
                if (g.flow(f) == null) log.debug("Gateway {} lists unknown outgoing flow {}, skipped", gw.getId(), f);
            }
        }
    }

    /* ===================== Utils ===================== */

    private static String rootMessage(Throwable e) {
        Throwable cur = e;
        while (cur.getCause() != null && cur.getCause() != cur) cur = cur.getCause();
        return cur.getMessage() != null ? cur.getMessage() : e.getMessage();
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
