package com.example.sop_generator.support;

import java.util.*;

/**
 * Builds small schema-valid BPMN 2.0 documents for tests. Incoming/outgoing references
 * of every node are derived from the declared sequence flows when the document is built.
 */
public final class BpmnXmlBuilder {

    private static final String PROCESS_ID = "Process_1";

    private String participantName;
    private String participantDoc;
    private String versionTag;
    private final Map<String, String> properties = new LinkedHashMap<>();
    private final List<String[]> processDocs = new ArrayList<>();

    private final List<Lane> lanes = new ArrayList<>();
    private final List<Element> elements = new ArrayList<>();
    private final Map<String, Element> byId = new HashMap<>();
    private final List<Element> groups = new ArrayList<>();
    private final Map<String, double[]> shapes = new LinkedHashMap<>();

    public static BpmnXmlBuilder process() {
        return new BpmnXmlBuilder();
    }

    /* ================= Header ================= */

    public BpmnXmlBuilder participant(String name, String documentation) {
        this.participantName = name;
        this.participantDoc = documentation;
        return this;
    }

    public BpmnXmlBuilder processDoc(String textFormat, String text) {
        processDocs.add(new String[]{textFormat, text});
        return this;
    }

    public BpmnXmlBuilder versionTag(String value) {
        this.versionTag = value;
        return this;
    }

    public BpmnXmlBuilder property(String name, String value) {
        properties.put(name, value);
        return this;
    }

    /* ================= Lanes ================= */

    public BpmnXmlBuilder lane(String id, String name, String... members) {
        lanes.add(new Lane(id, name, Arrays.asList(members)));
        return this;
    }

    public BpmnXmlBuilder laneRaci(String laneId, String responsible, String accountable, String consulted, String informed) {
        for (Lane lane : lanes) {
            if (!lane.id.equals(laneId)) continue;
            lane.docs.add(new String[]{"application/x-responsible", responsible});
            lane.docs.add(new String[]{"application/x-accountable", accountable});
            lane.docs.add(new String[]{"application/x-consulted", consulted});
            lane.docs.add(new String[]{"application/x-informed", informed});
        }
        return this;
    }

    /* ================= Flow nodes ================= */

    public BpmnXmlBuilder start(String id, String name) { return node("startEvent", id, name); }
    public BpmnXmlBuilder end(String id, String name) { return node("endEvent", id, name); }
    public BpmnXmlBuilder intermediate(String id, String name) { return node("intermediateCatchEvent", id, name); }
    public BpmnXmlBuilder task(String id, String name) { return node("task", id, name); }
    public BpmnXmlBuilder userTask(String id, String name) { return node("userTask", id, name); }
    public BpmnXmlBuilder subprocess(String id, String name) { return node("subProcess", id, name); }
    public BpmnXmlBuilder xor(String id, String name) { return node("exclusiveGateway", id, name); }
    public BpmnXmlBuilder and(String id) { return node("parallelGateway", id, null); }
    public BpmnXmlBuilder or(String id) { return node("inclusiveGateway", id, null); }

    public BpmnXmlBuilder timer(String id, String name, String attachedTo, boolean interrupting) {
        return boundary(id, name, attachedTo, interrupting, "timerEventDefinition");
    }

    public BpmnXmlBuilder message(String id, String name, String attachedTo, boolean interrupting) {
        return boundary(id, name, attachedTo, interrupting, "messageEventDefinition");
    }

    private BpmnXmlBuilder boundary(String id, String name, String attachedTo, boolean interrupting, String definition) {
        Element e = new Element("boundaryEvent", id, name);
        e.attributes.put("attachedToRef", attachedTo);
        if (!interrupting) e.attributes.put("cancelActivity", "false");
        e.eventDefinition = definition;
        return add(e);
    }

    public BpmnXmlBuilder doc(String id, String text) {
        return doc(id, null, text);
    }

    public BpmnXmlBuilder doc(String id, String textFormat, String text) {
        byId.get(id).docs.add(new String[]{textFormat, text});
        return this;
    }

    /* ================= Flows & artifacts ================= */

    public BpmnXmlBuilder flow(String id, String source, String target) {
        return flow(id, source, target, null);
    }

    public BpmnXmlBuilder flow(String id, String source, String target, String name) {
        Element e = new Element("sequenceFlow", id, name);
        e.attributes.put("sourceRef", source);
        e.attributes.put("targetRef", target);
        return add(e);
    }

    public BpmnXmlBuilder group(String id, String sla, double x, double y, double w, double h) {
        Element e = new Element("group", id, null);
        e.docs.add(new String[]{"application/x-sla", sla});
        groups.add(e);
        byId.put(id, e);
        return shape(id, x, y, w, h);
    }

    public BpmnXmlBuilder shape(String elementId, double x, double y, double w, double h) {
        shapes.put(elementId, new double[]{x, y, w, h});
        return this;
    }

    private BpmnXmlBuilder node(String tag, String id, String name) {
        return add(new Element(tag, id, name));
    }

    private BpmnXmlBuilder add(Element e) {
        elements.add(e);
        byId.put(e.id, e);
        return this;
    }

    /* ================= Output ================= */

    public String build() {
        linkFlows();
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<bpmn:definitions xmlns:bpmn=\"http://www.omg.org/spec/BPMN/20100524/MODEL\"")
                .append(" xmlns:bpmndi=\"http://www.omg.org/spec/BPMN/20100524/DI\"")
                .append(" xmlns:dc=\"http://www.omg.org/spec/DD/20100524/DC\"")
                .append(" xmlns:zeebe=\"http://camunda.org/schema/zeebe/1.0\"")
                .append(" id=\"Definitions_1\" targetNamespace=\"http://bpmn.io/schema/bpmn\">\n");

        if (participantName != null || participantDoc != null) {
            sb.append("  <bpmn:collaboration id=\"Collaboration_1\">\n")
                    .append("    <bpmn:participant id=\"Participant_1\"")
                    .append(attr("name", participantName))
                    .append(" processRef=\"").append(PROCESS_ID).append("\">\n");
            if (participantDoc != null) {
                sb.append("      <bpmn:documentation>").append(escape(participantDoc)).append("</bpmn:documentation>\n");
            }
            sb.append("    </bpmn:participant>\n  </bpmn:collaboration>\n");
        }

        sb.append("  <bpmn:process id=\"").append(PROCESS_ID).append("\" isExecutable=\"false\">\n");
        for (String[] d : processDocs) appendDoc(sb, d, "    ");
        if (versionTag != null || !properties.isEmpty()) {
            sb.append("    <bpmn:extensionElements>\n");
            if (versionTag != null) sb.append("      <zeebe:versionTag").append(attr("value", versionTag)).append(" />\n");
            if (!properties.isEmpty()) {
                sb.append("      <zeebe:properties>\n");
                properties.forEach((k, v) -> sb.append("        <zeebe:property")
                        .append(attr("name", k)).append(attr("value", v)).append(" />\n"));
                sb.append("      </zeebe:properties>\n");
            }
            sb.append("    </bpmn:extensionElements>\n");
        }

        if (!lanes.isEmpty()) {
            sb.append("    <bpmn:laneSet id=\"LaneSet_1\">\n");
            for (Lane lane : lanes) {
                sb.append("      <bpmn:lane id=\"").append(lane.id).append("\"").append(attr("name", lane.name)).append(">\n");
                for (String[] d : lane.docs) appendDoc(sb, d, "        ");
                for (String m : lane.members) sb.append("        <bpmn:flowNodeRef>").append(m).append("</bpmn:flowNodeRef>\n");
                sb.append("      </bpmn:lane>\n");
            }
            sb.append("    </bpmn:laneSet>\n");
        }

        for (Element e : elements) appendElement(sb, e);
        for (Element e : groups) appendElement(sb, e);
        sb.append("  </bpmn:process>\n");

        if (!shapes.isEmpty()) {
            sb.append("  <bpmndi:BPMNDiagram id=\"Diagram_1\">\n")
                    .append("    <bpmndi:BPMNPlane id=\"Plane_1\" bpmnElement=\"").append(PROCESS_ID).append("\">\n");
            shapes.forEach((id, b) -> sb.append("      <bpmndi:BPMNShape id=\"").append(id).append("_di\" bpmnElement=\"")
                    .append(id).append("\">\n        <dc:Bounds x=\"").append(b[0]).append("\" y=\"").append(b[1])
                    .append("\" width=\"").append(b[2]).append("\" height=\"").append(b[3]).append("\" />\n")
                    .append("      </bpmndi:BPMNShape>\n"));
            sb.append("    </bpmndi:BPMNPlane>\n  </bpmndi:BPMNDiagram>\n");
        }
        sb.append("</bpmn:definitions>\n");
        return sb.toString();
    }

    private void linkFlows() {
        for (Element e : elements) {
            e.incoming.clear();
            e.outgoing.clear();
        }
        for (Element f : elements) {
            if (!"sequenceFlow".equals(f.tag)) continue;
            Element src = byId.get(f.attributes.get("sourceRef"));
            Element tgt = byId.get(f.attributes.get("targetRef"));
            if (src != null) src.outgoing.add(f.id);
            if (tgt != null) tgt.incoming.add(f.id);
        }
    }

    private static void appendElement(StringBuilder sb, Element e) {
        sb.append("    <bpmn:").append(e.tag).append(" id=\"").append(e.id).append("\"").append(attr("name", e.name));
        e.attributes.forEach((k, v) -> sb.append(attr(k, v)));
        sb.append(">\n");
        for (String[] d : e.docs) appendDoc(sb, d, "      ");
        for (String f : e.incoming) sb.append("      <bpmn:incoming>").append(f).append("</bpmn:incoming>\n");
        for (String f : e.outgoing) sb.append("      <bpmn:outgoing>").append(f).append("</bpmn:outgoing>\n");
        if (e.eventDefinition != null) {
            sb.append("      <bpmn:").append(e.eventDefinition).append(" id=\"").append(e.id).append("_def\" />\n");
        }
        sb.append("    </bpmn:").append(e.tag).append(">\n");
    }

    private static void appendDoc(StringBuilder sb, String[] doc, String indent) {
        sb.append(indent).append("<bpmn:documentation").append(attr("textFormat", doc[0])).append(">")
                .append(escape(doc[1])).append("</bpmn:documentation>\n");
    }

    private static String attr(String name, String value) {
        return value == null ? "" : " " + name + "=\"" + escape(value) + "\"";
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    private static final class Lane {
        final String id;
        final String name;
        final List<String> members;
        final List<String[]> docs = new ArrayList<>();

        Lane(String id, String name, List<String> members) {
            this.id = id;
            this.name = name;
            this.members = members;
        }
    }

    private static final class Element {
        final String tag;
        final String id;
        final String name;
        final Map<String, String> attributes = new LinkedHashMap<>();
        final List<String[]> docs = new ArrayList<>();
        final List<String> incoming = new ArrayList<>();
        final List<String> outgoing = new ArrayList<>();
        String eventDefinition;

        Element(String tag, String id, String name) {
            this.tag = tag;
            this.id = id;
            this.name = name;
        }
    }
}
