package com.example.sop_generator.service;

import com.example.sop_generator.dto.Abbreviation;
import com.example.sop_generator.dto.BpmnMetadata;
import com.example.sop_generator.dto.Policy;
import com.example.sop_generator.model.EventNode;
import com.example.sop_generator.model.EventType;
import com.example.sop_generator.model.FlowEdge;
import com.example.sop_generator.model.LaneNode;
import com.example.sop_generator.model.ProcessGraph;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.Documentation;
import org.camunda.bpm.model.bpmn.instance.ExtensionElements;
import org.camunda.bpm.model.bpmn.instance.Participant;
import org.camunda.bpm.model.bpmn.instance.Process;
import org.camunda.bpm.model.xml.instance.DomElement;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import static com.example.sop_generator.service.BpmnLoaderService.*;

/**
 * Reads the SOP header fields stored in a BPMN document: pool name and documentation,
 * scope and policy documentation of the process, Zeebe version tag and properties,
 * lane names, plus the process inputs (start events) and outputs (end events).
 */
@Service
public class MetadataService {

    static final String SCOPE_FORMAT = "application/x-scope";
    static final String POLICY_FORMAT = "application/x-policy";

    @Autowired
    private TraversalService traversal;

    public BpmnMetadata extract(BpmnModelInstance model, ProcessGraph g) {
        BpmnMetadata meta = new BpmnMetadata();

        for (Participant p : model.getModelElementsByType(Participant.class)) {
            String name = trimToNull(p.getName());
            if (name != null) {
                meta.setProcessName(name);
                break;
            }
        }
        for (Participant p : model.getModelElementsByType(Participant.class)) {
            if (!p.getDocumentations().isEmpty()) {
                meta.setPurpose(firstDocumentation(p));
                break;
            }
        }

        List<Abbreviation> abbreviations = new ArrayList<>();
        List<Policy> policies = new ArrayList<>();
        int policyIndex = 0;
        for (Process process : model.getModelElementsByType(Process.class)) {
            if (meta.getScope() == null) meta.setScope(documentation(process, SCOPE_FORMAT));

            for (Documentation d : process.getDocumentations()) {
                if (!POLICY_FORMAT.equals(d.getAttributeValue("textFormat"))) continue;
                policyIndex++;
                String text = trimToNull(d.getTextContent());
                if (text != null) policies.add(new Policy(String.valueOf(policyIndex), text));
            }

            ExtensionElements ext = process.getExtensionElements();
            if (ext == null) continue;
            DomElement extDom = ext.getDomElement();
            if (meta.getProcessCode() == null) {
                for (DomElement tag : extDom.getChildElementsByNameNs(ZEEBE_NS, "versionTag")) {
                    meta.setProcessCode(trimToNull(tag.getAttribute("value")));
                    break;
                }
            }
            for (DomElement props : extDom.getChildElementsByNameNs(ZEEBE_NS, "properties")) {
                for (DomElement prop : props.getChildElementsByNameNs(ZEEBE_NS, "property")) {
                    String term = nullToEmpty(prop.getAttribute("name"));
                    String definition = nullToEmpty(prop.getAttribute("value"));
                    if (!term.isEmpty() || !definition.isEmpty()) abbreviations.add(new Abbreviation(term, definition));
                }
            }
        }
        if (!abbreviations.isEmpty()) meta.setAbbreviationsList(abbreviations);
        if (!policies.isEmpty()) meta.setGeneralPoliciesList(policies);

        List<String> laneNames = laneNames(g);
        if (!laneNames.isEmpty()) meta.setLaneNames(laneNames);

        meta.setInputs(processInputs(g));
        meta.setOutputs(processOutputs(g));
        return meta;
    }

    /** Named lanes in document order. */
    public List<String> laneNames(ProcessGraph g) {
        List<String> out = new ArrayList<>();
        for (LaneNode lane : g.getLanes()) {
            String name = trimToNull(lane.getName());
            if (name != null) out.add(name);
        }
        return out;
    }

    /**
     * "1. Customer request" lines, one per start event in input-number order. Unnamed events
     * use their first named outgoing flow and are left out when there is none.
     */
    public String processInputs(ProcessGraph g) {
        StringJoiner out = new StringJoiner("\n");
        for (Map.Entry<String, Integer> e : traversal.startEventNumbers(g).entrySet()) {
            String name = inputName(g, g.event(e.getKey()));
            if (name != null) out.add(e.getValue() + ". " + name);
        }
        return out.toString();
    }

    /** Named end events, numbered in document order. */
    public String processOutputs(ProcessGraph g) {
        StringJoiner out = new StringJoiner("\n");
        int i = 1;
        for (EventNode end : g.eventsOfType(EventType.END)) {
            if (end.hasName()) out.add((i++) + ". " + end.getName());
        }
        return out.toString();
    }

    private String inputName(ProcessGraph g, EventNode start) {
        if (start.hasName()) return start.getName();
        for (String flowId : start.getOutgoing()) {
            FlowEdge flow = g.flow(flowId);
            if (flow != null && !flow.getName().isEmpty()) return flow.getName();
        }
        return null;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
