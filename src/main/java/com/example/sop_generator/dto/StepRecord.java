package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One SOP table row: a numbered task step ("12") or a gateway case ("12A").
 * Routing sentences are appended to the paragraph list after the row is created.
 */
public class StepRecord {

    @JsonProperty("ref")
    private final String ref;
    @JsonProperty("is_gateway")
    private final boolean gatewayCase;
    @JsonProperty("sla")
    private final String sla;
    @JsonProperty("sla_group")
    private final String slaGroup;
    @JsonProperty("raci")
    private final Raci raci;
    @JsonProperty("paragraphs")
    private final List<Paragraph> paragraphs;

    public StepRecord(String ref, boolean gatewayCase, String sla, String slaGroup, Raci raci, List<Paragraph> paragraphs) {
        this.ref = ref;
        this.gatewayCase = gatewayCase;
        this.sla = sla;
        this.slaGroup = slaGroup;
        this.raci = raci == null ? Raci.NONE : raci;
        this.paragraphs = new ArrayList<>(paragraphs);
    }

    public void append(Paragraph p) {
        paragraphs.add(p);
    }

    public String getRef() { return ref; }
    public boolean isGatewayCase() { return gatewayCase; }
    public String getSla() { return sla; }
    public String getSlaGroup() { return slaGroup; }
    public Raci getRaci() { return raci; }
    public List<Paragraph> getParagraphs() { return Collections.unmodifiableList(paragraphs); }
}
