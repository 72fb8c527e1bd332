package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of the generate / extract-metadata calls: the BPMN XML and optional header overrides. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerateRequest {

    @JsonProperty("xml")
    private String xml;
    @JsonProperty("metadata")
    private SopMetadata metadata;

    public GenerateRequest() {}

    public GenerateRequest(String xml, SopMetadata metadata) {
        this.xml = xml;
        this.metadata = metadata;
    }

    public String getXml() { return xml; }
    public void setXml(String xml) { this.xml = xml; }
    public SopMetadata getMetadata() { return metadata; }
    public void setMetadata(SopMetadata metadata) { this.metadata = metadata; }
}
