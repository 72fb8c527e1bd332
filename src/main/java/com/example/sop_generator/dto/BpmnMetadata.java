package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Header values read from fixed places in a BPMN document. Fields not found in the
 * document stay null and are left out of the JSON; inputs and outputs are always present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BpmnMetadata {

    @JsonProperty("process_name")
    private String processName;
    @JsonProperty("purpose")
    private String purpose;
    @JsonProperty("scope")
    private String scope;
    @JsonProperty("process_code")
    private String processCode;
    @JsonProperty("abbreviations_list")
    private List<Abbreviation> abbreviationsList;
    @JsonProperty("lane_names")
    private List<String> laneNames;
    @JsonProperty("general_policies_list")
    private List<Policy> generalPoliciesList;
    @JsonProperty("inputs")
    private String inputs = "";
    @JsonProperty("outputs")
    private String outputs = "";

    public String getProcessName() { return processName; }
    public void setProcessName(String processName) { this.processName = processName; }
    public String getPurpose() { return purpose; }
    public void setPurpose(String purpose) { this.purpose = purpose; }
    public String getScope() { return scope; }
    public void setScope(String scope) { this.scope = scope; }
    public String getProcessCode() { return processCode; }
    public void setProcessCode(String processCode) { this.processCode = processCode; }
    public List<Abbreviation> getAbbreviationsList() { return abbreviationsList; }
    public void setAbbreviationsList(List<Abbreviation> abbreviationsList) { this.abbreviationsList = abbreviationsList; }
    public List<String> getLaneNames() { return laneNames; }
    public void setLaneNames(List<String> laneNames) { this.laneNames = laneNames; }
    public List<Policy> getGeneralPoliciesList() { return generalPoliciesList; }
    public void setGeneralPoliciesList(List<Policy> generalPoliciesList) { this.generalPoliciesList = generalPoliciesList; }
    public String getInputs() { return inputs; }
    public void setInputs(String inputs) { this.inputs = inputs; }
    public String getOutputs() { return outputs; }
    public void setOutputs(String outputs) { this.outputs = outputs; }
}
