package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Document header fields supplied by the caller. Any field left null (lists) or blank
 * (process name, code, purpose, scope) is filled from the BPMN document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SopMetadata {

    @JsonProperty("process_name")
    private String processName;
    @JsonProperty("process_code")
    private String processCode;
    @JsonProperty("purpose")
    private String purpose;
    @JsonProperty("scope")
    private String scope;
    @JsonProperty("issued_by")
    private String issuedBy;
    @JsonProperty("release_date")
    private String releaseDate;
    @JsonProperty("process_owner")
    private String processOwner;
    @JsonProperty("abbreviations")
    private String abbreviations;
    @JsonProperty("references")
    private String references;
    @JsonProperty("inputs")
    private String inputs;
    @JsonProperty("outputs")
    private String outputs;
    @JsonProperty("abbreviations_list")
    private List<Abbreviation> abbreviationsList;
    @JsonProperty("references_list")
    private List<ReferenceDocument> referencesList;
    @JsonProperty("general_policies_list")
    private List<Policy> generalPoliciesList;

    public String getProcessName() { return processName; }
    public void setProcessName(String processName) { this.processName = processName; }
    public String getProcessCode() { return processCode; }
    public void setProcessCode(String processCode) { this.processCode = processCode; }
    public String getPurpose() { return purpose; }
    public void setPurpose(String purpose) { this.purpose = purpose; }
    public String getScope() { return scope; }
    public void setScope(String scope) { this.scope = scope; }
    public String getIssuedBy() { return issuedBy; }
    public void setIssuedBy(String issuedBy) { this.issuedBy = issuedBy; }
    public String getReleaseDate() { return releaseDate; }
    public void setReleaseDate(String releaseDate) { this.releaseDate = releaseDate; }
    public String getProcessOwner() { return processOwner; }
    public void setProcessOwner(String processOwner) { this.processOwner = processOwner; }
    public String getAbbreviations() { return abbreviations; }
    public void setAbbreviations(String abbreviations) { this.abbreviations = abbreviations; }
    public String getReferences() { return references; }
    public void setReferences(String references) { this.references = references; }
    public String getInputs() { return inputs; }
    public void setInputs(String inputs) { this.inputs = inputs; }
    public String getOutputs() { return outputs; }
    public void setOutputs(String outputs) { this.outputs = outputs; }
    public List<Abbreviation> getAbbreviationsList() { return abbreviationsList; }
    public void setAbbreviationsList(List<Abbreviation> abbreviationsList) { this.abbreviationsList = abbreviationsList; }
    public List<ReferenceDocument> getReferencesList() { return referencesList; }
    public void setReferencesList(List<ReferenceDocument> referencesList) { this.referencesList = referencesList; }
    public List<Policy> getGeneralPoliciesList() { return generalPoliciesList; }
    public void setGeneralPoliciesList(List<Policy> generalPoliciesList) { this.generalPoliciesList = generalPoliciesList; }
}
