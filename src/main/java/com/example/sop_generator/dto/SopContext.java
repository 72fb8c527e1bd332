package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Everything a document renderer needs: header fields, step rows and SLA merge ranges. */
public class SopContext {

    @JsonProperty("process_name")
    private String processName;
    @JsonProperty("process_code")
    private String processCode;
    @JsonProperty("issued_by")
    private String issuedBy;
    @JsonProperty("release_date")
    private String releaseDate;
    @JsonProperty("process_owner")
    private String processOwner;
    @JsonProperty("purpose")
    private String purpose;
    @JsonProperty("scope")
    private String scope;
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
    @JsonProperty("steps")
    private List<StepRecord> steps;
    @JsonProperty("sla_merges")
    private List<SlaMerge> slaMerges;

    public String getProcessName() { return processName; }
    public void setProcessName(String processName) { this.processName = processName; }
    public String getProcessCode() { return processCode; }
    public void setProcessCode(String processCode) { this.processCode = processCode; }
    public String getIssuedBy() { return issuedBy; }
    public void setIssuedBy(String issuedBy) { this.issuedBy = issuedBy; }
    public String getReleaseDate() { return releaseDate; }
    public void setReleaseDate(String releaseDate) { this.releaseDate = releaseDate; }
    public String getProcessOwner() { return processOwner; }
    public void setProcessOwner(String processOwner) { this.processOwner = processOwner; }
    public String getPurpose() { return purpose; }
    public void setPurpose(String purpose) { this.purpose = purpose; }
    public String getScope() { return scope; }
    public void setScope(String scope) { this.scope = scope; }
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
    public List<StepRecord> getSteps() { return steps; }
    public void setSteps(List<StepRecord> steps) { this.steps = steps; }
    public List<SlaMerge> getSlaMerges() { return slaMerges; }
    public void setSlaMerges(List<SlaMerge> slaMerges) { this.slaMerges = slaMerges; }
}
