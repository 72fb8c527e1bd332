package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class Abbreviation {

    @JsonProperty("term")
    private String term;
    @JsonProperty("definition")
    private String definition;

    public Abbreviation() {}

    public Abbreviation(String term, String definition) {
        this.term = term;
        this.definition = definition;
    }

    public String getTerm() { return term; }
    public void setTerm(String term) { this.term = term; }
    public String getDefinition() { return definition; }
    public void setDefinition(String definition) { this.definition = definition; }
}
