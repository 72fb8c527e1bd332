package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A row of the "References" table: document id and title. */
public class ReferenceDocument {

    @JsonProperty("id")
    private String id;
    @JsonProperty("title")
    private String title;

    public ReferenceDocument() {}

    public ReferenceDocument(String id, String title) {
        this.id = id;
        this.title = title;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
}
