package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class Policy {

    @JsonProperty("ref")
    private String ref;
    @JsonProperty("policy")
    private String policy;

    public Policy() {}

    public Policy(String ref, String policy) {
        this.ref = ref;
        this.policy = policy;
    }

    public String getRef() { return ref; }
    public void setRef(String ref) { this.ref = ref; }
    public String getPolicy() { return policy; }
    public void setPolicy(String policy) { this.policy = policy; }
}
