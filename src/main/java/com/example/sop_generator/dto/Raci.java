package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Responsible / Accountable / Consulted / Informed assignment of a lane.
 * Roles that are not documented on the lane read "N/A".
 */
public class Raci {

    public static final String NOT_ASSIGNED = "N/A";
    public static final Raci NONE = new Raci(NOT_ASSIGNED, NOT_ASSIGNED, NOT_ASSIGNED, NOT_ASSIGNED);

    @JsonProperty("responsible")
    private final String responsible;
    @JsonProperty("accountable")
    private final String accountable;
    @JsonProperty("consulted")
    private final String consulted;
    @JsonProperty("informed")
    private final String informed;

    public Raci(String responsible, String accountable, String consulted, String informed) {
        this.responsible = orNotAssigned(responsible);
        this.accountable = orNotAssigned(accountable);
        this.consulted = orNotAssigned(consulted);
        this.informed = orNotAssigned(informed);
    }

    private static String orNotAssigned(String v) {
        return (v == null || v.isBlank()) ? NOT_ASSIGNED : v;
    }

    public String getResponsible() { return responsible; }
    public String getAccountable() { return accountable; }
    public String getConsulted() { return consulted; }
    public String getInformed() { return informed; }
}
