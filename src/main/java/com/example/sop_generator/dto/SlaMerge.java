package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Rows {@code start..end} (inclusive, indexes into the step list) share one merged SLA cell. */
public class SlaMerge {

    @JsonProperty("start")
    private final int start;
    @JsonProperty("end")
    private final int end;
    @JsonProperty("sla")
    private final String sla;

    public SlaMerge(int start, int end, String sla) {
        this.start = start;
        this.end = end;
        this.sla = sla;
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }
    public String getSla() { return sla; }
}
