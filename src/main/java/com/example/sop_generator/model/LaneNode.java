package com.example.sop_generator.model;

import com.example.sop_generator.dto.Raci;

import java.util.List;

public final class LaneNode {
    private final String id;
    private final String name;
    private final Raci raci;
    private final List<String> memberIds;

    public LaneNode(String id, String name, Raci raci, List<String> memberIds) {
        this.id = id;
        this.name = name;
        this.raci = raci;
        this.memberIds = List.copyOf(memberIds);
    }

    public String getId() { return id; }
    /** Raw lane name, null when the lane has no name attribute. */
    public String getName() { return name; }
    public Raci getRaci() { return raci; }
    public List<String> getMemberIds() { return memberIds; }
}
