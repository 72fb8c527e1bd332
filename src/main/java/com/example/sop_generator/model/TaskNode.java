package com.example.sop_generator.model;

import com.example.sop_generator.dto.Raci;

import java.util.List;

/**
 * A task-like activity (any task subtype or a call activity).
 * Only tasks carrying a step number become SOP rows; the rest still take part in traversal.
 */
public final class TaskNode {
    private final String id;
    private final String name;
    private final String label;
    private final Integer step;
    private final String laneName;
    private final Raci raci;
    private final List<String> incoming;
    private final List<String> outgoing;
    private final String documentation;
    private final String sla;

    public TaskNode(String id, String name, String label, Integer step, String laneName, Raci raci,
                    List<String> incoming, List<String> outgoing, String documentation, String sla) {
        this.id = id;
        this.name = name;
        this.label = label;
        this.step = step;
        this.laneName = laneName;
        this.raci = raci;
        this.incoming = List.copyOf(incoming);
        this.outgoing = List.copyOf(outgoing);
        this.documentation = documentation;
        this.sla = sla;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getLabel() { return label; }
    public Integer getStep() { return step; }
    public boolean hasStep() { return step != null; }
    public String getLaneName() { return laneName; }
    public Raci getRaci() { return raci; }
    public List<String> getIncoming() { return incoming; }
    public List<String> getOutgoing() { return outgoing; }
    public String getDocumentation() { return documentation; }
    public String getSla() { return sla; }
}
