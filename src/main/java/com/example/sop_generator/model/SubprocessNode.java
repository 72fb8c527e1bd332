package com.example.sop_generator.model;

import java.util.List;
import java.util.Locale;

public final class SubprocessNode {
    private final String id;
    private final String name;
    private final List<String> incoming;
    private final List<String> outgoing;

    public SubprocessNode(String id, String name, List<String> incoming, List<String> outgoing) {
        this.id = id;
        this.name = name;
        this.incoming = List.copyOf(incoming);
        this.outgoing = List.copyOf(outgoing);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public List<String> getIncoming() { return incoming; }
    public List<String> getOutgoing() { return outgoing; }

    /** " Process" unless the name already ends with "process". */
    public String processSuffix() {
        return name.toLowerCase(Locale.ROOT).endsWith("process") ? "" : " Process";
    }
}
