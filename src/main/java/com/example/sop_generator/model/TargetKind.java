package com.example.sop_generator.model;

/** What a sequence flow leads to, once resolved against the graph tables. */
public enum TargetKind {
    TASK,
    GATEWAY,
    SUBPROCESS,
    END,
    INTERMEDIATE
}
