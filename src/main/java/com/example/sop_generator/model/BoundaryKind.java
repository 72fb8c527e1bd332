package com.example.sop_generator.model;

public enum BoundaryKind {
    TIMER,
    MESSAGE,
    SIGNAL,
    ERROR,
    OTHER
}
