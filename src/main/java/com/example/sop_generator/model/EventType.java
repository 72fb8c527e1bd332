package com.example.sop_generator.model;

public enum EventType {
    START,
    END,
    INTERMEDIATE
}
