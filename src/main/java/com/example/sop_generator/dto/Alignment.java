package com.example.sop_generator.dto;

public enum Alignment {
    LEFT,
    CENTER,
    JUSTIFY
}
