package com.example.sop_generator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One paragraph of a step cell as the document renderer draws it.
 * Headings and routing sentences use size 12, everything else size 11.
 */
public class Paragraph {

    public static final int HEADING_SIZE = 12;
    public static final int BODY_SIZE = 11;

    @JsonProperty("text")
    private final String text;
    @JsonProperty("bold")
    private final boolean bold;
    @JsonProperty("font_size")
    private final int fontSize;
    @JsonProperty("alignment")
    private final Alignment alignment;

    public Paragraph(String text, boolean bold, int fontSize, Alignment alignment) {
        this.text = text == null ? "" : text;
        this.bold = bold;
        this.fontSize = fontSize;
        this.alignment = alignment;
    }

    public static Paragraph heading(String text) {
        return new Paragraph(text, true, HEADING_SIZE, Alignment.JUSTIFY);
    }

    public static Paragraph body(String text) {
        return new Paragraph(text, false, BODY_SIZE, Alignment.JUSTIFY);
    }

    public static Paragraph emphasis(String text) {
        return new Paragraph(text, true, BODY_SIZE, Alignment.JUSTIFY);
    }

    public static Paragraph blank() {
        return body("");
    }

    /** Copy with different text, same formatting. */
    public Paragraph withText(String newText) {
        return new Paragraph(newText, bold, fontSize, alignment);
    }

    public String getText() { return text; }
    public boolean isBold() { return bold; }
    public int getFontSize() { return fontSize; }
    public Alignment getAlignment() { return alignment; }
}
