package com.example.sop_generator.model;

/** Diagram bounds of a BPMNShape. */
public final class ShapeBounds {
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public ShapeBounds(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    public double centerX() { return x + width / 2; }
    public double centerY() { return y + height / 2; }

    /** Edges count as inside. */
    public boolean contains(double px, double py) {
        return x <= px && px <= x + width && y <= py && py <= y + height;
    }
}
