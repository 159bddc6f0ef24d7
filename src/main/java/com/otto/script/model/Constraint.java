package com.otto.script.model;

/** A geometric relation between two anchors. Collected only; nothing here solves it. */
public final class Constraint {
    private final ConstraintKind kind;
    private final AnchorRef a;
    private final AnchorRef b;
    private final Double distance;

    public Constraint(ConstraintKind kind, AnchorRef a, AnchorRef b, Double distance) {
        this.kind = kind;
        this.a = a;
        this.b = b;
        this.distance = distance;
    }

    public ConstraintKind getKind() { return kind; }
    public AnchorRef getA() { return a; }
    public AnchorRef getB() { return b; }

    /** Only set for {@link ConstraintKind#DISTANCE}. */
    public Double getDistance() { return distance; }

    @Override
    public String toString() {
        return kind + "(" + a + ", " + b + (distance != null ? ", " + Value.formatNumber(distance) : "") + ")";
    }
}
