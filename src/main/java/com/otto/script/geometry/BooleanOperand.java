package com.otto.script.geometry;

import com.otto.script.model.ShapeRecord;

/** A shape handed to the boolean engine together with the name the script used for it. */
public final class BooleanOperand {
    private final String name;
    private final ShapeRecord shape;

    public BooleanOperand(String name, ShapeRecord shape) {
        this.name = name;
        this.shape = shape;
    }

    public String getName() { return name; }
    public ShapeRecord getShape() { return shape; }
}
