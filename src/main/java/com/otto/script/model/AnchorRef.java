package com.otto.script.model;

/** {@code shape.anchor}, e.g. {@code box.topLeft}. */
public final class AnchorRef {
    public final String shape;
    public final String anchor;

    public AnchorRef(String shape, String anchor) {
        this.shape = shape;
        this.anchor = anchor;
    }

    @Override
    public String toString() {
        return shape + "." + anchor;
    }
}
