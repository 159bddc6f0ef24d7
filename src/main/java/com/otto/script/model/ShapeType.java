package com.otto.script.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Every 2D shape kind a script can create. Names match case-insensitively. */
public enum ShapeType {
    RECTANGLE("rectangle", false),
    CIRCLE("circle", true),
    TRIANGLE("triangle", false),
    ELLIPSE("ellipse", true),
    POLYGON("polygon", false),
    STAR("star", false),
    ARC("arc", true),
    ROUNDED_RECTANGLE("roundedRectangle", true),
    ARROW("arrow", false),
    TEXT("text", false),
    BEZIER_CURVE("bezierCurve", false),
    BSPLINE("bspline", true),
    DONUT("donut", true),
    SPIRAL("spiral", true),
    CROSS("cross", false),
    GEAR("gear", false),
    WAVE("wave", true),
    SLOT("slot", false),
    CHAMFER_RECTANGLE("chamferRectangle", false),
    POLYGON_WITH_HOLES("polygonWithHoles", false),
    PATH("path", false);

    private static final Map<String, ShapeType> BY_NAME = new HashMap<>();
    static {
        for (ShapeType t : values()) BY_NAME.put(t.typeName.toLowerCase(Locale.ROOT), t);
    }

    private final String typeName;
    private final boolean curved;

    ShapeType(String typeName, boolean curved) {
        this.typeName = typeName;
        this.curved = curved;
    }

    /** The name scripts and external stores use, e.g. "roundedRectangle". */
    public String typeName() {
        return typeName;
    }

    /** Curved outlines get a finer sampling resolution when turned into polygons. */
    public boolean isCurved() {
        return curved;
    }

    /** @return the matching type, or {@code null} when the name is not a known shape */
    public static ShapeType fromName(String name) {
        if (name == null) return null;
        return BY_NAME.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return typeName;
    }
}
