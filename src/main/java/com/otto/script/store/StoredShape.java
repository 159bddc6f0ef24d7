package com.otto.script.store;

import java.util.LinkedHashMap;
import java.util.Map;

/** A shape as the outside world keeps it: plain values only, no script types. */
public class StoredShape {
    private final String id;
    private final String name;
    private final String type;
    private double x;
    private double y;
    private double rotation;
    private double scaleX = 1;
    private double scaleY = 1;
    private String layer;
    private final Map<String, Object> options = new LinkedHashMap<>();

    public StoredShape(String id, String name, String type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getType() { return type; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getRotation() { return rotation; }
    public double getScaleX() { return scaleX; }
    public double getScaleY() { return scaleY; }
    public String getLayer() { return layer; }
    public Map<String, Object> getOptions() { return options; }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setRotation(double rotation) { this.rotation = rotation; }

    public void setScale(double scaleX, double scaleY) {
        this.scaleX = scaleX;
        this.scaleY = scaleY;
    }

    public void setLayer(String layer) { this.layer = layer; }
}
