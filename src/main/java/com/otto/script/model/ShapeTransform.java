package com.otto.script.model;

import java.util.Objects;

/** Position, rotation (degrees) and per-axis scale of a shape or layer. Mutable. */
public final class ShapeTransform {
    private double x;
    private double y;
    private double rotation;
    private double scaleX = 1;
    private double scaleY = 1;

    public static ShapeTransform identity() {
        return new ShapeTransform();
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getRotation() { return rotation; }
    public double getScaleX() { return scaleX; }
    public double getScaleY() { return scaleY; }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setRotation(double rotation) {
        this.rotation = rotation;
    }

    public void rotateBy(double degrees) {
        this.rotation += degrees;
    }

    public void setScale(double scaleX, double scaleY) {
        this.scaleX = scaleX;
        this.scaleY = scaleY;
    }

    public ShapeTransform copy() {
        ShapeTransform t = new ShapeTransform();
        t.x = x;
        t.y = y;
        t.rotation = rotation;
        t.scaleX = scaleX;
        t.scaleY = scaleY;
        return t;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapeTransform)) return false;
        ShapeTransform t = (ShapeTransform) o;
        return x == t.x && y == t.y && rotation == t.rotation && scaleX == t.scaleX && scaleY == t.scaleY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, rotation, scaleX, scaleY);
    }

    @Override
    public String toString() {
        return "{position=[" + Value.formatNumber(x) + ", " + Value.formatNumber(y) + "], rotation="
                + Value.formatNumber(rotation) + ", scale=[" + Value.formatNumber(scaleX) + ", "
                + Value.formatNumber(scaleY) + "]}";
    }
}
