package com.otto.script.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A shape produced by a script. Statements such as {@code transform}, {@code fill} and
 * {@code style} mutate it in place; boolean operations flag their operands as consumed.
 */
public final class ShapeRecord {
    private final ShapeType type;
    private final String id;
    private final LinkedHashMap<String, Value> params;
    private final ShapeTransform transform;
    private String layerName;
    private boolean consumedByBoolean;

    public ShapeRecord(ShapeType type, String id, Map<String, Value> params, ShapeTransform transform) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = id;
        this.params = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        this.transform = transform == null ? ShapeTransform.identity() : transform;
    }

    public ShapeType getType() { return type; }
    public String getId() { return id; }
    public ShapeTransform getTransform() { return transform; }

    /** Live view; writes go straight into the shape. */
    public Map<String, Value> getParams() { return params; }

    public Value getParam(String name) {
        Value v = params.get(name);
        return v == null ? Value.nil() : v;
    }

    public boolean hasParam(String name) {
        Value v = params.get(name);
        return v != null && !v.isNull();
    }

    public void setParam(String name, Value value) {
        params.put(name, value);
    }

    public double getNumber(String name, double fallback) {
        Value v = params.get(name);
        return v != null && v.isNumber() ? v.asNumber() : fallback;
    }

    public boolean isTruthyParam(String name) {
        Value v = params.get(name);
        return v != null && v.type == Value.Type.BOOL && v.asBool();
    }

    public String getLayerName() { return layerName; }
    public void setLayerName(String layerName) { this.layerName = layerName; }

    public boolean isConsumedByBoolean() { return consumedByBoolean; }
    public void markConsumedByBoolean() { this.consumedByBoolean = true; }

    /** True for outlines that came out of a union/difference/intersection/xor. */
    public boolean isBooleanResult() {
        return type == ShapeType.PATH && hasParam("operation");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapeRecord)) return false;
        ShapeRecord s = (ShapeRecord) o;
        return type == s.type && Objects.equals(id, s.id) && params.equals(s.params)
                && transform.equals(s.transform) && Objects.equals(layerName, s.layerName)
                && consumedByBoolean == s.consumedByBoolean;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id, params, transform, layerName, consumedByBoolean);
    }

    @Override
    public String toString() {
        return "{type=" + type + ", id=" + id + ", params=" + params + ", transform=" + transform + "}";
    }
}
