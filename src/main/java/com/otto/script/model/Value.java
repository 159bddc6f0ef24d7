package com.otto.script.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class Value {
    public enum Type { NUMBER, BOOL, STRING, ARRAY, SHAPE, LAYER, FUNC, NULL }

    private static final Value NIL = new Value(Type.NULL, null);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, a); }
    public static Value shape(ShapeRecord s) { return new Value(Type.SHAPE, s); }
    public static Value layer(Layer l) { return new Value(Type.LAYER, l); }
    public static Value func(String name) { return new Value(Type.FUNC, name); }
    public static Value nil() { return NIL; }

    public static Value point(double x, double y) {
        List<Value> xy = new ArrayList<>(2);
        xy.add(number(x));
        xy.add(number(y));
        return array(xy);
    }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }
    public boolean isNumber() { return type == Type.NUMBER; }
    public boolean isString() { return type == Type.STRING; }
    public boolean isArray() { return type == Type.ARRAY; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING && type != Type.FUNC) {
            throw new IllegalStateException("Expected string, got " + type);
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new IllegalStateException("Expected array, got " + type);
        return (List<Value>) value;
    }

    public ShapeRecord asShape() {
        if (type != Type.SHAPE) throw new IllegalStateException("Expected shape, got " + type);
        return (ShapeRecord) value;
    }

    public Layer asLayer() {
        if (type != Type.LAYER) throw new IllegalStateException("Expected layer, got " + type);
        return (Layer) value;
    }

    /** Numeric view used at the store boundary: non-numbers read as 0. */
    public double numberOr(double fallback) {
        return type == Type.NUMBER ? (double) value : fallback;
    }

    /** Plain Java view (Double, Boolean, String, List or null) for stores and JSON output. */
    public Object toJava() {
        switch (type) {
            case NUMBER:
            case BOOL:
            case STRING:
            case FUNC:
                return value;
            case ARRAY: {
                List<Object> out = new ArrayList<>();
                for (Value v : asArray()) out.add(v.toJava());
                return out;
            }
            case SHAPE:
                return asShape().getId();
            case LAYER:
                return asLayer().getName();
            case NULL:
            default:
                return null;
        }
    }

    /** Renders numbers the way scripts see them: integral values without a fraction. */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.NUMBER) return asNumber() == other.asNumber();
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) {
            double d = asNumber();
            return Double.hashCode(d == 0.0 ? 0.0 : d);
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return asString();
            case FUNC:
                return "<fn " + asString() + ">";
            case ARRAY:
                return asArray().toString();
            case SHAPE:
                return "<shape " + asShape().getId() + ">";
            case LAYER:
                return "<layer " + asLayer().getName() + ">";
            case NULL:
            default:
                return "null";
        }
    }
}
