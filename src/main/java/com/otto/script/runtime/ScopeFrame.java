package com.otto.script.runtime;

import com.otto.script.model.FunctionDef;
import com.otto.script.model.Layer;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One level of bindings. Lookups fall through to the parent frame on a miss and
 * return {@code null} when the chain is exhausted.
 */
public final class ScopeFrame {

    private final ScopeFrame parent;
    private final Map<String, Value> parameters = new LinkedHashMap<>();
    private final Map<ShapeId, ShapeRecord> shapes = new LinkedHashMap<>();
    private final Map<String, Layer> layers = new LinkedHashMap<>();
    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();

    ScopeFrame(ScopeFrame parent) {
        this.parent = parent;
    }

    public ScopeFrame getParent() {
        return parent;
    }

    public boolean isGlobal() {
        return parent == null;
    }

    // -------------------------
    // Parameters
    // -------------------------

    public Value findParameter(String name) {
        for (ScopeFrame f = this; f != null; f = f.parent) {
            Value v = f.parameters.get(name);
            if (v != null) return v;
        }
        return null;
    }

    void putParameter(String name, Value value) {
        parameters.put(name, value);
    }

    // -------------------------
    // Shapes
    // -------------------------

    /** Matches a script name against each frame's entries, exact unscoped ids first. */
    public ShapeRecord findShape(String name) {
        ShapeId plain = ShapeId.plain(name);
        for (ScopeFrame f = this; f != null; f = f.parent) {
            ShapeRecord s = f.shapes.get(plain);
            if (s != null) return s;
            for (Map.Entry<ShapeId, ShapeRecord> e : f.shapes.entrySet()) {
                if (e.getKey().render().equals(name)) return e.getValue();
            }
        }
        return null;
    }

    void putShape(ShapeId id, ShapeRecord shape) {
        shapes.put(id, shape);
    }

    // -------------------------
    // Layers
    // -------------------------

    public Layer findLayer(String name) {
        for (ScopeFrame f = this; f != null; f = f.parent) {
            Layer l = f.layers.get(name);
            if (l != null) return l;
        }
        return null;
    }

    void putLayer(Layer layer) {
        layers.put(layer.getName(), layer);
    }

    // -------------------------
    // Functions
    // -------------------------

    public FunctionDef findFunction(String name) {
        for (ScopeFrame f = this; f != null; f = f.parent) {
            FunctionDef fn = f.functions.get(name);
            if (fn != null) return fn;
        }
        return null;
    }

    void putFunction(FunctionDef fn) {
        functions.put(fn.getName(), fn);
    }

    // Read-only views of this frame only.
    public Map<String, Value> parameters() { return Collections.unmodifiableMap(parameters); }
    public Map<ShapeId, ShapeRecord> shapes() { return Collections.unmodifiableMap(shapes); }
    public Map<String, Layer> layers() { return Collections.unmodifiableMap(layers); }
    public Map<String, FunctionDef> functions() { return Collections.unmodifiableMap(functions); }
}
