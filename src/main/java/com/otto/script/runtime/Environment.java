package com.otto.script.runtime;

import com.otto.script.error.NameNotFoundException;
import com.otto.script.model.FunctionDef;
import com.otto.script.model.Layer;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.Value;

/**
 * Chain of scope frames rooted at a global frame that lives for the whole run.
 * Function calls push a child of the current frame; loops do not push anything.
 */
public class Environment {

    private final ScopeFrame global = new ScopeFrame(null);
    private ScopeFrame current = global;

    public ScopeFrame global() {
        return global;
    }

    public ScopeFrame current() {
        return current;
    }

    public int depth() {
        int depth = 0;
        for (ScopeFrame f = current; f.getParent() != null; f = f.getParent()) depth++;
        return depth;
    }

    // -------------------------
    // Scoping (LIFO)
    // -------------------------

    public void pushScope() {
        current = new ScopeFrame(current);
    }

    public void popScope() {
        if (current.isGlobal()) {
            throw new IllegalStateException("Cannot pop global scope");
        }
        current = current.getParent();
    }

    // -------------------------
    // Parameters
    // -------------------------

    public Value getParameter(String name) {
        Value v = current.findParameter(name);
        if (v == null) throw new NameNotFoundException("Parameter not found: " + name);
        return v;
    }

    public boolean hasParameter(String name) {
        return current.findParameter(name) != null;
    }

    /** Binds in the current frame, shadowing any outer binding. */
    public void setParameter(String name, Value value) {
        current.putParameter(name, value);
    }

    // -------------------------
    // Shapes
    // -------------------------

    public ShapeRecord getShape(String name) {
        ShapeRecord s = current.findShape(name);
        if (s == null) throw new NameNotFoundException("Shape not found: " + name);
        return s;
    }

    public ShapeRecord findShape(String name) {
        return current.findShape(name);
    }

    public boolean hasShape(String name) {
        return current.findShape(name) != null;
    }

    /**
     * Registers into the current frame, keyed per loop iteration when a loop counter is active.
     *
     * @return the id the shape was stored under
     */
    public ShapeId addShape(String name, Double loopCounter, ShapeRecord shape) {
        ShapeId id = loopCounter != null ? ShapeId.inLoop(name, loopCounter) : ShapeId.plain(name);
        current.putShape(id, shape);
        return id;
    }

    /** Registers straight into the global frame, however deep the current call is. */
    public void defineGlobalShape(ShapeId id, ShapeRecord shape) {
        global.putShape(id, shape);
    }

    // -------------------------
    // Layers
    // -------------------------

    public Layer createLayer(String name) {
        Layer layer = new Layer(name);
        current.putLayer(layer);
        return layer;
    }

    public Layer getLayer(String name) {
        Layer l = current.findLayer(name);
        if (l == null) throw new NameNotFoundException("Layer not found: " + name);
        return l;
    }

    public Layer findLayer(String name) {
        return current.findLayer(name);
    }

    /** Adds the shape name to the layer and tags the shape with the layer when it exists. */
    public void addShapeToLayer(String layerName, String shapeName) {
        Layer layer = getLayer(layerName);
        layer.addMember(shapeName);
        ShapeRecord shape = current.findShape(shapeName);
        if (shape != null) shape.setLayerName(layerName);
    }

    // -------------------------
    // Functions
    // -------------------------

    public void defineFunction(FunctionDef fn) {
        current.putFunction(fn);
    }

    public FunctionDef getFunction(String name) {
        FunctionDef fn = current.findFunction(name);
        if (fn == null) throw new NameNotFoundException("Function not found: " + name);
        return fn;
    }

    public boolean hasFunction(String name) {
        return current.findFunction(name) != null;
    }
}
