package com.otto.script.runtime;

import com.otto.script.model.Constraint;
import com.otto.script.model.FunctionDef;
import com.otto.script.model.Layer;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** What a script left in the global frame, plus the value of its last statement. */
public final class InterpretResult {
    private final Map<String, Value> parameters;
    private final Map<ShapeId, ShapeRecord> shapes;
    private final Map<String, Layer> layers;
    private final Map<String, FunctionDef> functions;
    private final List<Constraint> constraints;
    private final Value result;

    private InterpretResult(Map<String, Value> parameters, Map<ShapeId, ShapeRecord> shapes,
                            Map<String, Layer> layers, Map<String, FunctionDef> functions,
                            List<Constraint> constraints, Value result) {
        this.parameters = parameters;
        this.shapes = shapes;
        this.layers = layers;
        this.functions = functions;
        this.constraints = constraints;
        this.result = result;
    }

    static InterpretResult from(EvalContext ctx, Value result) {
        ScopeFrame global = ctx.env().global();
        return new InterpretResult(
                Collections.unmodifiableMap(new LinkedHashMap<>(global.parameters())),
                Collections.unmodifiableMap(new LinkedHashMap<>(global.shapes())),
                Collections.unmodifiableMap(new LinkedHashMap<>(global.layers())),
                Collections.unmodifiableMap(new LinkedHashMap<>(global.functions())),
                Collections.unmodifiableList(new ArrayList<>(ctx.constraints())),
                result);
    }

    public Map<String, Value> getParameters() { return parameters; }
    public Map<ShapeId, ShapeRecord> getShapes() { return shapes; }
    public Map<String, Layer> getLayers() { return layers; }
    public Map<String, FunctionDef> getFunctions() { return functions; }
    public List<Constraint> getConstraints() { return constraints; }
    public Value getResult() { return result; }

    /** Shapes keyed by their flat display names ({@code s_0}, {@code box_make_1}, ...). */
    public Map<String, ShapeRecord> shapesByName() {
        Map<String, ShapeRecord> out = new LinkedHashMap<>();
        for (Map.Entry<ShapeId, ShapeRecord> e : shapes.entrySet()) {
            out.put(e.getKey().render(), e.getValue());
        }
        return out;
    }
}
