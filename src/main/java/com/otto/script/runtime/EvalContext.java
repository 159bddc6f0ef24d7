package com.otto.script.runtime;

import com.otto.script.geometry.BooleanEngine;
import com.otto.script.geometry.BooleanNaming;
import com.otto.script.model.Constraint;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything that changes while one script runs. A fresh context is built for every
 * {@link Interpreter#interpret} call; the statement and expression handlers keep no state.
 */
public final class EvalContext {

    /** The function call currently executing: name plus its per-function call ordinal. */
    public static final class FunctionContext {
        public final String name;
        public final int callId;

        FunctionContext(String name, int callId) {
            this.name = name;
            this.callId = callId;
        }
    }

    private final Environment env = new Environment();
    private final BooleanEngine engine;
    private final BooleanNaming naming = new BooleanNaming();
    private final TurtleDrawer turtle = new TurtleDrawer();
    private final List<Constraint> constraints = new ArrayList<>();

    private final Map<String, Integer> callCounters = new HashMap<>();
    private final Map<ShapeType, Integer> unnamedCounters = new EnumMap<>(ShapeType.class);
    private int shapeSequence = 0;

    private Double loopCounter;
    private FunctionContext functionContext;

    EvalContext(BooleanEngine engine) {
        this.engine = engine;
    }

    public Environment env() { return env; }
    public BooleanEngine engine() { return engine; }
    public BooleanNaming naming() { return naming; }
    public TurtleDrawer turtle() { return turtle; }
    public List<Constraint> constraints() { return constraints; }

    public Double loopCounter() { return loopCounter; }
    void setLoopCounter(Double loopCounter) { this.loopCounter = loopCounter; }

    public FunctionContext functionContext() { return functionContext; }
    void setFunctionContext(FunctionContext functionContext) { this.functionContext = functionContext; }

    FunctionContext enterCall(String functionName) {
        int callId = callCounters.merge(functionName, 1, Integer::sum);
        return new FunctionContext(functionName, callId);
    }

    void resetCallCounter(String functionName) {
        callCounters.put(functionName, 0);
    }

    /** Id for a shape named in a script, qualified by the active call or loop iteration. */
    ShapeId scopedShapeId(String name) {
        if (functionContext != null) return ShapeId.inCall(name, functionContext.name, functionContext.callId);
        if (loopCounter != null) return ShapeId.inLoop(name, loopCounter);
        return ShapeId.plain(name);
    }

    String nextUnnamed(ShapeType type) {
        return type.typeName() + unnamedCounters.merge(type, 1, Integer::sum);
    }

    /** Deterministic record id: {@code <type>_<name>_<sequence>}. */
    String nextRecordId(ShapeType type, String name) {
        return type.typeName() + "_" + name + "_" + (++shapeSequence);
    }
}
