package com.otto.script;

import com.otto.debug.Debug;
import com.otto.script.error.ScriptException;
import com.otto.script.geometry.BooleanEngine;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.Value;
import com.otto.script.parser.Lexer;
import com.otto.script.parser.Parser;
import com.otto.script.parser.Statement.Stmt;
import com.otto.script.parser.Token;
import com.otto.script.runtime.InterpretResult;
import com.otto.script.runtime.Interpreter;
import com.otto.script.store.ParameterStore;
import com.otto.script.store.ShapeFactory;
import com.otto.script.store.ShapeStore;
import com.otto.script.store.StoredParameter;
import com.otto.script.store.StoredShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a script and copies its parameters and shapes into the external stores.
 *
 * Stores are only touched after evaluation succeeds; a failing script leaves them exactly
 * as they were. Every script error is reported through the returned {@link RunResult}.
 */
public class ScriptRunner {

    private static final String TAG = "ScriptRunner";

    private final ShapeStore shapeStore;
    private final ParameterStore parameterStore;
    private final ShapeFactory shapeFactory;
    private final BooleanEngine booleanEngine;

    public ScriptRunner(ShapeStore shapeStore, ParameterStore parameterStore, ShapeFactory shapeFactory) {
        this(shapeStore, parameterStore, shapeFactory, BooleanEngine.withDefaults());
    }

    public ScriptRunner(ShapeStore shapeStore, ParameterStore parameterStore, ShapeFactory shapeFactory,
                        BooleanEngine booleanEngine) {
        this.shapeStore = shapeStore;
        this.parameterStore = parameterStore;
        this.shapeFactory = shapeFactory;
        this.booleanEngine = booleanEngine;
    }

    public RunResult run(String source) {
        return run(source, RunOptions.defaults());
    }

    public RunResult run(String source, RunOptions options) {
        Debug.get().i(TAG, "Run started");
        InterpretResult result;
        try {
            result = interpret(source);
        } catch (ScriptException e) {
            Debug.get().e(TAG, "Script failed: " + e.getMessage());
            return RunResult.failure(e.getMessage(), e.getLine(), e.getColumn());
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "Script failed unexpectedly", e);
            return RunResult.failure(e.getMessage() == null ? e.toString() : e.getMessage(), null, null);
        }

        if (options.clearShapes()) clearShapes();
        if (options.clearParameters()) clearParameters();

        int parametersCreated = applyParameters(result.getParameters());
        int shapesCreated = applyShapes(result.getShapes());
        Debug.get().i(TAG, "Run finished: " + shapesCreated + " shape(s), " + parametersCreated + " parameter(s)");
        return RunResult.success(shapesCreated, parametersCreated, result);
    }

    /** Lex, parse and evaluate without touching any store. */
    public InterpretResult interpret(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        List<Stmt> program = new Parser(tokens).parse();
        Debug.get().d(TAG, "Parsed " + program.size() + " statement(s)");
        return new Interpreter(booleanEngine).interpret(program);
    }

    private void clearShapes() {
        for (StoredShape s : new ArrayList<>(shapeStore.getAll())) shapeStore.remove(s.getId());
    }

    private void clearParameters() {
        for (StoredParameter p : new ArrayList<>(parameterStore.getAll())) parameterStore.remove(p.getId());
    }

    /** Existing parameters are updated by name, new ones created. Non-numeric values store as 0. */
    private int applyParameters(Map<String, Value> parameters) {
        int count = 0;
        for (Map.Entry<String, Value> e : parameters.entrySet()) {
            double value = e.getValue().numberOr(0);
            StoredParameter existing = parameterStore.getByName(e.getKey());
            if (existing != null) {
                parameterStore.setValue(existing.getId(), value);
            } else {
                parameterStore.add(e.getKey(), value);
            }
            count++;
        }
        return count;
    }

    private int applyShapes(Map<ShapeId, ShapeRecord> shapes) {
        int count = 0;
        for (Map.Entry<ShapeId, ShapeRecord> e : shapes.entrySet()) {
            ShapeRecord shape = e.getValue();
            if (shape.isConsumedByBoolean()) continue;

            String type = shape.getType().typeName();
            if (!shapeFactory.supports(type)) {
                Debug.get().w(TAG, "Skipping shape '" + e.getKey().render() + "': unsupported type " + type);
                continue;
            }
            shapeStore.add(shapeFactory.create(e.getKey().render(), shape));
            count++;
        }
        return count;
    }
}
