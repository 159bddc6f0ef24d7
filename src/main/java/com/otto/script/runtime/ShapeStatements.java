package com.otto.script.runtime;

import com.otto.script.error.ScriptException;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.ShapeTransform;
import com.otto.script.model.ShapeType;
import com.otto.script.model.Value;
import com.otto.script.parser.Expr;
import com.otto.script.parser.Statement;
import com.otto.script.parser.Token;

import java.util.LinkedHashMap;
import java.util.Map;

final class ShapeStatements {

    private ShapeStatements() {}

    static Outcome shape(Interpreter in, Statement.ShapeStmt stmt, EvalContext ctx) {
        ShapeType type = ShapeType.fromName(stmt.type.lexeme);
        if (type == null) {
            throw new ScriptException("Unknown shape type: " + stmt.type.lexeme, stmt.type.line, stmt.type.column);
        }
        String name = stmt.name != null ? stmt.name.lexeme : ctx.nextUnnamed(type);

        Map<String, Value> params = new LinkedHashMap<>();
        for (Map.Entry<String, Expr.ExprInterface> e : stmt.properties.entrySet()) {
            Value v = in.evaluate(e.getValue(), ctx);
            params.put(e.getKey(), ShapeStyling.normalize(e.getKey(), v));
        }
        ShapeTransform transform = extractTransform(params, stmt.type);
        ShapeStyling.applyFillDefaults(type, params);

        ShapeRecord shape = new ShapeRecord(type, ctx.nextRecordId(type, name), params, transform);
        register(name, shape, ctx);
        return Outcome.normal(Value.shape(shape));
    }

    /**
     * Shapes made during a function call go to the global frame so they survive the call;
     * elsewhere they go to the current frame, one entry per loop iteration.
     */
    static void register(String name, ShapeRecord shape, EvalContext ctx) {
        if (ctx.functionContext() != null) {
            ctx.env().defineGlobalShape(ctx.scopedShapeId(name), shape);
        } else if (ctx.loopCounter() != null) {
            ctx.env().addShape(name, ctx.loopCounter(), shape);
        } else {
            ctx.env().defineGlobalShape(ShapeId.plain(name), shape);
        }
    }

    /** Moves position, rotation and scale out of the parameter map into a transform. */
    private static ShapeTransform extractTransform(Map<String, Value> params, Token at) {
        ShapeTransform t = ShapeTransform.identity();

        Value position = params.remove("position");
        if (position != null) {
            double[] p = Expressions.requirePoint(position, "position", at);
            t.setPosition(p[0], p[1]);
        }

        Value rotation = params.remove("rotation");
        if (rotation != null) {
            t.setRotation(Expressions.requireNumber(rotation, "rotation", at));
        }

        Value scale = params.remove("scale");
        if (scale != null) {
            if (scale.isNumber()) {
                t.setScale(scale.asNumber(), scale.asNumber());
            } else {
                double[] s = Expressions.requirePoint(scale, "scale", at);
                t.setScale(s[0], s[1]);
            }
        }
        return t;
    }
}
