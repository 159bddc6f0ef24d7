package com.otto.script.runtime;

import com.otto.debug.Debug;
import com.otto.script.model.ColorTable;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.Value;
import com.otto.script.parser.Expr;
import com.otto.script.parser.Statement;

import java.util.Map;

/** {@code fill} and {@code style}. A missing target shape is logged and skipped. */
final class StyleStatements {

    private static final String TAG = "Style";

    private StyleStatements() {}

    static Outcome fill(Interpreter in, Statement.FillStmt stmt, EvalContext ctx) {
        ShapeRecord shape = ctx.env().findShape(stmt.target.lexeme);
        if (shape == null) {
            Debug.get().w(TAG, "fill: shape '" + stmt.target.lexeme + "' not found (line " + stmt.target.line + ")");
            return Outcome.none();
        }

        if (stmt.value == null) {
            shape.setParam("fill", Value.bool(true));
            shape.setParam("fillColor", Value.string(ColorTable.DEFAULT_FILL));
            return Outcome.none();
        }

        Value v = in.evaluate(stmt.value, ctx);
        if (v.type == Value.Type.BOOL) {
            shape.setParam("fill", v);
            if (v.asBool()) shape.setParam("fillColor", Value.string(ColorTable.DEFAULT_FILL));
        } else if (v.isString()) {
            shape.setParam("fill", Value.bool(true));
            shape.setParam("fillColor", Value.string(ColorTable.resolve(v.asString())));
        } else {
            Debug.get().w(TAG, "fill: unsupported value " + v + " for '" + stmt.target.lexeme + "'");
        }
        return Outcome.none();
    }

    static Outcome style(Interpreter in, Statement.StyleStmt stmt, EvalContext ctx) {
        ShapeRecord shape = ctx.env().findShape(stmt.target.lexeme);
        if (shape == null) {
            Debug.get().w(TAG, "style: shape '" + stmt.target.lexeme + "' not found (line " + stmt.target.line + ")");
            return Outcome.none();
        }
        for (Map.Entry<String, Expr.ExprInterface> e : stmt.properties.entrySet()) {
            Value v = in.evaluate(e.getValue(), ctx);
            shape.setParam(e.getKey(), ShapeStyling.normalize(e.getKey(), v));
        }
        return Outcome.none();
    }
}
