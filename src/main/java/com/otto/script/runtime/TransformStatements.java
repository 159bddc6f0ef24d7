package com.otto.script.runtime;

import com.otto.script.error.NameNotFoundException;
import com.otto.script.model.Layer;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.ShapeTransform;
import com.otto.script.model.Value;
import com.otto.script.parser.Statement;

import java.util.List;

final class TransformStatements {

    private TransformStatements() {}

    /** Targets a shape first, then a layer with that name. */
    static Outcome transform(Interpreter in, Statement.TransformStmt stmt, EvalContext ctx) {
        String name = stmt.target.lexeme;
        ShapeTransform target;
        ShapeRecord shape = ctx.env().findShape(name);
        if (shape != null) {
            target = shape.getTransform();
        } else {
            Layer layer = ctx.env().findLayer(name);
            if (layer == null) throw new NameNotFoundException("Transform target not found: " + name);
            target = layer.getTransform();
        }
        apply(in, target, stmt.operations, ctx);
        return Outcome.none();
    }

    private static void apply(Interpreter in, ShapeTransform target, List<Statement.TransformOp> ops, EvalContext ctx) {
        for (Statement.TransformOp op : ops) {
            Value v = in.evaluate(op.value, ctx);
            switch (op.kind) {
                case SCALE:
                    if (v.isNumber()) {
                        target.setScale(v.asNumber(), v.asNumber());
                    } else {
                        double[] s = Expressions.requirePoint(v, "scale", op.token);
                        target.setScale(s[0], s[1]);
                    }
                    break;
                case ROTATE:
                    target.rotateBy(Expressions.requireNumber(v, "rotate", op.token));
                    break;
                case POSITION: {
                    double[] p = Expressions.requirePoint(v, "position", op.token);
                    target.setPosition(p[0], p[1]);
                    break;
                }
                case IF:
                    if (Expressions.isTruthy(v)) apply(in, target, op.body, ctx);
                    break;
                default:
                    throw new IllegalStateException("Unhandled transform operation " + op.kind);
            }
        }
    }
}
