package com.otto.script.runtime;

import com.otto.debug.Debug;
import com.otto.script.geometry.Contours;
import com.otto.script.model.ColorTable;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.ShapeTransform;
import com.otto.script.model.ShapeType;
import com.otto.script.model.Value;
import com.otto.script.parser.Statement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class DrawStatements {

    private static final String TAG = "Draw";

    private DrawStatements() {}

    /** Runs the pen commands and turns the strokes into an open, unfilled path shape. */
    static Outcome draw(Interpreter in, Statement.DrawStmt stmt, EvalContext ctx) {
        TurtleDrawer turtle = ctx.turtle();
        turtle.reset();

        for (Statement.DrawCommand cmd : stmt.commands) {
            switch (cmd.op) {
                case FORWARD:
                    turtle.forward(Expressions.requireNumber(in.evaluate(cmd.value, ctx), "forward distance", cmd.token));
                    break;
                case BACKWARD:
                    turtle.backward(Expressions.requireNumber(in.evaluate(cmd.value, ctx), "backward distance", cmd.token));
                    break;
                case RIGHT:
                    turtle.right(Expressions.requireNumber(in.evaluate(cmd.value, ctx), "right angle", cmd.token));
                    break;
                case LEFT:
                    turtle.left(Expressions.requireNumber(in.evaluate(cmd.value, ctx), "left angle", cmd.token));
                    break;
                case GOTO: {
                    double[] p = Expressions.requirePoint(in.evaluate(cmd.value, ctx), "goto target", cmd.token);
                    turtle.moveTo(p[0], p[1]);
                    break;
                }
                case PENUP:
                    turtle.penUp();
                    break;
                case PENDOWN:
                    turtle.penDown();
                    break;
                default:
                    throw new IllegalStateException("Unhandled draw command " + cmd.op);
            }
        }

        List<List<double[]>> paths = turtle.getDrawingPaths();
        if (paths.isEmpty()) {
            Debug.get().d(TAG, "draw at line " + stmt.keyword.line + " produced no strokes");
            return Outcome.none();
        }

        List<double[]> flat = new ArrayList<>();
        List<Value> subPaths = new ArrayList<>(paths.size());
        for (List<double[]> path : paths) {
            flat.addAll(path);
            subPaths.add(Contours.polyline(path));
        }

        Map<String, Value> params = new LinkedHashMap<>();
        params.put("points", Contours.polyline(flat));
        params.put("subPaths", Value.array(subPaths));
        params.put("isTurtlePath", Value.bool(true));
        params.put("closed", Value.bool(false));
        params.put("fill", Value.bool(false));
        params.put("strokeColor", Value.string(ColorTable.DEFAULT_STROKE));
        params.put("strokeWidth", Value.number(2));

        String name = stmt.name != null ? stmt.name.lexeme : ctx.nextUnnamed(ShapeType.PATH);
        ShapeRecord shape = new ShapeRecord(ShapeType.PATH, ctx.nextRecordId(ShapeType.PATH, name), params,
                ShapeTransform.identity());
        ctx.env().defineGlobalShape(ShapeId.plain(name), shape);
        return Outcome.normal(Value.shape(shape));
    }
}
