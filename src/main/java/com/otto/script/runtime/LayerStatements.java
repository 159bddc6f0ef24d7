package com.otto.script.runtime;

import com.otto.script.model.Layer;
import com.otto.script.model.Value;
import com.otto.script.parser.Statement;

import java.util.List;

final class LayerStatements {

    private LayerStatements() {}

    static Outcome layer(Interpreter in, Statement.LayerStmt stmt, EvalContext ctx) {
        Layer layer = ctx.env().createLayer(stmt.name.lexeme);
        apply(in, layer, stmt.commands, ctx);
        return Outcome.normal(Value.layer(layer));
    }

    private static void apply(Interpreter in, Layer layer, List<Statement.LayerCommand> commands, EvalContext ctx) {
        for (Statement.LayerCommand cmd : commands) {
            switch (cmd.kind) {
                case ADD:
                    ctx.env().addShapeToLayer(layer.getName(), cmd.shape.lexeme);
                    break;
                case SUBTRACT:
                    layer.recordSubtract(cmd.shape.lexeme);
                    break;
                case ROTATE:
                    layer.rotate(Expressions.requireNumber(in.evaluate(cmd.value, ctx), "Layer rotation", cmd.token));
                    break;
                case IF:
                    if (Expressions.isTruthy(in.evaluate(cmd.value, ctx))) apply(in, layer, cmd.body, ctx);
                    break;
                default:
                    throw new IllegalStateException("Unhandled layer command " + cmd.kind);
            }
        }
    }
}
