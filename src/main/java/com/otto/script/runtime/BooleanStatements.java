package com.otto.script.runtime;

import com.otto.script.error.NameNotFoundException;
import com.otto.script.geometry.BooleanOperand;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.Value;
import com.otto.script.parser.Statement;
import com.otto.script.parser.Token;

import java.util.ArrayList;
import java.util.List;

final class BooleanStatements {

    private BooleanStatements() {}

    /**
     * Combines the named shapes, flags them as consumed and registers the result under the
     * block's name. The result's own id is the generated {@code <first>_<symbol><n>} name.
     */
    static Outcome combine(Statement.BooleanStmt stmt, EvalContext ctx) {
        List<BooleanOperand> operands = new ArrayList<>(stmt.operands.size());
        List<Value> names = new ArrayList<>(stmt.operands.size());
        for (Token operand : stmt.operands) {
            ShapeRecord shape = ctx.env().findShape(operand.lexeme);
            if (shape == null) {
                throw new NameNotFoundException("Error in boolean operation " + stmt.operation.tag()
                        + ": Shape not found: " + operand.lexeme);
            }
            operands.add(new BooleanOperand(operand.lexeme, shape));
            names.add(Value.string(operand.lexeme));
        }

        ShapeRecord result = ctx.engine().apply(stmt.operation, operands, ctx.naming());
        for (BooleanOperand operand : operands) {
            operand.getShape().markConsumedByBoolean();
        }
        result.setParam("operands", Value.array(names));

        ShapeStatements.register(stmt.name.lexeme, result, ctx);
        return Outcome.normal(Value.shape(result));
    }
}
