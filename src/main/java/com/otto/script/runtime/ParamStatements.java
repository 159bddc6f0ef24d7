package com.otto.script.runtime;

import com.otto.script.model.Value;
import com.otto.script.parser.Statement;

final class ParamStatements {

    private ParamStatements() {}

    /** Binds in the current frame; inside a loop body that is the enclosing frame, so the binding outlives the loop. */
    static Outcome param(Interpreter in, Statement.ParamStmt stmt, EvalContext ctx) {
        Value value = in.evaluate(stmt.value, ctx);
        ctx.env().setParameter(stmt.name.lexeme, value);
        return Outcome.normal(value);
    }
}
