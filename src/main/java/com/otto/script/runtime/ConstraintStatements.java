package com.otto.script.runtime;

import com.otto.script.model.Constraint;
import com.otto.script.parser.Statement;

final class ConstraintStatements {

    private ConstraintStatements() {}

    static Outcome constraints(Interpreter in, Statement.ConstraintsStmt stmt, EvalContext ctx) {
        for (Statement.ConstraintItem item : stmt.items) {
            Double distance = null;
            if (item.distance != null) {
                distance = Expressions.requireNumber(in.evaluate(item.distance, ctx), "Constraint distance", null);
            }
            ctx.constraints().add(new Constraint(item.kind, item.a, item.b, distance));
        }
        return Outcome.none();
    }
}
