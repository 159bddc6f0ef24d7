package com.otto.script.runtime;

import com.otto.script.error.ScriptException;
import com.otto.script.model.Value;
import com.otto.script.parser.Statement;

final class ControlFlow {

    private ControlFlow() {}

    static Outcome ifStatement(Interpreter in, Statement.If stmt, EvalContext ctx) {
        if (Expressions.isTruthy(in.evaluate(stmt.condition, ctx))) {
            return in.executeBlock(stmt.thenBranch, ctx);
        }
        if (stmt.elseBranch != null) {
            return in.executeBlock(stmt.elseBranch, ctx);
        }
        return Outcome.none();
    }

    /**
     * Inclusive range. No frame is pushed: the loop variable, and any parameter the body
     * sets, stays bound after the loop ends.
     */
    static Outcome forStatement(Interpreter in, Statement.For stmt, EvalContext ctx) {
        double start = Expressions.requireNumber(in.evaluate(stmt.from, ctx), "Loop start", stmt.variable);
        double end = Expressions.requireNumber(in.evaluate(stmt.to, ctx), "Loop end", stmt.variable);
        double step = stmt.step == null ? 1
                : Expressions.requireNumber(in.evaluate(stmt.step, ctx), "Loop step", stmt.variable);
        if (step <= 0) {
            throw new ScriptException("Loop step must be positive, got " + Value.formatNumber(step),
                    stmt.variable.line, stmt.variable.column);
        }

        String variable = stmt.variable.lexeme;
        Double outer = ctx.loopCounter();
        Value last = Value.nil();
        try {
            for (double i = start; i <= end; i += step) {
                ctx.env().setParameter(variable, Value.number(i));
                ctx.setLoopCounter(i);
                Outcome outcome = in.executeBlock(stmt.body, ctx);
                if (outcome.isReturn()) return outcome;
                last = outcome.value();
            }
        } finally {
            ctx.setLoopCounter(outer);
        }
        return Outcome.normal(last);
    }
}
