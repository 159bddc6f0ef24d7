package com.otto.script.runtime;

import com.otto.script.error.ArityException;
import com.otto.script.model.FunctionDef;
import com.otto.script.model.Value;
import com.otto.script.parser.Expr;
import com.otto.script.parser.Statement;
import com.otto.script.parser.Token;

import java.util.ArrayList;
import java.util.List;

final class FunctionStatements {

    private FunctionStatements() {}

    /** Stores the definition in the current frame; a redefinition replaces it and restarts its call numbering. */
    static Outcome define(Statement.FunctionStmt stmt, EvalContext ctx) {
        List<String> params = new ArrayList<>(stmt.params.size());
        for (Token p : stmt.params) params.add(p.lexeme);
        String name = stmt.name.lexeme;

        ctx.env().defineFunction(new FunctionDef(name, params, stmt.body));
        ctx.resetCallCounter(name);
        return Outcome.normal(Value.func(name));
    }

    /**
     * The call takes its ordinal before the arguments are evaluated, so in {@code f(f(1))} the outer call is 1.
     * Arguments are evaluated in the caller's frame, then bound in a fresh child frame.
     * The value is whatever {@code return} produced, otherwise the last statement's value.
     */
    static Value call(Interpreter in, Expr.Call expr, EvalContext ctx) {
        String name = expr.callee.lexeme;
        FunctionDef fn = ctx.env().getFunction(name);
        if (expr.arguments.size() != fn.arity()) {
            throw new ArityException(name + "() expects " + fn.arity() + " argument"
                    + (fn.arity() == 1 ? "" : "s") + ", got " + expr.arguments.size());
        }

        EvalContext.FunctionContext previous = ctx.functionContext();
        ctx.setFunctionContext(ctx.enterCall(name));
        try {
            List<Value> args = new ArrayList<>(expr.arguments.size());
            for (Expr.ExprInterface arg : expr.arguments) args.add(in.evaluate(arg, ctx));

            ctx.env().pushScope();
            try {
                for (int i = 0; i < args.size(); i++) {
                    ctx.env().setParameter(fn.getParams().get(i), args.get(i));
                }
                return in.executeBlock(fn.getBody(), ctx).value();
            } finally {
                ctx.env().popScope();
            }
        } finally {
            ctx.setFunctionContext(previous);
        }
    }

    static Outcome returnStatement(Interpreter in, Statement.ReturnStmt stmt, EvalContext ctx) {
        Value value = stmt.value == null ? Value.nil() : in.evaluate(stmt.value, ctx);
        return Outcome.returned(value);
    }
}
