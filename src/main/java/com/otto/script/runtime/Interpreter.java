package com.otto.script.runtime;

import com.otto.script.geometry.BooleanEngine;
import com.otto.script.model.Value;
import com.otto.script.parser.Expr;
import com.otto.script.parser.Statement;
import com.otto.script.parser.Statement.Stmt;

import java.util.List;

/**
 * Tree-walking evaluator. Dispatches every node to the handler for its construct; all
 * mutable state lives in the {@link EvalContext} passed along, so one interpreter can run
 * any number of scripts.
 */
public class Interpreter implements Expr.ExprVisitor<Value, EvalContext>, Statement.StmtVisitor<Outcome, EvalContext> {

    private final BooleanEngine engine;

    public Interpreter() {
        this(BooleanEngine.withDefaults());
    }

    public Interpreter(BooleanEngine engine) {
        this.engine = engine;
    }

    public InterpretResult interpret(List<Stmt> program) {
        EvalContext ctx = new EvalContext(engine);
        ctx.naming().reset();

        Value last = Value.nil();
        for (Stmt stmt : program) {
            last = execute(stmt, ctx).value();
        }
        return InterpretResult.from(ctx, last);
    }

    public Value evaluate(Expr.ExprInterface expr, EvalContext ctx) {
        return expr.accept(this, ctx);
    }

    public Outcome execute(Stmt stmt, EvalContext ctx) {
        return stmt.accept(this, ctx);
    }

    /** Runs statements in order; stops at the first return. Otherwise yields the last value. */
    public Outcome executeBlock(List<Stmt> body, EvalContext ctx) {
        Value last = Value.nil();
        for (Stmt stmt : body) {
            Outcome outcome = execute(stmt, ctx);
            if (outcome.isReturn()) return outcome;
            last = outcome.value();
        }
        return Outcome.normal(last);
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override public Value visitLiteralExpr(Expr.Literal expr, EvalContext ctx) { return Expressions.literal(expr); }
    @Override public Value visitColorExpr(Expr.ColorLiteral expr, EvalContext ctx) { return Expressions.color(expr); }
    @Override public Value visitVariableExpr(Expr.Variable expr, EvalContext ctx) { return Expressions.variable(expr, ctx); }
    @Override public Value visitBinaryExpr(Expr.Binary expr, EvalContext ctx) { return Expressions.binary(this, expr, ctx); }
    @Override public Value visitComparisonExpr(Expr.Comparison expr, EvalContext ctx) { return Expressions.comparison(this, expr, ctx); }
    @Override public Value visitLogicalExpr(Expr.Logical expr, EvalContext ctx) { return Expressions.logical(this, expr, ctx); }
    @Override public Value visitUnaryExpr(Expr.Unary expr, EvalContext ctx) { return Expressions.unary(this, expr, ctx); }
    @Override public Value visitTernaryExpr(Expr.Ternary expr, EvalContext ctx) { return Expressions.ternary(this, expr, ctx); }
    @Override public Value visitArrayExpr(Expr.ArrayLiteral expr, EvalContext ctx) { return Expressions.array(this, expr, ctx); }
    @Override public Value visitIndexExpr(Expr.Index expr, EvalContext ctx) { return Expressions.index(this, expr, ctx); }
    @Override public Value visitCallExpr(Expr.Call expr, EvalContext ctx) { return FunctionStatements.call(this, expr, ctx); }
    @Override public Value visitPropertyExpr(Expr.PropertyRef expr, EvalContext ctx) { return Expressions.property(expr, ctx); }

    // -------------------------
    // Statements
    // -------------------------

    @Override public Outcome visitParamStmt(Statement.ParamStmt stmt, EvalContext ctx) { return ParamStatements.param(this, stmt, ctx); }
    @Override public Outcome visitShapeStmt(Statement.ShapeStmt stmt, EvalContext ctx) { return ShapeStatements.shape(this, stmt, ctx); }
    @Override public Outcome visitLayerStmt(Statement.LayerStmt stmt, EvalContext ctx) { return LayerStatements.layer(this, stmt, ctx); }
    @Override public Outcome visitTransformStmt(Statement.TransformStmt stmt, EvalContext ctx) { return TransformStatements.transform(this, stmt, ctx); }
    @Override public Outcome visitIfStmt(Statement.If stmt, EvalContext ctx) { return ControlFlow.ifStatement(this, stmt, ctx); }
    @Override public Outcome visitForStmt(Statement.For stmt, EvalContext ctx) { return ControlFlow.forStatement(this, stmt, ctx); }
    @Override public Outcome visitFunctionStmt(Statement.FunctionStmt stmt, EvalContext ctx) { return FunctionStatements.define(stmt, ctx); }
    @Override public Outcome visitCallStmt(Statement.CallStmt stmt, EvalContext ctx) { return Outcome.normal(FunctionStatements.call(this, stmt.call, ctx)); }
    @Override public Outcome visitReturnStmt(Statement.ReturnStmt stmt, EvalContext ctx) { return FunctionStatements.returnStatement(this, stmt, ctx); }
    @Override public Outcome visitDrawStmt(Statement.DrawStmt stmt, EvalContext ctx) { return DrawStatements.draw(this, stmt, ctx); }
    @Override public Outcome visitBooleanStmt(Statement.BooleanStmt stmt, EvalContext ctx) { return BooleanStatements.combine(stmt, ctx); }
    @Override public Outcome visitFillStmt(Statement.FillStmt stmt, EvalContext ctx) { return StyleStatements.fill(this, stmt, ctx); }
    @Override public Outcome visitStyleStmt(Statement.StyleStmt stmt, EvalContext ctx) { return StyleStatements.style(this, stmt, ctx); }
    @Override public Outcome visitConstraintsStmt(Statement.ConstraintsStmt stmt, EvalContext ctx) { return ConstraintStatements.constraints(this, stmt, ctx); }
}
