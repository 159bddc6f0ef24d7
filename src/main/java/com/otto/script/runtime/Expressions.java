package com.otto.script.runtime;

import com.otto.script.error.NameNotFoundException;
import com.otto.script.error.ScriptArithmeticException;
import com.otto.script.error.ScriptException;
import com.otto.script.model.ColorTable;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.Value;
import com.otto.script.parser.Expr;
import com.otto.script.parser.Token;

import java.util.ArrayList;
import java.util.List;

/** Expression evaluation. Stateless; the interpreter passes itself for nested evaluation. */
final class Expressions {

    private Expressions() {}

    static Value literal(Expr.Literal expr) {
        Object v = expr.value;
        if (v instanceof Double) return Value.number((Double) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        if (v instanceof String) return Value.string((String) v);
        return Value.nil();
    }

    static Value color(Expr.ColorLiteral expr) {
        return Value.string(ColorTable.resolve(expr.color));
    }

    static Value variable(Expr.Variable expr, EvalContext ctx) {
        String name = expr.name.lexeme;
        Value v = ctx.env().current().findParameter(name);
        if (v != null) return v;
        // `null` reads as 0
        if (name.equals("null")) return Value.number(0);
        throw new NameNotFoundException("Parameter not found: " + name);
    }

    static Value binary(Interpreter in, Expr.Binary expr, EvalContext ctx) {
        Value left = in.evaluate(expr.left, ctx);
        Value right = in.evaluate(expr.right, ctx);

        switch (expr.operator.type) {
            case PLUS:
                if (left.isNumber() && right.isNumber()) return Value.number(left.asNumber() + right.asNumber());
                if (left.isString() || right.isString()) return Value.string(left.toString() + right.toString());
                throw operandError(expr.operator, "numbers or strings", left, right);
            case MINUS:
                checkNumbers(expr.operator, left, right);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                checkNumbers(expr.operator, left, right);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                checkNumbers(expr.operator, left, right);
                if (right.asNumber() == 0) throw new ScriptArithmeticException("Division by zero");
                return Value.number(left.asNumber() / right.asNumber());
            default:
                throw new ScriptException("Unknown operator: " + expr.operator.lexeme,
                        expr.operator.line, expr.operator.column);
        }
    }

    static Value comparison(Interpreter in, Expr.Comparison expr, EvalContext ctx) {
        Value left = in.evaluate(expr.left, ctx);
        Value right = in.evaluate(expr.right, ctx);

        switch (expr.operator.type) {
            case EQUAL_EQUAL: return Value.bool(left.equals(right));
            case BANG_EQUAL: return Value.bool(!left.equals(right));
            default:
                break;
        }

        int cmp;
        if (left.isNumber() && right.isNumber()) {
            cmp = Double.compare(left.asNumber(), right.asNumber());
        } else if (left.isString() && right.isString()) {
            cmp = left.asString().compareTo(right.asString());
        } else {
            throw operandError(expr.operator, "two numbers or two strings", left, right);
        }

        switch (expr.operator.type) {
            case LESS: return Value.bool(cmp < 0);
            case LESS_EQUAL: return Value.bool(cmp <= 0);
            case GREATER: return Value.bool(cmp > 0);
            case GREATER_EQUAL: return Value.bool(cmp >= 0);
            default:
                throw new ScriptException("Unknown comparison: " + expr.operator.lexeme,
                        expr.operator.line, expr.operator.column);
        }
    }

    static Value logical(Interpreter in, Expr.Logical expr, EvalContext ctx) {
        boolean left = isTruthy(in.evaluate(expr.left, ctx));
        switch (expr.operator.type) {
            case OR:
                if (left) return Value.bool(true);
                return Value.bool(isTruthy(in.evaluate(expr.right, ctx)));
            case AND:
                if (!left) return Value.bool(false);
                return Value.bool(isTruthy(in.evaluate(expr.right, ctx)));
            default:
                throw new ScriptException("Unknown logical operator: " + expr.operator.lexeme,
                        expr.operator.line, expr.operator.column);
        }
    }

    static Value unary(Interpreter in, Expr.Unary expr, EvalContext ctx) {
        Value right = in.evaluate(expr.right, ctx);
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!isTruthy(right));
            case MINUS:
                if (!right.isNumber()) throw operandError(expr.operator, "a number", right, null);
                return Value.number(-right.asNumber());
            default:
                throw new ScriptException("Unknown unary operator: " + expr.operator.lexeme,
                        expr.operator.line, expr.operator.column);
        }
    }

    static Value ternary(Interpreter in, Expr.Ternary expr, EvalContext ctx) {
        return isTruthy(in.evaluate(expr.condition, ctx))
                ? in.evaluate(expr.thenBranch, ctx)
                : in.evaluate(expr.elseBranch, ctx);
    }

    static Value array(Interpreter in, Expr.ArrayLiteral expr, EvalContext ctx) {
        List<Value> out = new ArrayList<>(expr.elements.size());
        for (Expr.ExprInterface e : expr.elements) out.add(in.evaluate(e, ctx));
        return Value.array(out);
    }

    static Value index(Interpreter in, Expr.Index expr, EvalContext ctx) {
        String name = expr.name.lexeme;
        Value target = ctx.env().getParameter(name);
        for (Expr.ExprInterface indexExpr : expr.indices) {
            if (!target.isArray()) {
                throw new ScriptException(name + " is not an array", expr.name.line, expr.name.column);
            }
            Value idx = in.evaluate(indexExpr, ctx);
            if (!idx.isNumber()) {
                throw new ScriptException("Array index for " + name + " must be a number, got " + idx.type,
                        expr.name.line, expr.name.column);
            }
            List<Value> items = target.asArray();
            int i = (int) Math.floor(idx.asNumber());
            if (i < 0 || i >= items.size()) {
                throw new ScriptException("Array index " + i + " out of bounds for " + name
                        + " (length " + items.size() + ")", expr.name.line, expr.name.column);
            }
            target = items.get(i);
        }
        return target;
    }

    /** {@code name.prop}: {@code length} of an array or string parameter, else a parameter of a shape with that name. */
    static Value property(Expr.PropertyRef expr, EvalContext ctx) {
        String name = expr.name.lexeme;
        String prop = expr.property.lexeme;

        Value param = ctx.env().current().findParameter(name);
        if (param != null) {
            if (!"length".equals(prop)) return Value.nil();
            if (param.isArray()) return Value.number(param.asArray().size());
            if (param.isString()) return Value.number(param.asString().length());
            return Value.nil();
        }

        ShapeRecord shape = ctx.env().findShape(name);
        if (shape != null) return shape.getParam(prop);

        throw new NameNotFoundException("Parameter not found: " + name);
    }

    static boolean isTruthy(Value v) {
        if (v == null) return false;
        switch (v.type) {
            case NULL: return false;
            case BOOL: return v.asBool();
            case NUMBER: return v.asNumber() != 0;
            case STRING: return !v.asString().isEmpty();
            case ARRAY: return !v.asArray().isEmpty();
            default: return true;
        }
    }

    static double requireNumber(Value v, String what, Token at) {
        if (!v.isNumber()) {
            throw new ScriptException(what + " must be a number, got " + v.type,
                    at == null ? null : at.line, at == null ? null : at.column);
        }
        return v.asNumber();
    }

    /** {@code [x, y]} with numeric entries. */
    static double[] requirePoint(Value v, String what, Token at) {
        if (v.isArray() && v.asArray().size() >= 2
                && v.asArray().get(0).isNumber() && v.asArray().get(1).isNumber()) {
            return new double[]{v.asArray().get(0).asNumber(), v.asArray().get(1).asNumber()};
        }
        throw new ScriptException(what + " must be [x, y], got " + v,
                at == null ? null : at.line, at == null ? null : at.column);
    }

    private static void checkNumbers(Token operator, Value left, Value right) {
        if (!left.isNumber() || !right.isNumber()) throw operandError(operator, "numbers", left, right);
    }

    private static ScriptException operandError(Token operator, String expected, Value left, Value right) {
        String got = right == null ? left.type.toString() : left.type + " and " + right.type;
        return new ScriptException("Operands of '" + operator.lexeme + "' must be " + expected + ", got " + got,
                operator.line, operator.column);
    }
}
