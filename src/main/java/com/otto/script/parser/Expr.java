package com.otto.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R, C> R accept(ExprVisitor<R, C> visitor, C context);
    }

    public interface ExprVisitor<R, C> {
        R visitLiteralExpr(Literal expr, C context);
        R visitColorExpr(ColorLiteral expr, C context);
        R visitVariableExpr(Variable expr, C context);
        R visitBinaryExpr(Binary expr, C context);
        R visitComparisonExpr(Comparison expr, C context);
        R visitLogicalExpr(Logical expr, C context);
        R visitUnaryExpr(Unary expr, C context);
        R visitTernaryExpr(Ternary expr, C context);
        R visitArrayExpr(ArrayLiteral expr, C context);
        R visitIndexExpr(Index expr, C context);
        R visitCallExpr(Call expr, C context);
        R visitPropertyExpr(PropertyRef expr, C context);
    }

    // -------------------------
    // Literals
    // -------------------------

    /** Number (Double), string or boolean constant. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitLiteralExpr(this, context);
        }
    }

    /** Hex color or color name; names resolve to hex at evaluation. */
    public static final class ColorLiteral implements ExprInterface {
        public final Token token;
        public final String color;

        public ColorLiteral(Token token, String color) {
            this.token = token;
            this.color = color;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitColorExpr(this, context);
        }
    }

    public static final class ArrayLiteral implements ExprInterface {
        public final Token bracket;
        public final List<ExprInterface> elements;

        public ArrayLiteral(Token bracket, List<ExprInterface> elements) {
            this.bracket = bracket;
            this.elements = elements;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitArrayExpr(this, context);
        }
    }

    // -------------------------
    // Names
    // -------------------------

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitVariableExpr(this, context);
        }
    }

    /** {@code name[i]} or {@code name[i][j]} on a parameter. */
    public static final class Index implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> indices;

        public Index(Token name, List<ExprInterface> indices) {
            this.name = name;
            this.indices = indices;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitIndexExpr(this, context);
        }
    }

    /** {@code name.property}: {@code length} of an array or string parameter, or a shape parameter. */
    public static final class PropertyRef implements ExprInterface {
        public final Token name;
        public final Token property;

        public PropertyRef(Token name, Token property) {
            this.name = name;
            this.property = property;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitPropertyExpr(this, context);
        }
    }

    public static final class Call implements ExprInterface {
        public final Token callee;
        public final List<ExprInterface> arguments;

        public Call(Token callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = arguments;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitCallExpr(this, context);
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    /** Arithmetic: {@code + - * /}. */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitBinaryExpr(this, context);
        }
    }

    public static final class Comparison implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Comparison(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitComparisonExpr(this, context);
        }
    }

    /** {@code and} / {@code or}, short-circuiting. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitLogicalExpr(this, context);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitUnaryExpr(this, context);
        }
    }

    public static final class Ternary implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface thenBranch;
        public final ExprInterface elseBranch;

        public Ternary(ExprInterface condition, ExprInterface thenBranch, ExprInterface elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
            return visitor.visitTernaryExpr(this, context);
        }
    }
}
