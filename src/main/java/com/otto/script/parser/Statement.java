package com.otto.script.parser;

import com.otto.script.model.AnchorRef;
import com.otto.script.model.BooleanOp;
import com.otto.script.model.ConstraintKind;

import java.util.LinkedHashMap;
import java.util.List;

public class Statement {

    public interface Stmt {
        <R, C> R accept(StmtVisitor<R, C> visitor, C context);
    }

    public interface StmtVisitor<R, C> {
        R visitParamStmt(ParamStmt stmt, C context);
        R visitShapeStmt(ShapeStmt stmt, C context);
        R visitLayerStmt(LayerStmt stmt, C context);
        R visitTransformStmt(TransformStmt stmt, C context);
        R visitIfStmt(If stmt, C context);
        R visitForStmt(For stmt, C context);
        R visitFunctionStmt(FunctionStmt stmt, C context);
        R visitCallStmt(CallStmt stmt, C context);
        R visitReturnStmt(ReturnStmt stmt, C context);
        R visitDrawStmt(DrawStmt stmt, C context);
        R visitBooleanStmt(BooleanStmt stmt, C context);
        R visitFillStmt(FillStmt stmt, C context);
        R visitStyleStmt(StyleStmt stmt, C context);
        R visitConstraintsStmt(ConstraintsStmt stmt, C context);
    }

    // -------------------------
    // Declarations
    // -------------------------

    public static final class ParamStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;
        ParamStmt(Token name, Expr.ExprInterface value) { this.name = name; this.value = value; }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitParamStmt(this, context); }
    }

    /** {@code shape <type> [name] { prop: value ... }}; name is null when omitted. */
    public static final class ShapeStmt implements Stmt {
        public final Token type;
        public final Token name;
        public final LinkedHashMap<String, Expr.ExprInterface> properties;
        ShapeStmt(Token type, Token name, LinkedHashMap<String, Expr.ExprInterface> properties) {
            this.type = type;
            this.name = name;
            this.properties = properties;
        }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitShapeStmt(this, context); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;
        FunctionStmt(Token name, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitFunctionStmt(this, context); }
    }

    public static final class CallStmt implements Stmt {
        public final Expr.Call call;
        CallStmt(Expr.Call call) { this.call = call; }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitCallStmt(this, context); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;
        ReturnStmt(Token keyword, Expr.ExprInterface value) { this.keyword = keyword; this.value = value; }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitReturnStmt(this, context); }
    }

    // -------------------------
    // Control flow
    // -------------------------

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch;
        If(Expr.ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitIfStmt(this, context); }
    }

    /** {@code for v from a to b [step s] { ... }}; step is null when omitted. */
    public static final class For implements Stmt {
        public final Token variable;
        public final Expr.ExprInterface from;
        public final Expr.ExprInterface to;
        public final Expr.ExprInterface step;
        public final List<Stmt> body;
        For(Token variable, Expr.ExprInterface from, Expr.ExprInterface to, Expr.ExprInterface step, List<Stmt> body) {
            this.variable = variable;
            this.from = from;
            this.to = to;
            this.step = step;
            this.body = body;
        }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitForStmt(this, context); }
    }

    // -------------------------
    // Layers and transforms
    // -------------------------

    public enum LayerCommandKind { ADD, SUBTRACT, ROTATE, IF }

    public static final class LayerCommand {
        public final LayerCommandKind kind;
        public final Token token;
        public final Token shape;
        public final Expr.ExprInterface value;
        public final List<LayerCommand> body;

        private LayerCommand(LayerCommandKind kind, Token token, Token shape, Expr.ExprInterface value, List<LayerCommand> body) {
            this.kind = kind;
            this.token = token;
            this.shape = shape;
            this.value = value;
            this.body = body;
        }

        static LayerCommand add(Token token, Token shape) { return new LayerCommand(LayerCommandKind.ADD, token, shape, null, null); }
        static LayerCommand subtract(Token token, Token shape) { return new LayerCommand(LayerCommandKind.SUBTRACT, token, shape, null, null); }
        static LayerCommand rotate(Token token, Expr.ExprInterface angle) { return new LayerCommand(LayerCommandKind.ROTATE, token, null, angle, null); }
        static LayerCommand conditional(Token token, Expr.ExprInterface condition, List<LayerCommand> body) {
            return new LayerCommand(LayerCommandKind.IF, token, null, condition, body);
        }
    }

    public static final class LayerStmt implements Stmt {
        public final Token name;
        public final List<LayerCommand> commands;
        LayerStmt(Token name, List<LayerCommand> commands) { this.name = name; this.commands = commands; }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitLayerStmt(this, context); }
    }

    public enum TransformKind { SCALE, ROTATE, POSITION, IF }

    public static final class TransformOp {
        public final TransformKind kind;
        public final Token token;
        public final Expr.ExprInterface value;
        public final List<TransformOp> body;

        TransformOp(TransformKind kind, Token token, Expr.ExprInterface value, List<TransformOp> body) {
            this.kind = kind;
            this.token = token;
            this.value = value;
            this.body = body;
        }
    }

    public static final class TransformStmt implements Stmt {
        public final Token target;
        public final List<TransformOp> operations;
        TransformStmt(Token target, List<TransformOp> operations) { this.target = target; this.operations = operations; }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitTransformStmt(this, context); }
    }

    // -------------------------
    // Drawing and geometry
    // -------------------------

    public enum DrawOp { FORWARD, BACKWARD, RIGHT, LEFT, GOTO, PENUP, PENDOWN }

    public static final class DrawCommand {
        public final DrawOp op;
        public final Token token;
        public final Expr.ExprInterface value;
        DrawCommand(DrawOp op, Token token, Expr.ExprInterface value) {
            this.op = op;
            this.token = token;
            this.value = value;
        }
    }

    /** {@code draw [name] { ... }}; name is null when omitted. */
    public static final class DrawStmt implements Stmt {
        public final Token keyword;
        public final Token name;
        public final List<DrawCommand> commands;
        DrawStmt(Token keyword, Token name, List<DrawCommand> commands) {
            this.keyword = keyword;
            this.name = name;
            this.commands = commands;
        }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitDrawStmt(this, context); }
    }

    public static final class BooleanStmt implements Stmt {
        public final Token keyword;
        public final BooleanOp operation;
        public final Token name;
        public final List<Token> operands;
        BooleanStmt(Token keyword, BooleanOp operation, Token name, List<Token> operands) {
            this.keyword = keyword;
            this.operation = operation;
            this.name = name;
            this.operands = operands;
        }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitBooleanStmt(this, context); }
    }

    // -------------------------
    // Styling
    // -------------------------

    /** {@code fill shape [: value]}; value is null for the bare form. */
    public static final class FillStmt implements Stmt {
        public final Token target;
        public final Expr.ExprInterface value;
        FillStmt(Token target, Expr.ExprInterface value) { this.target = target; this.value = value; }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitFillStmt(this, context); }
    }

    public static final class StyleStmt implements Stmt {
        public final Token target;
        public final LinkedHashMap<String, Expr.ExprInterface> properties;
        StyleStmt(Token target, LinkedHashMap<String, Expr.ExprInterface> properties) {
            this.target = target;
            this.properties = properties;
        }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitStyleStmt(this, context); }
    }

    // -------------------------
    // Constraints
    // -------------------------

    public static final class ConstraintItem {
        public final ConstraintKind kind;
        public final AnchorRef a;
        public final AnchorRef b;
        public final Expr.ExprInterface distance;
        ConstraintItem(ConstraintKind kind, AnchorRef a, AnchorRef b, Expr.ExprInterface distance) {
            this.kind = kind;
            this.a = a;
            this.b = b;
            this.distance = distance;
        }
    }

    public static final class ConstraintsStmt implements Stmt {
        public final List<ConstraintItem> items;
        ConstraintsStmt(List<ConstraintItem> items) { this.items = items; }
        public <R, C> R accept(StmtVisitor<R, C> visitor, C context) { return visitor.visitConstraintsStmt(this, context); }
    }
}
