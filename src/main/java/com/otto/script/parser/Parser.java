package com.otto.script.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import com.otto.script.error.ParseException;
import com.otto.script.model.AnchorRef;
import com.otto.script.model.BooleanOp;
import com.otto.script.model.ConstraintKind;
import com.otto.script.model.ShapeType;
import com.otto.script.parser.Expr.ExprInterface;
import com.otto.script.parser.Statement.DrawCommand;
import com.otto.script.parser.Statement.DrawOp;
import com.otto.script.parser.Statement.LayerCommand;
import com.otto.script.parser.Statement.Stmt;
import com.otto.script.parser.Statement.TransformKind;
import com.otto.script.parser.Statement.TransformOp;

/**
 * Recursive descent parser for shape scripts.
 *
 * Expression precedence, lowest first: or, and, ternary, comparison, additive,
 * multiplicative, unary, primary. Comparison does not chain.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;
    private int functionDepth = 0;

    /** Tokens allowed as a key inside shape and style blocks. */
    private static final Set<TokenType> PROPERTY_KEYS = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.POSITION, TokenType.SCALE,
            TokenType.FILL, TokenType.FILLED, TokenType.FILLCOLOR, TokenType.COLOR,
            TokenType.STROKE, TokenType.STROKECOLOR, TokenType.STROKEWIDTH, TokenType.OPACITY,
            TokenType.VISIBLE, TokenType.HIDDEN, TokenType.STYLE, TokenType.TRANSPARENT);

    /** Tokens that end the skip after a parse error. */
    private static final Set<TokenType> SYNC_POINTS = EnumSet.of(
            TokenType.RIGHT_BRACE, TokenType.SHAPE, TokenType.LAYER, TokenType.PARAM);

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /**
     * Parses the whole token list. The first error aborts parsing; the token cursor is moved
     * to the next statement boundary before the error is rethrown.
     */
    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        try {
            while (true) {
                skipSeparators();
                if (isAtEnd()) break;
                statements.add(statement());
            }
        } catch (ParseException e) {
            synchronize();
            throw e;
        }
        return statements;
    }

    private void synchronize() {
        while (!isAtEnd() && !SYNC_POINTS.contains(peek().type)) {
            advance();
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.PARAM)) return paramStatement();
        if (match(TokenType.SHAPE)) return shapeStatement();
        if (match(TokenType.LAYER)) return layerStatement();
        if (match(TokenType.TRANSFORM)) return transformStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.DEF)) return functionDeclaration();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.DRAW)) return drawStatement();
        if (match(TokenType.UNION)) return booleanStatement(BooleanOp.UNION);
        if (match(TokenType.DIFFERENCE)) return booleanStatement(BooleanOp.DIFFERENCE);
        if (match(TokenType.INTERSECTION)) return booleanStatement(BooleanOp.INTERSECTION);
        if (match(TokenType.FILL)) return fillStatement();
        if (match(TokenType.STYLE)) return styleStatement();
        if (match(TokenType.CONSTRAINTS)) return constraintsStatement();
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN)) {
            Token callee = advance();
            return new Statement.CallStmt(finishCall(callee));
        }
        throw error(peek(), "statement");
    }

    private Stmt paramStatement() {
        Token name = consume(TokenType.IDENTIFIER, "parameter name");
        ExprInterface value = expression();
        return new Statement.ParamStmt(name, value);
    }

    /** {@code shape <type> [name] {...}}; {@code shape <name> <type> {...}} is accepted too. */
    private Stmt shapeStatement() {
        Token type = consume(TokenType.IDENTIFIER, "shape type");
        Token name = null;
        if (ShapeType.fromName(type.lexeme) == null) {
            if (check(TokenType.IDENTIFIER) && ShapeType.fromName(peek().lexeme) != null) {
                name = type;
                type = advance();
            } else {
                throw new ParseException("Parser error at line " + type.line + ", col " + type.column
                        + ": Unknown shape type '" + type.lexeme + "'", type.line, type.column);
            }
        } else if (check(TokenType.IDENTIFIER)) {
            name = advance();
        }
        consume(TokenType.LEFT_BRACE, "'{'");
        LinkedHashMap<String, ExprInterface> properties = propertyBlock();
        return new Statement.ShapeStmt(type, name, properties);
    }

    /** {@code key: value} pairs up to and including the closing brace; commas are optional. */
    private LinkedHashMap<String, ExprInterface> propertyBlock() {
        LinkedHashMap<String, ExprInterface> properties = new LinkedHashMap<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Token key = peek();
            if (!PROPERTY_KEYS.contains(key.type)) throw error(key, "property name");
            advance();
            consume(TokenType.COLON, "':'");
            properties.put(propertyKey(key), expression());
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "'}'");
        return properties;
    }

    private static String propertyKey(Token key) {
        switch (key.type) {
            case FILLCOLOR: return "fillColor";
            case STROKECOLOR: return "strokeColor";
            case STROKEWIDTH: return "strokeWidth";
            case OPACITY: return key.lexeme.equalsIgnoreCase("alpha") ? "alpha" : "opacity";
            default: return key.lexeme;
        }
    }

    private Stmt layerStatement() {
        Token name = consume(TokenType.IDENTIFIER, "layer name");
        consume(TokenType.LEFT_BRACE, "'{'");
        List<LayerCommand> commands = layerCommands();
        return new Statement.LayerStmt(name, commands);
    }

    private List<LayerCommand> layerCommands() {
        List<LayerCommand> commands = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.ADD)) {
                Token keyword = previous();
                commands.add(LayerCommand.add(keyword, consume(TokenType.IDENTIFIER, "shape name")));
            } else if (match(TokenType.SUBTRACT)) {
                Token keyword = previous();
                commands.add(LayerCommand.subtract(keyword, consume(TokenType.IDENTIFIER, "shape name")));
            } else if (match(TokenType.ROTATE)) {
                Token keyword = previous();
                commands.add(LayerCommand.rotate(keyword, expression()));
            } else if (match(TokenType.IF)) {
                Token keyword = previous();
                ExprInterface condition = expression();
                consume(TokenType.LEFT_BRACE, "'{'");
                commands.add(LayerCommand.conditional(keyword, condition, layerCommands()));
            } else {
                throw error(peek(), "layer command");
            }
        }
        consume(TokenType.RIGHT_BRACE, "'}'");
        return commands;
    }

    private Stmt transformStatement() {
        Token target = consume(TokenType.IDENTIFIER, "transform target");
        consume(TokenType.LEFT_BRACE, "'{'");
        List<TransformOp> operations = transformOperations();
        return new Statement.TransformStmt(target, operations);
    }

    private List<TransformOp> transformOperations() {
        List<TransformOp> operations = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.SCALE)) {
                operations.add(transformOperation(TransformKind.SCALE));
            } else if (match(TokenType.ROTATE)) {
                operations.add(transformOperation(TransformKind.ROTATE));
            } else if (match(TokenType.POSITION)) {
                operations.add(transformOperation(TransformKind.POSITION));
            } else if (match(TokenType.IF)) {
                Token keyword = previous();
                ExprInterface condition = expression();
                consume(TokenType.LEFT_BRACE, "'{'");
                operations.add(new TransformOp(TransformKind.IF, keyword, condition, transformOperations()));
            } else {
                throw error(peek(), "transform operation");
            }
        }
        consume(TokenType.RIGHT_BRACE, "'}'");
        return operations;
    }

    private TransformOp transformOperation(TransformKind kind) {
        Token keyword = previous();
        consume(TokenType.COLON, "':'");
        return new TransformOp(kind, keyword, expression(), null);
    }

    private Stmt ifStatement() {
        ExprInterface condition = expression();
        consume(TokenType.LEFT_BRACE, "'{'");
        List<Stmt> thenBranch = block();
        List<Stmt> elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseBranch = new ArrayList<>();
                elseBranch.add(ifStatement());
            } else {
                consume(TokenType.LEFT_BRACE, "'{'");
                elseBranch = block();
            }
        }
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt forStatement() {
        Token variable = consume(TokenType.IDENTIFIER, "loop variable");
        consume(TokenType.FROM, "'from'");
        ExprInterface from = expression();
        consume(TokenType.TO, "'to'");
        ExprInterface to = expression();
        ExprInterface step = null;
        if (match(TokenType.STEP)) step = expression();
        consume(TokenType.LEFT_BRACE, "'{'");
        List<Stmt> body = block();
        return new Statement.For(variable, from, to, step, body);
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "function name");
        consume(TokenType.LEFT_PAREN, "'('");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "parameter name"));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')'");
        consume(TokenType.LEFT_BRACE, "'{'");

        functionDepth++;
        try {
            List<Stmt> body = block();
            return new Statement.FunctionStmt(name, params, body);
        } finally {
            functionDepth--;
        }
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        if (functionDepth == 0) {
            throw new ParseException("Parser error at line " + keyword.line + ", col " + keyword.column
                    + ": 'return' outside of a function", keyword.line, keyword.column);
        }
        ExprInterface value = null;
        if (!check(TokenType.RIGHT_BRACE)) value = expression();
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt drawStatement() {
        Token keyword = previous();
        Token name = null;
        if (check(TokenType.IDENTIFIER)) name = advance();
        consume(TokenType.LEFT_BRACE, "'{'");

        List<DrawCommand> commands = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.FORWARD)) commands.add(new DrawCommand(DrawOp.FORWARD, previous(), expression()));
            else if (match(TokenType.BACKWARD)) commands.add(new DrawCommand(DrawOp.BACKWARD, previous(), expression()));
            else if (match(TokenType.RIGHT)) commands.add(new DrawCommand(DrawOp.RIGHT, previous(), expression()));
            else if (match(TokenType.LEFT)) commands.add(new DrawCommand(DrawOp.LEFT, previous(), expression()));
            else if (match(TokenType.GOTO)) commands.add(new DrawCommand(DrawOp.GOTO, previous(), expression()));
            else if (match(TokenType.PENUP)) commands.add(new DrawCommand(DrawOp.PENUP, previous(), null));
            else if (match(TokenType.PENDOWN)) commands.add(new DrawCommand(DrawOp.PENDOWN, previous(), null));
            else throw error(peek(), "draw command");
        }
        consume(TokenType.RIGHT_BRACE, "'}'");
        return new Statement.DrawStmt(keyword, name, commands);
    }

    private Stmt booleanStatement(BooleanOp operation) {
        Token keyword = previous();
        Token name = consume(TokenType.IDENTIFIER, "result name");
        consume(TokenType.LEFT_BRACE, "'{'");

        List<Token> operands = new ArrayList<>();
        while (match(TokenType.ADD)) {
            operands.add(consume(TokenType.IDENTIFIER, "shape name"));
        }
        consume(TokenType.RIGHT_BRACE, "'}'");

        if (operands.size() < 2) {
            throw new ParseException("Parser error at line " + keyword.line + ", col " + keyword.column
                    + ": Boolean operation requires at least two shapes", keyword.line, keyword.column);
        }
        return new Statement.BooleanStmt(keyword, operation, name, operands);
    }

    private Stmt fillStatement() {
        Token target = consume(TokenType.IDENTIFIER, "shape name");
        ExprInterface value = null;
        if (match(TokenType.COLON)) value = expression();
        return new Statement.FillStmt(target, value);
    }

    private Stmt styleStatement() {
        Token target = consume(TokenType.IDENTIFIER, "shape name");
        consume(TokenType.LEFT_BRACE, "'{'");
        return new Statement.StyleStmt(target, propertyBlock());
    }

    private Stmt constraintsStatement() {
        consume(TokenType.LEFT_BRACE, "'{'");
        List<Statement.ConstraintItem> items = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            ConstraintKind kind;
            if (match(TokenType.COINCIDENT)) kind = ConstraintKind.COINCIDENT;
            else if (match(TokenType.DISTANCE)) kind = ConstraintKind.DISTANCE;
            else if (match(TokenType.HORIZONTAL)) kind = ConstraintKind.HORIZONTAL;
            else if (match(TokenType.VERTICAL)) kind = ConstraintKind.VERTICAL;
            else throw error(peek(), "constraint");

            AnchorRef a = anchor();
            AnchorRef b = anchor();
            ExprInterface distance = kind == ConstraintKind.DISTANCE ? expression() : null;
            items.add(new Statement.ConstraintItem(kind, a, b, distance));
        }
        consume(TokenType.RIGHT_BRACE, "'}'");
        return new Statement.ConstraintsStmt(items);
    }

    private AnchorRef anchor() {
        Token shape = consume(TokenType.IDENTIFIER, "shape name");
        consume(TokenType.DOT, "'.'");
        Token anchor = word("anchor name");
        return new AnchorRef(shape.lexeme, anchor.lexeme);
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "'}'");
        return statements;
    }

    private void skipSeparators() {
        while (match(TokenType.SEMICOLON)) {
            // stray separators are allowed between statements
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() {
        return or();
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token operator = previous();
            ExprInterface right = and();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = ternary();
        while (match(TokenType.AND)) {
            Token operator = previous();
            ExprInterface right = ternary();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface ternary() {
        ExprInterface condition = comparison();
        if (match(TokenType.QUESTION)) {
            ExprInterface thenBranch = ternary();
            consume(TokenType.COLON, "':'");
            ExprInterface elseBranch = ternary();
            return new Expr.Ternary(condition, thenBranch, elseBranch);
        }
        return condition;
    }

    private ExprInterface comparison() {
        ExprInterface expr = additive();
        if (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token operator = previous();
            ExprInterface right = additive();
            expr = new Expr.Comparison(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            ExprInterface right = multiplicative();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token operator = previous();
            ExprInterface right = unary();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.NOT, TokenType.MINUS)) {
            Token operator = previous();
            ExprInterface right = unary();
            return new Expr.Unary(operator, right);
        }
        return primary();
    }

    private ExprInterface primary() {
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Expr.Literal(previous().literal);
        if (match(TokenType.TRUE)) return new Expr.Literal(Boolean.TRUE);
        if (match(TokenType.FALSE)) return new Expr.Literal(Boolean.FALSE);
        if (match(TokenType.HEXCOLOR, TokenType.COLORNAME)) {
            Token color = previous();
            return new Expr.ColorLiteral(color, (String) color.literal);
        }

        if (match(TokenType.IDENTIFIER, TokenType.POSITION)) {
            Token name = previous();
            if (check(TokenType.LEFT_PAREN)) {
                return finishCall(name);
            }
            if (match(TokenType.LEFT_BRACKET)) {
                List<ExprInterface> indices = new ArrayList<>();
                indices.add(expression());
                consume(TokenType.RIGHT_BRACKET, "']'");
                if (match(TokenType.LEFT_BRACKET)) {
                    indices.add(expression());
                    consume(TokenType.RIGHT_BRACKET, "']'");
                }
                return new Expr.Index(name, indices);
            }
            if (match(TokenType.DOT)) {
                Token property = word("property name");
                return new Expr.PropertyRef(name, property);
            }
            return new Expr.Variable(name);
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<ExprInterface> elements = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    elements.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "']'");
            return new Expr.ArrayLiteral(bracket, elements);
        }

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "')'");
            return expr;
        }

        throw error(peek(), "expression");
    }

    private Expr.Call finishCall(Token callee) {
        consume(TokenType.LEFT_PAREN, "'('");
        List<ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')'");
        return new Expr.Call(callee, arguments);
    }

    /** Identifier or keyword used as a plain word, e.g. the anchor in {@code box.left}. */
    private Token word(String expected) {
        Token token = peek();
        if (token.type != TokenType.EOF && !token.lexeme.isEmpty()
                && (Character.isLetter(token.lexeme.charAt(0)) || token.lexeme.charAt(0) == '_')) {
            return advance();
        }
        throw error(token, expected);
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseException error(Token token, String expected) {
        String got = token.type == TokenType.EOF ? "end of input" : "'" + token.lexeme + "'";
        return new ParseException("Parser error at line " + token.line + ", col " + token.column
                + ": Expected " + expected + " but got " + got, token.line, token.column);
    }
}
