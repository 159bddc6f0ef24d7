package com.otto.script.parser;

public enum TokenType {
    // Literals
    NUMBER, STRING, HEXCOLOR, COLORNAME, IDENTIFIER,

    // Declarations
    PARAM, SHAPE, LAYER, TRANSFORM, DEF, RETURN,

    // Layer / transform commands
    ADD, SUBTRACT, ROTATE, SCALE, POSITION,

    // Control flow
    IF, ELSE, ENDIF, FOR, FROM, TO, STEP, IN,
    TRUE, FALSE, AND, OR, NOT,

    // Boolean operations
    UNION, DIFFERENCE, INTERSECTION,

    // Turtle drawing
    DRAW, FORWARD, BACKWARD, RIGHT, LEFT, GOTO, PENUP, PENDOWN,

    // Constraints
    CONSTRAINTS, COINCIDENT, DISTANCE, HORIZONTAL, VERTICAL,

    // Styling
    FILL, FILLED, FILLCOLOR, COLOR, STROKE, STROKECOLOR, STROKEWIDTH,
    OPACITY, TRANSPARENT, VISIBLE, HIDDEN, STYLE,

    // Punctuation
    LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET, LEFT_PAREN, RIGHT_PAREN,
    COLON, COMMA, SEMICOLON, DOT, QUESTION,
    PLUS, MINUS, STAR, SLASH, PERCENT,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AMPERSAND, PIPE, CARET, TILDE, AT, DOLLAR,

    EOF
}
