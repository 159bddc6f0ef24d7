package com.otto.script.error;

/**
 * Base class for every failure raised while lexing, parsing or evaluating a script.
 * Line and column are known for lexer and parser errors and for a few runtime checks.
 */
public class ScriptException extends RuntimeException {

    private final Integer line;
    private final Integer column;

    public ScriptException(String message) {
        this(message, null, null);
    }

    public ScriptException(String message, Integer line, Integer column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public ScriptException(String message, Throwable cause) {
        super(message, cause);
        this.line = null;
        this.column = null;
    }

    public Integer getLine() {
        return line;
    }

    public Integer getColumn() {
        return column;
    }
}
