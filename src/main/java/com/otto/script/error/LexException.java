package com.otto.script.error;

public class LexException extends ScriptException {
    public LexException(String message, int line, int column) {
        super(message, line, column);
    }
}
