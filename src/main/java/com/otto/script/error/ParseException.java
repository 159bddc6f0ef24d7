package com.otto.script.error;

public class ParseException extends ScriptException {
    public ParseException(String message, int line, int column) {
        super(message, line, column);
    }
}
