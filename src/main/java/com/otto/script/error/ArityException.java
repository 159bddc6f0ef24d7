package com.otto.script.error;

public class ArityException extends ScriptException {
    public ArityException(String message) {
        super(message);
    }
}
