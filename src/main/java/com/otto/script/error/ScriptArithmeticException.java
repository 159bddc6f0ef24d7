package com.otto.script.error;

public class ScriptArithmeticException extends ScriptException {
    public ScriptArithmeticException(String message) {
        super(message);
    }
}
