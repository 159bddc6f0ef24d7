package com.otto.script.error;

/** A parameter, shape, layer or function name missed every frame of the scope chain. */
public class NameNotFoundException extends ScriptException {
    public NameNotFoundException(String message) {
        super(message);
    }
}
