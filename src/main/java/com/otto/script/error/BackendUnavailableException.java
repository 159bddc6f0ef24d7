package com.otto.script.error;

public class BackendUnavailableException extends ScriptException {
    public BackendUnavailableException() {
        super("Clipping library not available");
    }
}
