package com.otto.script.error;

/** Wrong operand count for a boolean operation, or a boolean result that cannot be repaired. */
public class GeometryException extends ScriptException {
    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
