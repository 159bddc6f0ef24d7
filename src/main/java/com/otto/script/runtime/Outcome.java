package com.otto.script.runtime;

import com.otto.script.model.Value;

/**
 * Result of executing one statement: either keep going, or a {@code return} was hit and the
 * enclosing bodies must stop until the function call that owns it consumes the value.
 */
public final class Outcome {

    private static final Outcome NONE = new Outcome(false, Value.nil());

    private final boolean returned;
    private final Value value;

    private Outcome(boolean returned, Value value) {
        this.returned = returned;
        this.value = value == null ? Value.nil() : value;
    }

    public static Outcome normal(Value value) {
        return value == null || value.isNull() ? NONE : new Outcome(false, value);
    }

    public static Outcome none() {
        return NONE;
    }

    public static Outcome returned(Value value) {
        return new Outcome(true, value);
    }

    public boolean isReturn() {
        return returned;
    }

    public Value value() {
        return value;
    }
}
