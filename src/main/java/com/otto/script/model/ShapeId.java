package com.otto.script.model;

import java.util.Objects;

/**
 * Identity of a shape entry in a scope frame: the name written in the script plus the
 * loop iteration or function call it was created in. Rendered to a flat string only
 * when shapes leave the evaluator.
 */
public final class ShapeId {

    public enum ScopeKind { GLOBAL, LOOP, CALL }

    private final String baseName;
    private final ScopeKind scopeKind;
    private final String scopeKey;

    private ShapeId(String baseName, ScopeKind scopeKind, String scopeKey) {
        this.baseName = Objects.requireNonNull(baseName, "baseName");
        this.scopeKind = scopeKind;
        this.scopeKey = scopeKey;
    }

    public static ShapeId plain(String name) {
        return new ShapeId(name, ScopeKind.GLOBAL, null);
    }

    public static ShapeId inLoop(String name, double loopCounter) {
        return new ShapeId(name, ScopeKind.LOOP, Value.formatNumber(loopCounter));
    }

    public static ShapeId inCall(String name, String functionName, int callId) {
        return new ShapeId(name, ScopeKind.CALL, functionName + "_" + callId);
    }

    public String getBaseName() { return baseName; }
    public ScopeKind getScopeKind() { return scopeKind; }
    public String getScopeKey() { return scopeKey; }

    /** Flat name: {@code s}, {@code s_2} inside a loop, {@code s_box_1} inside a call. */
    public String render() {
        return scopeKind == ScopeKind.GLOBAL ? baseName : baseName + "_" + scopeKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapeId)) return false;
        ShapeId other = (ShapeId) o;
        return baseName.equals(other.baseName) && scopeKind == other.scopeKind
                && Objects.equals(scopeKey, other.scopeKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseName, scopeKind, scopeKey);
    }

    @Override
    public String toString() {
        return render();
    }
}
