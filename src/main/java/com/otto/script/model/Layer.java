package com.otto.script.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

public final class Layer {

    public enum OperationKind { ADD, SUBTRACT, ROTATE }

    /** One command applied to the layer, kept in script order. */
    public static final class Operation {
        public final OperationKind kind;
        public final String shapeName;
        public final double angle;

        private Operation(OperationKind kind, String shapeName, double angle) {
            this.kind = kind;
            this.shapeName = shapeName;
            this.angle = angle;
        }

        public static Operation add(String shapeName) { return new Operation(OperationKind.ADD, shapeName, 0); }
        public static Operation subtract(String shapeName) { return new Operation(OperationKind.SUBTRACT, shapeName, 0); }
        public static Operation rotate(double angle) { return new Operation(OperationKind.ROTATE, null, angle); }
    }

    private final String name;
    private final Set<String> memberNames = new LinkedHashSet<>();
    private final ShapeTransform transform = ShapeTransform.identity();
    private final List<Operation> operations = new ArrayList<>();

    public Layer(String name) {
        this.name = name;
    }

    public String getName() { return name; }
    public ShapeTransform getTransform() { return transform; }

    public Set<String> getMemberNames() {
        return Collections.unmodifiableSet(memberNames);
    }

    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public void addMember(String shapeName) {
        memberNames.add(shapeName);
        operations.add(Operation.add(shapeName));
    }

    public void recordSubtract(String shapeName) {
        operations.add(Operation.subtract(shapeName));
    }

    public void rotate(double angle) {
        transform.rotateBy(angle);
        operations.add(Operation.rotate(angle));
    }

    /** Resolves member names against the given lookup; names that no longer resolve are skipped. */
    public List<ShapeRecord> shapes(Function<String, ShapeRecord> lookup) {
        List<ShapeRecord> out = new ArrayList<>();
        for (String member : memberNames) {
            ShapeRecord s = lookup.apply(member);
            if (s != null) out.add(s);
        }
        return out;
    }
}
