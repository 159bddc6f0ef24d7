package com.otto.script.geometry;

import com.otto.script.model.BooleanOp;

import java.util.EnumMap;
import java.util.Map;

/** Per-run counters behind result names such as {@code base_U1} or {@code base_D2}. */
public final class BooleanNaming {

    private final Map<BooleanOp, Integer> counters = new EnumMap<>(BooleanOp.class);

    public String next(BooleanOp op, String firstOperandName) {
        int n = counters.merge(op, 1, Integer::sum);
        String base = firstOperandName == null || firstOperandName.isEmpty() ? "shape" : firstOperandName;
        return base + "_" + op.symbol() + n;
    }

    public void reset() {
        counters.clear();
    }
}
