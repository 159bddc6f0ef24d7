package com.otto.script.model;

public enum BooleanOp {
    UNION("union", "U", "#4CAF50", 1),
    DIFFERENCE("difference", "D", "#FF5722", 2),
    INTERSECTION("intersection", "I", "#2196F3", 2),
    XOR("xor", "X", "#9C27B0", 2);

    private final String tag;
    private final String symbol;
    private final String defaultFill;
    private final int minOperands;

    BooleanOp(String tag, String symbol, String defaultFill, int minOperands) {
        this.tag = tag;
        this.symbol = symbol;
        this.defaultFill = defaultFill;
        this.minOperands = minOperands;
    }

    /** Value stored in a result's {@code operation} param. */
    public String tag() { return tag; }

    /** Letter used in generated result names, e.g. {@code a_U1}. */
    public String symbol() { return symbol; }

    public String defaultFill() { return defaultFill; }

    public int minOperands() { return minOperands; }
}
