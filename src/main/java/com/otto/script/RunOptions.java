package com.otto.script;

/** Whether a run wipes the external stores before copying its results in. Both default to true. */
public final class RunOptions {

    private final boolean clearShapes;
    private final boolean clearParameters;

    private RunOptions(boolean clearShapes, boolean clearParameters) {
        this.clearShapes = clearShapes;
        this.clearParameters = clearParameters;
    }

    public static RunOptions defaults() {
        return new RunOptions(true, true);
    }

    public RunOptions withClearShapes(boolean clear) {
        return new RunOptions(clear, clearParameters);
    }

    public RunOptions withClearParameters(boolean clear) {
        return new RunOptions(clearShapes, clear);
    }

    public boolean clearShapes() { return clearShapes; }
    public boolean clearParameters() { return clearParameters; }
}
