package com.otto.script;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.otto.script.runtime.InterpretResult;

/** Outcome of {@link ScriptRunner#run}. Failures carry the message and, when known, the position. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RunResult {
    private final boolean success;
    private final Integer shapesCreated;
    private final Integer parametersCreated;
    private final String error;
    private final Integer line;
    private final Integer column;
    private final InterpretResult interpretResult;

    private RunResult(boolean success, Integer shapesCreated, Integer parametersCreated, String error,
                      Integer line, Integer column, InterpretResult interpretResult) {
        this.success = success;
        this.shapesCreated = shapesCreated;
        this.parametersCreated = parametersCreated;
        this.error = error;
        this.line = line;
        this.column = column;
        this.interpretResult = interpretResult;
    }

    static RunResult success(int shapesCreated, int parametersCreated, InterpretResult interpretResult) {
        return new RunResult(true, shapesCreated, parametersCreated, null, null, null, interpretResult);
    }

    static RunResult failure(String error, Integer line, Integer column) {
        return new RunResult(false, null, null, error, line, column, null);
    }

    public boolean isSuccess() { return success; }
    public Integer getShapesCreated() { return shapesCreated; }
    public Integer getParametersCreated() { return parametersCreated; }
    public String getError() { return error; }
    public Integer getLine() { return line; }
    public Integer getColumn() { return column; }

    /** Full evaluator output of a successful run; null on failure. */
    @JsonIgnore
    public InterpretResult getInterpretResult() { return interpretResult; }
}
