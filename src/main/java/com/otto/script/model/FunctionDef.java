package com.otto.script.model;

import com.otto.script.parser.Statement;

import java.util.Collections;
import java.util.List;

public final class FunctionDef {
    private final String name;
    private final List<String> params;
    private final List<Statement.Stmt> body;

    public FunctionDef(String name, List<String> params, List<Statement.Stmt> body) {
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = Collections.unmodifiableList(body);
    }

    public String getName() { return name; }
    public List<String> getParams() { return params; }
    public List<Statement.Stmt> getBody() { return body; }

    public int arity() {
        return params.size();
    }
}
