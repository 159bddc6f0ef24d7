package com.otto.script.store;

public class StoredParameter {
    private final String id;
    private final String name;
    private double value;

    public StoredParameter(String id, String name, double value) {
        this.id = id;
        this.name = name;
        this.value = value;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public double getValue() { return value; }

    public void setValue(double value) { this.value = value; }
}
