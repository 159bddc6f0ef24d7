package com.otto.script.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Insertion-ordered parameter store. Not thread-safe: a single run writes to it at a time. */
public class InMemoryParameterStore implements ParameterStore {

    private final Map<String, StoredParameter> byId = new LinkedHashMap<>();
    private int nextId = 1;

    @Override
    public StoredParameter add(String name, double value) {
        StoredParameter p = new StoredParameter("param_" + (nextId++), name, value);
        byId.put(p.getId(), p);
        return p;
    }

    @Override
    public void remove(String id) {
        byId.remove(id);
    }

    @Override
    public StoredParameter getByName(String name) {
        for (StoredParameter p : byId.values()) {
            if (p.getName().equals(name)) return p;
        }
        return null;
    }

    @Override
    public void setValue(String id, double value) {
        StoredParameter p = byId.get(id);
        if (p == null) throw new IllegalArgumentException("Unknown parameter id: " + id);
        p.setValue(value);
    }

    @Override
    public Collection<StoredParameter> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(byId.values()));
    }

    public int size() {
        return byId.size();
    }
}
