package com.otto.script.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Insertion-ordered shape store. Not thread-safe: a single run writes to it at a time. */
public class InMemoryShapeStore implements ShapeStore {

    private final Map<String, StoredShape> byId = new LinkedHashMap<>();

    @Override
    public void add(StoredShape shape) {
        byId.put(shape.getId(), shape);
    }

    @Override
    public void remove(String id) {
        byId.remove(id);
    }

    @Override
    public StoredShape getByName(String name) {
        for (StoredShape s : byId.values()) {
            if (s.getName().equals(name)) return s;
        }
        return null;
    }

    @Override
    public Collection<StoredShape> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(byId.values()));
    }

    public int size() {
        return byId.size();
    }
}
