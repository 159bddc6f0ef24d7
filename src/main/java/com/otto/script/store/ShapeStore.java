package com.otto.script.store;

import java.util.Collection;

public interface ShapeStore {

    void add(StoredShape shape);

    void remove(String id);

    StoredShape getByName(String name);

    Collection<StoredShape> getAll();
}
