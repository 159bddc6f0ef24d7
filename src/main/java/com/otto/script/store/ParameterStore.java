package com.otto.script.store;

import java.util.Collection;

public interface ParameterStore {

    StoredParameter add(String name, double value);

    void remove(String id);

    StoredParameter getByName(String name);

    void setValue(String id, double value);

    Collection<StoredParameter> getAll();
}
