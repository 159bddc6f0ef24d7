package com.otto.script.store;

import com.otto.script.model.ShapeRecord;

/** Builds store-side shapes, keyed by type name. */
public interface ShapeFactory {

    boolean supports(String type);

    StoredShape create(String name, ShapeRecord shape);
}
