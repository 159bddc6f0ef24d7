package com.otto.script.geometry;

import com.otto.script.model.ShapeRecord;

import java.util.List;

/**
 * Turns a primitive's parameters into outline points around its own origin, before any
 * transform is applied.
 */
public interface PrimitiveSampler {

    /**
     * @param segments resolution hint for curved outlines
     * @return one or more contours of {@code double[]{x, y}} points
     * @throws com.otto.script.error.GeometryException when the shape type has no polygon form
     */
    List<List<double[]>> sample(ShapeRecord shape, int segments);
}
