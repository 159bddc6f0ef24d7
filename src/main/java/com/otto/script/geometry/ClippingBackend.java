package com.otto.script.geometry;

import com.otto.script.model.BooleanOp;

import java.util.List;

/**
 * Polygon clipper the boolean engine drives. Implementations take integer contours,
 * combine subjects with clips under a fill rule and hand back outer contours followed by
 * their holes.
 */
public interface ClippingBackend {

    /**
     * @return result contours; empty when the operation leaves no area
     */
    List<FixedPath> execute(BooleanOp op, List<FixedPath> subjects, List<FixedPath> clips, FillRule fillRule);

    /** Removes self-intersections and degenerate edges. */
    List<FixedPath> simplify(List<FixedPath> paths, FillRule fillRule);
}
