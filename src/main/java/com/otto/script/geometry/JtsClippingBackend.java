package com.otto.script.geometry;

import com.otto.script.error.GeometryException;
import com.otto.script.model.BooleanOp;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.UnaryUnionNG;
import org.locationtech.jts.operation.polygonize.Polygonizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Clipping backend on top of JTS overlay. Input contours may self-intersect or overlap;
 * they are first resolved into a clean polygonal region under the requested fill rule by
 * noding all contour linework, polygonizing the faces and keeping the faces whose winding
 * number the rule counts as filled. Work happens on a unit grid, matching the integer input.
 */
public class JtsClippingBackend implements ClippingBackend {

    private final PrecisionModel precision = new PrecisionModel(1.0);
    private final GeometryFactory factory = new GeometryFactory(precision);

    @Override
    public List<FixedPath> execute(BooleanOp op, List<FixedPath> subjects, List<FixedPath> clips, FillRule fillRule) {
        try {
            Geometry subject = region(subjects, fillRule);
            if (clips.isEmpty()) {
                return op == BooleanOp.INTERSECTION ? new ArrayList<>() : toPaths(subject);
            }
            Geometry clip = region(clips, fillRule);
            return toPaths(OverlayNG.overlay(subject, clip, overlayCode(op), precision));
        } catch (TopologyException e) {
            throw new GeometryException("Clipping failed for " + op.tag() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<FixedPath> simplify(List<FixedPath> paths, FillRule fillRule) {
        try {
            return toPaths(region(paths, fillRule));
        } catch (TopologyException e) {
            throw new GeometryException("Polygon simplification failed: " + e.getMessage(), e);
        }
    }

    private static int overlayCode(BooleanOp op) {
        switch (op) {
            case UNION: return OverlayNG.UNION;
            case DIFFERENCE: return OverlayNG.DIFFERENCE;
            case INTERSECTION: return OverlayNG.INTERSECTION;
            case XOR: return OverlayNG.SYMDIFFERENCE;
            default: throw new IllegalArgumentException("Unsupported operation: " + op);
        }
    }

    // -------------------------
    // Fill rule resolution
    // -------------------------

    private Geometry region(List<FixedPath> paths, FillRule fillRule) {
        List<LineString> rings = new ArrayList<>();
        List<FixedPath> usable = new ArrayList<>();
        for (FixedPath path : paths) {
            if (path.size() < 3) continue;
            rings.add(factory.createLineString(closedCoordinates(path)));
            usable.add(path);
        }
        if (rings.isEmpty()) return factory.createPolygon();

        Geometry linework = factory.createMultiLineString(rings.toArray(new LineString[0]));
        Geometry noded = UnaryUnionNG.union(linework, precision);

        Polygonizer polygonizer = new Polygonizer();
        polygonizer.add(noded);

        List<Polygon> filled = new ArrayList<>();
        for (Object face : polygonizer.getPolygons()) {
            Polygon polygon = (Polygon) face;
            Point inside = polygon.getInteriorPoint();
            if (inside == null || inside.isEmpty()) continue;
            if (fillRule.isFilled(windingNumber(inside.getCoordinate(), usable))) {
                filled.add(polygon);
            }
        }
        if (filled.isEmpty()) return factory.createPolygon();
        return UnaryUnionNG.union(factory.createMultiPolygon(filled.toArray(new Polygon[0])), precision);
    }

    /** Sum of the winding numbers of {@code p} around every contour; +1 per counter-clockwise loop. */
    static int windingNumber(Coordinate p, List<FixedPath> paths) {
        int winding = 0;
        for (FixedPath path : paths) {
            int n = path.size();
            for (int i = 0; i < n; i++) {
                int j = (i + 1) % n;
                double x1 = path.x(i), y1 = path.y(i);
                double x2 = path.x(j), y2 = path.y(j);
                if (y1 <= p.y) {
                    if (y2 > p.y && isLeft(x1, y1, x2, y2, p) > 0) winding++;
                } else if (y2 <= p.y && isLeft(x1, y1, x2, y2, p) < 0) {
                    winding--;
                }
            }
        }
        return winding;
    }

    private static double isLeft(double x1, double y1, double x2, double y2, Coordinate p) {
        return (x2 - x1) * (p.y - y1) - (p.x - x1) * (y2 - y1);
    }

    // -------------------------
    // Conversion
    // -------------------------

    private static Coordinate[] closedCoordinates(FixedPath path) {
        Coordinate[] coords = new Coordinate[path.size() + 1];
        for (int i = 0; i < path.size(); i++) {
            coords[i] = new Coordinate(path.x(i), path.y(i));
        }
        coords[path.size()] = new Coordinate(coords[0]);
        return coords;
    }

    /** Each polygon contributes its shell (counter-clockwise) followed by its holes (clockwise). */
    private static List<FixedPath> toPaths(Geometry geometry) {
        List<FixedPath> out = new ArrayList<>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry part = geometry.getGeometryN(i);
            if (!(part instanceof Polygon) || part.isEmpty()) continue;
            Polygon polygon = (Polygon) part;
            addRing(out, polygon.getExteriorRing(), true);
            for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
                addRing(out, polygon.getInteriorRingN(h), false);
            }
        }
        return out;
    }

    private static void addRing(List<FixedPath> out, LinearRing ring, boolean counterClockwise) {
        Coordinate[] coords = ring.getCoordinates();
        if (coords.length < 4) return;
        boolean ccw = Orientation.isCCW(coords);
        int n = coords.length - 1;
        long[] xs = new long[n];
        long[] ys = new long[n];
        for (int i = 0; i < n; i++) {
            Coordinate c = ccw == counterClockwise ? coords[i] : coords[n - 1 - i];
            xs[i] = Math.round(c.x);
            ys[i] = Math.round(c.y);
        }
        out.add(new FixedPath(xs, ys));
    }
}
