package com.otto.script.geometry;

import com.otto.script.error.GeometryException;
import com.otto.script.model.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Helpers for floating-point contours stored as lists of {@code double[]{x, y}}. */
public final class Contours {

    private Contours() {}

    /**
     * Splits a {@code points} value on null separators. Each element must be an {@code [x, y]}
     * array of numbers or null.
     */
    public static List<List<double[]>> split(Value points) {
        List<List<double[]>> contours = new ArrayList<>();
        if (points == null || points.isNull()) return contours;
        if (!points.isArray()) throw new GeometryException("Path points must be an array, got " + points.type);

        List<double[]> current = new ArrayList<>();
        for (Value p : points.asArray()) {
            if (p.isNull()) {
                if (!current.isEmpty()) contours.add(current);
                current = new ArrayList<>();
            } else {
                current.add(toPoint(p));
            }
        }
        if (!current.isEmpty()) contours.add(current);
        return contours;
    }

    /** Concatenates nested point lists into a single contour, as used for turtle sub-paths. */
    public static List<double[]> flatten(Value subPaths) {
        List<double[]> out = new ArrayList<>();
        if (subPaths == null || !subPaths.isArray()) return out;
        for (Value sub : subPaths.asArray()) {
            if (!sub.isArray()) continue;
            for (Value p : sub.asArray()) {
                if (!p.isNull()) out.add(toPoint(p));
            }
        }
        return out;
    }

    /** Inverse of {@link #split(Value)}: contours joined with null separators. */
    public static Value join(List<List<double[]>> contours) {
        List<Value> out = new ArrayList<>();
        for (int c = 0; c < contours.size(); c++) {
            if (c > 0) out.add(Value.nil());
            for (double[] p : contours.get(c)) out.add(Value.point(p[0], p[1]));
        }
        return Value.array(out);
    }

    public static Value polyline(List<double[]> points) {
        List<Value> out = new ArrayList<>(points.size());
        for (double[] p : points) out.add(Value.point(p[0], p[1]));
        return Value.array(out);
    }

    /** Sum of (x2 - x1)(y2 + y1) over all edges; negative means counter-clockwise. */
    public static double shoelace(List<double[]> contour) {
        double sum = 0;
        int n = contour.size();
        for (int i = 0; i < n; i++) {
            double[] a = contour.get(i);
            double[] b = contour.get((i + 1) % n);
            sum += (b[0] - a[0]) * (b[1] + a[1]);
        }
        return sum;
    }

    public static boolean isCounterClockwise(List<double[]> contour) {
        return shoelace(contour) < 0;
    }

    public static List<double[]> reversed(List<double[]> contour) {
        List<double[]> copy = new ArrayList<>(contour);
        Collections.reverse(copy);
        return copy;
    }

    /** Scale, then rotate (degrees), then translate. */
    public static List<double[]> transform(List<double[]> contour, double sx, double sy, double rotation,
                                           double tx, double ty) {
        double rad = Math.toRadians(rotation);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        List<double[]> out = new ArrayList<>(contour.size());
        for (double[] p : contour) {
            double x = p[0] * sx;
            double y = p[1] * sy;
            out.add(new double[]{x * cos - y * sin + tx, x * sin + y * cos + ty});
        }
        return out;
    }

    private static double[] toPoint(Value p) {
        if (!p.isArray() || p.asArray().size() < 2
                || !p.asArray().get(0).isNumber() || !p.asArray().get(1).isNumber()) {
            throw new GeometryException("Invalid path point: " + p);
        }
        return new double[]{p.asArray().get(0).asNumber(), p.asArray().get(1).asNumber()};
    }
}
