package com.otto.script.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed contour on the integer grid the clipping backend works on. The closing vertex
 * is implied, never stored.
 */
public final class FixedPath {

    private final long[] xs;
    private final long[] ys;

    public FixedPath(long[] xs, long[] ys) {
        if (xs.length != ys.length) throw new IllegalArgumentException("coordinate arrays differ in length");
        this.xs = xs;
        this.ys = ys;
    }

    /** Scales and rounds a floating-point contour onto the grid. */
    public static FixedPath fromContour(List<double[]> contour, double scale) {
        long[] xs = new long[contour.size()];
        long[] ys = new long[contour.size()];
        for (int i = 0; i < contour.size(); i++) {
            xs[i] = Math.round(contour.get(i)[0] * scale);
            ys[i] = Math.round(contour.get(i)[1] * scale);
        }
        return new FixedPath(xs, ys);
    }

    public List<double[]> toContour(double scale) {
        List<double[]> out = new ArrayList<>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            out.add(new double[]{xs[i] / scale, ys[i] / scale});
        }
        return out;
    }

    public int size() { return xs.length; }
    public long x(int i) { return xs[i]; }
    public long y(int i) { return ys[i]; }

    /** Sum of (x2 - x1)(y2 + y1) over all edges; negative means counter-clockwise. */
    public double shoelace() {
        double sum = 0;
        for (int i = 0; i < xs.length; i++) {
            int j = (i + 1) % xs.length;
            sum += (double) (xs[j] - xs[i]) * (double) (ys[j] + ys[i]);
        }
        return sum;
    }

    public boolean isCounterClockwise() {
        return shoelace() < 0;
    }

    public FixedPath reversed() {
        int n = xs.length;
        long[] rx = new long[n];
        long[] ry = new long[n];
        for (int i = 0; i < n; i++) {
            rx[i] = xs[n - 1 - i];
            ry[i] = ys[n - 1 - i];
        }
        return new FixedPath(rx, ry);
    }

    /** @return {minX, minY, maxX, maxY} over every vertex of every path */
    public static long[] bounds(List<FixedPath> paths) {
        long minX = Long.MAX_VALUE, minY = Long.MAX_VALUE, maxX = Long.MIN_VALUE, maxY = Long.MIN_VALUE;
        for (FixedPath p : paths) {
            for (int i = 0; i < p.size(); i++) {
                minX = Math.min(minX, p.xs[i]);
                minY = Math.min(minY, p.ys[i]);
                maxX = Math.max(maxX, p.xs[i]);
                maxY = Math.max(maxY, p.ys[i]);
            }
        }
        return new long[]{minX, minY, maxX, maxY};
    }
}
