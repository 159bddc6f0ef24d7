package com.otto.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pen state machine behind {@code draw} blocks. Heading is in degrees within [0, 360);
 * 0 points along +x. Points are {@code double[]{x, y}}.
 */
public class TurtleDrawer {

    private double x;
    private double y;
    private double angle;
    private boolean penDown;
    private List<double[]> currentPath;
    private final List<List<double[]>> paths = new ArrayList<>();

    public TurtleDrawer() {
        reset();
    }

    public void reset() {
        x = 0;
        y = 0;
        angle = 0;
        penDown = true;
        paths.clear();
        currentPath = new ArrayList<>();
        currentPath.add(new double[]{0, 0});
    }

    public void forward(double distance) {
        double radians = Math.toRadians(angle);
        moveTo(x + distance * Math.cos(radians), y + distance * Math.sin(radians));
    }

    public void backward(double distance) {
        forward(-distance);
    }

    public void right(double degrees) {
        angle = normalize(angle + degrees);
    }

    public void left(double degrees) {
        angle = normalize(angle - degrees);
    }

    public void moveTo(double nx, double ny) {
        x = nx;
        y = ny;
        if (penDown) {
            currentPath.add(new double[]{x, y});
        } else {
            closeCurrentPath();
            currentPath = new ArrayList<>();
            currentPath.add(new double[]{x, y});
        }
    }

    public void penUp() {
        if (!penDown) return;
        closeCurrentPath();
        currentPath = new ArrayList<>();
        currentPath.add(new double[]{x, y});
        penDown = false;
    }

    public void penDown() {
        if (penDown) return;
        penDown = true;
        currentPath = new ArrayList<>();
        currentPath.add(new double[]{x, y});
    }

    /** Finished polylines plus the one in progress, each with at least two points. */
    public List<List<double[]>> getDrawingPaths() {
        List<List<double[]>> out = new ArrayList<>(paths);
        if (currentPath.size() > 1) out.add(new ArrayList<>(currentPath));
        return Collections.unmodifiableList(out);
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getAngle() { return angle; }
    public boolean isPenDown() { return penDown; }

    private void closeCurrentPath() {
        if (currentPath.size() > 1) paths.add(currentPath);
    }

    private static double normalize(double degrees) {
        double a = degrees % 360;
        return a < 0 ? a + 360 : a;
    }
}
