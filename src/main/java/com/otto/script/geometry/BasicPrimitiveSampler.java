package com.otto.script.geometry;

import com.otto.script.error.GeometryException;
import com.otto.script.model.ShapeRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Outlines for the closed primitives. All contours come out counter-clockwise. */
public class BasicPrimitiveSampler implements PrimitiveSampler {

    private static final double DEFAULT_SIZE = 50;
    private static final double DEFAULT_RADIUS = 25;

    @Override
    public List<List<double[]>> sample(ShapeRecord shape, int segments) {
        List<double[]> contour;
        switch (shape.getType()) {
            case RECTANGLE:
                contour = rectangle(shape.getNumber("width", DEFAULT_SIZE), shape.getNumber("height", DEFAULT_SIZE));
                break;
            case CIRCLE: {
                double r = shape.getNumber("radius", DEFAULT_RADIUS);
                contour = ellipse(r, r, segments);
                break;
            }
            case ELLIPSE: {
                double rx = shape.getNumber("radiusX", shape.getNumber("width", DEFAULT_SIZE) / 2);
                double ry = shape.getNumber("radiusY", shape.getNumber("height", DEFAULT_SIZE) / 2);
                contour = ellipse(rx, ry, segments);
                break;
            }
            case TRIANGLE:
                contour = triangle(shape.getNumber("base", shape.getNumber("width", DEFAULT_SIZE)),
                        shape.getNumber("height", DEFAULT_SIZE));
                break;
            case POLYGON:
                contour = regularPolygon((int) shape.getNumber("sides", 6), shape.getNumber("radius", DEFAULT_RADIUS));
                break;
            case STAR: {
                double outer = shape.getNumber("outerRadius", shape.getNumber("radius", DEFAULT_RADIUS));
                double inner = shape.getNumber("innerRadius", outer * 0.4);
                contour = star((int) shape.getNumber("points", 5), outer, inner);
                break;
            }
            default:
                throw new GeometryException("No polygon outline for shape type: " + shape.getType().typeName());
        }
        return Collections.singletonList(contour);
    }

    static List<double[]> rectangle(double w, double h) {
        List<double[]> pts = new ArrayList<>(4);
        pts.add(new double[]{-w / 2, -h / 2});
        pts.add(new double[]{w / 2, -h / 2});
        pts.add(new double[]{w / 2, h / 2});
        pts.add(new double[]{-w / 2, h / 2});
        return pts;
    }

    static List<double[]> ellipse(double rx, double ry, int segments) {
        List<double[]> pts = new ArrayList<>(segments);
        for (int i = 0; i < segments; i++) {
            double a = (double) i / segments * Math.PI * 2;
            pts.add(new double[]{rx * Math.cos(a), ry * Math.sin(a)});
        }
        return pts;
    }

    static List<double[]> triangle(double base, double height) {
        List<double[]> pts = new ArrayList<>(3);
        pts.add(new double[]{-base / 2, -height / 2});
        pts.add(new double[]{base / 2, -height / 2});
        pts.add(new double[]{0, height / 2});
        return pts;
    }

    static List<double[]> regularPolygon(int sides, double radius) {
        if (sides < 3) throw new GeometryException("A polygon needs at least 3 sides, got " + sides);
        List<double[]> pts = new ArrayList<>(sides);
        for (int i = 0; i < sides; i++) {
            double a = (double) i / sides * Math.PI * 2 - Math.PI / 2;
            pts.add(new double[]{radius * Math.cos(a), radius * Math.sin(a)});
        }
        return pts;
    }

    static List<double[]> star(int points, double outer, double inner) {
        if (points < 2) throw new GeometryException("A star needs at least 2 points, got " + points);
        List<double[]> pts = new ArrayList<>(points * 2);
        for (int i = 0; i < points * 2; i++) {
            double r = i % 2 == 0 ? outer : inner;
            double a = i * Math.PI / points - Math.PI / 2;
            pts.add(new double[]{r * Math.cos(a), r * Math.sin(a)});
        }
        return pts;
    }
}
