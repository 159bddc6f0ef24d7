package com.otto.script.geometry;

import com.otto.debug.Debug;
import com.otto.script.error.BackendUnavailableException;
import com.otto.script.error.GeometryException;
import com.otto.script.model.BooleanOp;
import com.otto.script.model.ColorTable;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.ShapeTransform;
import com.otto.script.model.ShapeType;
import com.otto.script.model.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Union, difference, intersection and xor of shapes.
 *
 * Operands are turned into world-space contours, scaled onto an integer grid and passed
 * to the {@link ClippingBackend} under the non-zero rule. The result becomes a closed
 * {@code path} shape whose first contour is the outer boundary.
 *
 * Difference runs one cut at a time. A cut that wipes out a subject which is itself a
 * boolean result is retried with the even-odd rule; if the cut still comes back empty while
 * lying strictly inside the subject's bounds, the cut is added to the subject as a hole.
 */
public class BooleanEngine {

    private static final String TAG = "BooleanEngine";

    public static final double SCALE = 10_000.0;
    public static final int CURVED_SEGMENTS = 128;
    public static final int DEFAULT_SEGMENTS = 64;

    private final ClippingBackend backend;
    private final PrimitiveSampler sampler;

    /** @param backend may be null, in which case every operation fails */
    public BooleanEngine(ClippingBackend backend, PrimitiveSampler sampler) {
        this.backend = backend;
        this.sampler = sampler == null ? new BasicPrimitiveSampler() : sampler;
    }

    public static BooleanEngine withDefaults() {
        return new BooleanEngine(new JtsClippingBackend(), new BasicPrimitiveSampler());
    }

    public boolean isAvailable() {
        return backend != null;
    }

    public ShapeRecord apply(BooleanOp op, List<BooleanOperand> operands, BooleanNaming naming) {
        switch (op) {
            case DIFFERENCE:
                return difference(operands, naming);
            case UNION:
            case INTERSECTION:
            case XOR:
            default:
                return clipAndMake(op, operands, naming);
        }
    }

    public ShapeRecord union(List<BooleanOperand> operands, BooleanNaming naming) {
        return clipAndMake(BooleanOp.UNION, operands, naming);
    }

    public ShapeRecord intersection(List<BooleanOperand> operands, BooleanNaming naming) {
        return clipAndMake(BooleanOp.INTERSECTION, operands, naming);
    }

    public ShapeRecord xor(List<BooleanOperand> operands, BooleanNaming naming) {
        return clipAndMake(BooleanOp.XOR, operands, naming);
    }

    /** {@code ((base - cut1) - cut2) - ...} */
    public ShapeRecord difference(List<BooleanOperand> operands, BooleanNaming naming) {
        requireBackend();
        checkOperandCount(BooleanOp.DIFFERENCE, operands);

        List<FixedPath> current = toFixedPaths(operands.get(0));
        boolean currentIsBoolean = operands.get(0).getShape().isBooleanResult();

        for (int i = 1; i < operands.size(); i++) {
            List<FixedPath> cut = toFixedPaths(operands.get(i));
            List<FixedPath> solution = backend.execute(BooleanOp.DIFFERENCE, current, cut, FillRule.NON_ZERO);

            if (solution.isEmpty() && currentIsBoolean) {
                Debug.get().w(TAG, "Difference step " + i + " came back empty, retrying with even-odd fill");
                solution = backend.execute(BooleanOp.DIFFERENCE, current, cut, FillRule.EVEN_ODD);
            }

            boolean repaired = false;
            if (solution.isEmpty()) {
                // only a boolean-result subject gets its lost cut back as a hole
                if (!currentIsBoolean || !strictlyInside(FixedPath.bounds(cut), FixedPath.bounds(current))) {
                    throw new GeometryException("Difference operation at step " + i + " resulted in empty geometry");
                }
                Debug.get().w(TAG, "Difference step " + i + " lost a cut lying inside '"
                        + operands.get(0).getName() + "', adding '" + operands.get(i).getName() + "' as a hole");
                solution = withHoles(current, cut);
                repaired = true;
            }

            if (!repaired) {
                solution = backend.simplify(solution, FillRule.NON_ZERO);
                if (solution.isEmpty()) {
                    throw new GeometryException("Difference operation at step " + i + " resulted in empty geometry");
                }
            }
            current = solution;
            currentIsBoolean = true;
        }
        return makeResult(BooleanOp.DIFFERENCE, operands, current, naming);
    }

    private ShapeRecord clipAndMake(BooleanOp op, List<BooleanOperand> operands, BooleanNaming naming) {
        requireBackend();
        checkOperandCount(op, operands);

        List<FixedPath> subjects = new ArrayList<>();
        List<FixedPath> clips = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            List<FixedPath> paths = toFixedPaths(operands.get(i));
            if (op == BooleanOp.UNION || i == 0) subjects.addAll(paths);
            else clips.addAll(paths);
        }

        List<FixedPath> solution = backend.execute(op, subjects, clips, FillRule.NON_ZERO);
        solution = backend.simplify(solution, FillRule.NON_ZERO);
        if (solution.isEmpty()) {
            throw new GeometryException(capitalize(op.tag()) + " operation resulted in empty geometry");
        }
        return makeResult(op, operands, solution, naming);
    }

    private void requireBackend() {
        if (backend == null) throw new BackendUnavailableException();
    }

    private static void checkOperandCount(BooleanOp op, List<BooleanOperand> operands) {
        int count = operands == null ? 0 : operands.size();
        if (count < op.minOperands()) {
            throw new GeometryException(capitalize(op.tag()) + " needs at least " + op.minOperands()
                    + " shape" + (op.minOperands() == 1 ? "" : "s") + ", got " + count);
        }
    }

    // -------------------------
    // Repair
    // -------------------------

    private static boolean strictlyInside(long[] inner, long[] outer) {
        return inner[0] > outer[0] && inner[1] > outer[1] && inner[2] < outer[2] && inner[3] < outer[3];
    }

    /** Subject contours unchanged, followed by every cut contour wound clockwise. */
    private static List<FixedPath> withHoles(List<FixedPath> subject, List<FixedPath> cut) {
        List<FixedPath> out = new ArrayList<>(subject);
        for (FixedPath hole : cut) {
            out.add(hole.isCounterClockwise() ? hole.reversed() : hole);
        }
        return out;
    }

    // -------------------------
    // Operand extraction
    // -------------------------

    private List<FixedPath> toFixedPaths(BooleanOperand operand) {
        List<List<double[]>> contours = worldContours(operand);
        if (operand.getShape().isTruthyParam("hasHoles") && contours.size() > 1) {
            enforceWinding(operand.getName(), contours);
        }
        List<FixedPath> out = new ArrayList<>(contours.size());
        for (List<double[]> contour : contours) {
            out.add(FixedPath.fromContour(contour, SCALE));
        }
        return out;
    }

    /** First contour counter-clockwise, every other one clockwise. Wrong ones are reversed in place. */
    static void enforceWinding(String name, List<List<double[]>> contours) {
        for (int i = 0; i < contours.size(); i++) {
            boolean wantCcw = i == 0;
            if (Contours.isCounterClockwise(contours.get(i)) != wantCcw) {
                Debug.get().w(TAG, "Reversed contour " + i + " of '" + name + "' to "
                        + (wantCcw ? "counter-clockwise" : "clockwise"));
                contours.set(i, Contours.reversed(contours.get(i)));
            }
        }
    }

    List<List<double[]>> worldContours(BooleanOperand operand) {
        ShapeRecord shape = operand.getShape();
        ShapeTransform t = shape.getTransform();
        List<List<double[]>> local;
        double tx;
        double ty;

        if (shape.getType() == ShapeType.PATH) {
            if (shape.isTruthyParam("isTurtlePath") && shape.hasParam("subPaths")) {
                local = new ArrayList<>();
                local.add(Contours.flatten(shape.getParam("subPaths")));
            } else {
                local = Contours.split(shape.getParam("points"));
            }
            tx = t.getX();
            ty = t.getY();
        } else {
            int segments = shape.getType().isCurved() ? CURVED_SEGMENTS : DEFAULT_SEGMENTS;
            local = sampler.sample(shape, segments);
            double[] origin = primitiveOrigin(shape);
            tx = origin[0];
            ty = origin[1];
        }

        List<List<double[]>> world = new ArrayList<>();
        for (List<double[]> contour : local) {
            if (contour.size() < 3) continue;
            world.add(Contours.transform(contour, t.getScaleX(), t.getScaleY(), t.getRotation(), tx, ty));
        }
        if (world.isEmpty()) {
            throw new GeometryException("Shape '" + operand.getName() + "' has no contour with at least 3 points");
        }
        return world;
    }

    /**
     * Where a primitive's local origin lands: centerX/centerY when given, otherwise x/y
     * (the top-left corner for rectangle types), otherwise the transform position.
     */
    private static double[] primitiveOrigin(ShapeRecord shape) {
        if (shape.hasParam("centerX") || shape.hasParam("centerY")) {
            return new double[]{shape.getNumber("centerX", 0), shape.getNumber("centerY", 0)};
        }
        if (shape.hasParam("x") || shape.hasParam("y")) {
            double x = shape.getNumber("x", 0);
            double y = shape.getNumber("y", 0);
            ShapeType type = shape.getType();
            if (type == ShapeType.RECTANGLE || type == ShapeType.ROUNDED_RECTANGLE || type == ShapeType.CHAMFER_RECTANGLE) {
                x += shape.getNumber("width", 50) / 2;
                y += shape.getNumber("height", 50) / 2;
            }
            return new double[]{x, y};
        }
        return new double[]{shape.getTransform().getX(), shape.getTransform().getY()};
    }

    // -------------------------
    // Result packaging
    // -------------------------

    private static ShapeRecord makeResult(BooleanOp op, List<BooleanOperand> operands, List<FixedPath> solution,
                                          BooleanNaming naming) {
        List<List<double[]>> contours = new ArrayList<>(solution.size());
        for (FixedPath path : solution) contours.add(path.toContour(SCALE));

        Map<String, Value> params = new LinkedHashMap<>();
        params.put("points", Contours.join(contours));
        params.put("closed", Value.bool(true));
        params.put("operation", Value.string(op.tag()));
        params.put("hasHoles", Value.bool(isOuterWithHoles(contours)));
        params.putAll(inheritedStyle(op, operands.get(0).getShape()));

        String id = naming.next(op, operands.get(0).getName());
        return new ShapeRecord(ShapeType.PATH, id, params, ShapeTransform.identity());
    }

    /** One counter-clockwise outer boundary followed by at least one clockwise hole. */
    static boolean isOuterWithHoles(List<List<double[]>> contours) {
        if (contours.size() < 2 || !Contours.isCounterClockwise(contours.get(0))) return false;
        for (int i = 1; i < contours.size(); i++) {
            if (Contours.isCounterClockwise(contours.get(i))) return false;
        }
        return true;
    }

    private static Map<String, Value> inheritedStyle(BooleanOp op, ShapeRecord base) {
        Map<String, Value> style = new LinkedHashMap<>();
        style.put("fill", Value.bool(true));
        style.put("fillColor", Value.string(op.defaultFill()));
        style.put("strokeColor", Value.string(ColorTable.DEFAULT_STROKE));
        style.put("strokeWidth", Value.number(2));
        style.put("opacity", Value.number(0.8));

        if (base.hasParam("fill")) style.put("fill", base.getParam("fill"));
        if (base.hasParam("fillColor")) style.put("fillColor", base.getParam("fillColor"));
        else if (base.hasParam("color")) style.put("fillColor", base.getParam("color"));
        if (base.hasParam("strokeColor")) style.put("strokeColor", base.getParam("strokeColor"));
        if (base.hasParam("strokeWidth")) style.put("strokeWidth", base.getParam("strokeWidth"));
        if (base.hasParam("opacity")) style.put("opacity", base.getParam("opacity"));
        return style;
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
