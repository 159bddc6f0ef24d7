import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.otto.debug.Debug;
import com.otto.debug.DebugLevel;
import com.otto.script.error.ArityException;
import com.otto.script.error.NameNotFoundException;
import com.otto.script.error.ScriptArithmeticException;
import com.otto.script.error.ScriptException;
import com.otto.script.model.Constraint;
import com.otto.script.model.ConstraintKind;
import com.otto.script.model.Layer;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.ShapeTransform;
import com.otto.script.model.ShapeType;
import com.otto.script.model.Value;
import com.otto.script.parser.Lexer;
import com.otto.script.parser.Parser;
import com.otto.script.runtime.InterpretResult;
import com.otto.script.runtime.Interpreter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InterpreterTest {

    @AfterEach
    void restoreDebug() {
        Debug.get().resetSink();
        Debug.get().setLevel(DebugLevel.INFO);
    }

    private static InterpretResult run(Interpreter interpreter, String src) {
        return interpreter.interpret(new Parser(new Lexer(src).tokenize()).parse());
    }

    private static InterpretResult run(String src) {
        return run(new Interpreter(), src);
    }

    private static Value param(InterpretResult r, String name) {
        Value v = r.getParameters().get(name);
        assertNotNull(v, "missing parameter " + name);
        return v;
    }

    private static ShapeRecord shape(InterpretResult r, String name) {
        ShapeRecord s = r.shapesByName().get(name);
        assertNotNull(s, "missing shape " + name + " in " + r.shapesByName().keySet());
        return s;
    }

    // -------------------------
    // Parameters and expressions
    // -------------------------

    @Test
    void paramFeedsShapeProperty() {
        InterpretResult r = run("param size 50\nshape circle c { radius: size }");

        assertEquals(Value.number(50), param(r, "size"));
        ShapeRecord c = shape(r, "c");
        assertEquals(ShapeType.CIRCLE, c.getType());
        assertEquals(Map.of("radius", Value.number(50)), c.getParams());
        assertEquals("circle_c_1", c.getId());
    }

    @Test
    void nameFirstShapeSyntax_scenarios() {
        InterpretResult r = run("param size 50\nshape c circle { radius: size }");
        assertEquals(Map.of("radius", Value.number(50)), shape(r, "c").getParams());

        InterpretResult u = run("shape a rectangle { width: 100 height: 60 }\n"
                + "shape b circle { radius: 20 }\n"
                + "union u { add a add b }");
        assertEquals(ShapeType.PATH, shape(u, "u").getType());
    }

    @Test
    void arithmeticAndStrings() {
        InterpretResult r = run(
                "param a 2 + 3 * 4\n"
                + "param b (2 + 3) * 4\n"
                + "param c 7 / 2 - 1\n"
                + "param s \"w\" + 2\n"
                + "param n -(3)\n"
                + "param z null + 1");
        assertEquals(Value.number(14), param(r, "a"));
        assertEquals(Value.number(20), param(r, "b"));
        assertEquals(Value.number(2.5), param(r, "c"));
        assertEquals(Value.string("w2"), param(r, "s"));
        assertEquals(Value.number(-3), param(r, "n"));
        assertEquals(Value.number(1), param(r, "z"));
    }

    @Test
    void comparisonLogicAndTernary() {
        InterpretResult r = run(
                "param t 1 > 2 ? 10 : 20\n"
                + "param l 0 or \"x\"\n"
                + "param k 1 and 0\n"
                + "param e \"a\" == \"a\"\n"
                + "param ne 2 != 2\n"
                + "param b not true");
        assertEquals(Value.number(20), param(r, "t"));
        assertEquals(Value.bool(true), param(r, "l"));
        assertEquals(Value.bool(false), param(r, "k"));
        assertEquals(Value.bool(true), param(r, "e"));
        assertEquals(Value.bool(false), param(r, "ne"));
        assertEquals(Value.bool(false), param(r, "b"));
    }

    @Test
    void arraysAndIndexing() {
        InterpretResult r = run("param arr [[1, 2], [3, 4]]\nparam v arr[1][0]");
        assertEquals(Value.number(3), param(r, "v"));

        ScriptException ex = assertThrows(ScriptException.class,
                () -> run("param arr [1, 2]\nparam v arr[5]"));
        assertEquals("Array index 5 out of bounds for arr (length 2)", ex.getMessage());
        assertEquals(2, ex.getLine());
    }

    @Test
    void propertyOfShape() {
        InterpretResult r = run("shape circle c { radius: 7 }\nparam r c.radius\nparam missing c.width");
        assertEquals(Value.number(7), param(r, "r"));
        assertEquals(Value.nil(), param(r, "missing"));
    }

    @Test
    void lengthOfArrayAndStringParameters() {
        InterpretResult r = run("param arr [4, 5, 6]\nparam n arr.length\nparam s \"abcd\"\nparam k s.length\n"
                + "param x 3\nparam none x.length\nparam other arr.size");
        assertEquals(Value.number(3), param(r, "n"));
        assertEquals(Value.number(4), param(r, "k"));
        assertEquals(Value.nil(), param(r, "none"));
        assertEquals(Value.nil(), param(r, "other"));
    }

    @Test
    void divisionByZero_fails() {
        ScriptArithmeticException ex = assertThrows(ScriptArithmeticException.class, () -> run("param x 10 / 0"));
        assertEquals("Division by zero", ex.getMessage());
    }

    @Test
    void undefinedParameter_fails() {
        NameNotFoundException ex = assertThrows(NameNotFoundException.class, () -> run("param x y + 1"));
        assertEquals("Parameter not found: y", ex.getMessage());
    }

    @Test
    void lastStatementValue_isResult() {
        InterpretResult r = run("param a 1\nparam b 2");
        assertEquals(Value.number(2), r.getResult());
        assertEquals(Value.nil(), run("").getResult());
    }

    // -------------------------
    // Control flow
    // -------------------------

    @Test
    void ifElseIfChain_picksFirstMatch() {
        InterpretResult r = run("param x 5\nif x < 3 { param r 1 } else if x < 10 { param r 2 } else { param r 3 }");
        assertEquals(Value.number(2), param(r, "r"));
    }

    @Test
    void loopShapes_getIterationSuffix() {
        InterpretResult r = run("for i from 0 to 2 { shape circle s { radius: i } }");
        assertEquals(List.of("s_0", "s_1", "s_2"), new ArrayList<>(r.shapesByName().keySet()));
        assertEquals(Value.number(2), shape(r, "s_2").getParam("radius"));
    }

    @Test
    void loopBindings_outliveTheLoop() {
        InterpretResult r = run("for i from 1 to 3 { param last i }");
        assertEquals(Value.number(3), param(r, "last"));
        assertEquals(Value.number(3), param(r, "i"));
    }

    @Test
    void loopStep_isInclusiveAndMustBePositive() {
        InterpretResult r = run("param sum 0\nfor i from 0 to 10 step 5 { param sum sum + i }");
        assertEquals(Value.number(15), param(r, "sum"));

        assertThrows(ScriptException.class, () -> run("for i from 0 to 3 step 0 { }"));
    }

    // -------------------------
    // Functions
    // -------------------------

    @Test
    void functionReturnsValue() {
        InterpretResult r = run("def dbl(n) { return n * 2 }\nparam p dbl(5)");
        assertEquals(Value.number(10), param(r, "p"));
    }

    @Test
    void functionWithoutReturn_yieldsLastValue_andKeepsLocalsLocal() {
        InterpretResult r = run("def f() { param q 7 }\nparam z f()");
        assertEquals(Value.number(7), param(r, "z"));
        assertFalse(r.getParameters().containsKey("q"));
    }

    @Test
    void returnInsideLoop_stopsTheWholeCall() {
        InterpretResult r = run(
                "def first(n) {\n"
                + "  for i from 0 to n {\n"
                + "    if i == 2 { return i * 10 }\n"
                + "  }\n"
                + "  return -1\n"
                + "}\n"
                + "param r first(5)\n"
                + "param none first(1)");
        assertEquals(Value.number(20), param(r, "r"));
        assertEquals(Value.number(-1), param(r, "none"));
    }

    @Test
    void shapesInCalls_areNamedPerCall() {
        InterpretResult r = run(
                "def make(r) {\n"
                + "  shape rectangle box { width: r height: r }\n"
                + "  return r\n"
                + "}\n"
                + "param a make(1)\n"
                + "param b make(2)");
        assertEquals(List.of("box_make_1", "box_make_2"), new ArrayList<>(r.shapesByName().keySet()));
        assertEquals(Value.number(2), shape(r, "box_make_2").getParam("width"));
        assertEquals(Value.number(2), param(r, "b"));
    }

    @Test
    void nestedCall_outerCallTakesFirstOrdinal() {
        InterpretResult r = run(
                "def make(r) {\n"
                + "  shape circle s { radius: r }\n"
                + "  return r + 1\n"
                + "}\n"
                + "param a make(make(1))");
        assertEquals(Value.number(1), shape(r, "s_make_2").getParam("radius"));
        assertEquals(Value.number(2), shape(r, "s_make_1").getParam("radius"));
        assertEquals(Value.number(3), param(r, "a"));
    }

    @Test
    void wrongArgumentCount_fails() {
        ArityException ex = assertThrows(ArityException.class,
                () -> run("def dbl(n) { return n * 2 }\nparam p dbl(1, 2)"));
        assertEquals("dbl() expects 1 argument, got 2", ex.getMessage());

        assertThrows(ArityException.class, () -> run("def add(a, b) { return a + b }\nparam p add(1)"));
    }

    @Test
    void unknownFunction_fails() {
        NameNotFoundException ex = assertThrows(NameNotFoundException.class, () -> run("param p nope(1)"));
        assertEquals("Function not found: nope", ex.getMessage());
    }

    // -------------------------
    // Shapes and styling
    // -------------------------

    @Test
    void unnamedShapes_areNumberedPerType() {
        InterpretResult r = run("shape circle { radius: 1 }\nshape circle { radius: 2 }\nshape star { }");
        assertEquals(List.of("circle1", "circle2", "star1"), new ArrayList<>(r.shapesByName().keySet()));
    }

    @Test
    void positionRotationScale_moveIntoTransform() {
        InterpretResult r = run("shape rectangle r { width: 10 position: [1, 2] rotation: 30 scale: [2, 3] }");
        ShapeRecord s = shape(r, "r");
        assertFalse(s.getParams().containsKey("position"));
        assertFalse(s.getParams().containsKey("rotation"));
        assertFalse(s.getParams().containsKey("scale"));
        ShapeTransform t = s.getTransform();
        assertEquals(1, t.getX(), 1e-9);
        assertEquals(2, t.getY(), 1e-9);
        assertEquals(30, t.getRotation(), 1e-9);
        assertEquals(2, t.getScaleX(), 1e-9);
        assertEquals(3, t.getScaleY(), 1e-9);
    }

    @Test
    void colors_resolveAndFillDefaults() {
        InterpretResult r = run(
                "shape circle a { radius: 5, color: red, fill: true }\n"
                + "shape circle b { radius: 5 fill: true }\n"
                + "shape rectangle c { fillColor: \"blue\" }\n"
                + "shape rectangle d { border: green alpha: 0.5 }\n"
                + "shape text t { content: \"hi\" }");

        ShapeRecord a = shape(r, "a");
        assertEquals(Value.string("#FF0000"), a.getParam("color"));
        assertEquals(Value.string("#FF0000"), a.getParam("fillColor"));
        assertEquals(Value.string("#808080"), shape(r, "b").getParam("fillColor"));
        assertEquals(Value.string("#0000FF"), shape(r, "c").getParam("fillColor"));
        assertEquals(Value.bool(true), shape(r, "c").getParam("fill"));
        assertEquals(Value.string("#008000"), shape(r, "d").getParam("strokeColor"));
        assertEquals(Value.number(0.5), shape(r, "d").getParam("opacity"));
        assertEquals(Value.bool(true), shape(r, "t").getParam("fill"));
        assertEquals(Value.string("#000000"), shape(r, "t").getParam("fillColor"));
    }

    @Test
    void fillAndStyleStatements() {
        InterpretResult r = run(
                "shape circle a { radius: 5 }\n"
                + "shape circle b { radius: 5 }\n"
                + "shape circle c { radius: 5 }\n"
                + "fill a: blue\n"
                + "fill b\n"
                + "fill c: false\n"
                + "style a { strokeColor: green, strokeWidth: 3 }");

        assertEquals(Value.bool(true), shape(r, "a").getParam("fill"));
        assertEquals(Value.string("#0000FF"), shape(r, "a").getParam("fillColor"));
        assertEquals(Value.string("#008000"), shape(r, "a").getParam("strokeColor"));
        assertEquals(Value.number(3), shape(r, "a").getParam("strokeWidth"));
        assertEquals(Value.string("#808080"), shape(r, "b").getParam("fillColor"));
        assertEquals(Value.bool(false), shape(r, "c").getParam("fill"));
        assertFalse(shape(r, "c").hasParam("fillColor"));
    }

    @Test
    void fillOnMissingShape_warnsAndContinues() {
        List<String> warnings = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.WARN) warnings.add(tag + ": " + message);
        });

        InterpretResult r = run("fill ghost: red\nstyle ghost { strokeWidth: 2 }\nparam p 1");

        assertEquals(Value.number(1), param(r, "p"));
        assertEquals(2, warnings.size());
        assertTrue(warnings.get(0).startsWith("Style: fill: shape 'ghost' not found"), warnings.get(0));
    }

    // -------------------------
    // Layers, transforms, drawing, constraints
    // -------------------------

    @Test
    void layerCollectsShapesAndRotation() {
        InterpretResult r = run(
                "shape circle a { radius: 3 }\n"
                + "shape circle b { radius: 3 }\n"
                + "layer front { add a rotate 30 if 1 > 2 { add b } subtract b }");

        Layer layer = r.getLayers().get("front");
        assertNotNull(layer);
        assertEquals(List.of("a"), new ArrayList<>(layer.getMemberNames()));
        assertEquals(30, layer.getTransform().getRotation(), 1e-9);
        assertEquals(3, layer.getOperations().size());
        assertEquals("front", shape(r, "a").getLayerName());
        assertNull(shape(r, "b").getLayerName());
    }

    @Test
    void transformStatement_updatesShapeAndLayer() {
        InterpretResult r = run(
                "shape rectangle r { width: 10 height: 10 }\n"
                + "layer l { add r }\n"
                + "transform r { scale: 2 rotate: 45 rotate: 15 position: [4, 5] }\n"
                + "transform l { rotate: 90 }");

        ShapeTransform t = shape(r, "r").getTransform();
        assertEquals(2, t.getScaleX(), 1e-9);
        assertEquals(2, t.getScaleY(), 1e-9);
        assertEquals(60, t.getRotation(), 1e-9);
        assertEquals(4, t.getX(), 1e-9);
        assertEquals(5, t.getY(), 1e-9);
        assertEquals(90, r.getLayers().get("l").getTransform().getRotation(), 1e-9);
    }

    @Test
    void transformOfUnknownTarget_fails() {
        NameNotFoundException ex = assertThrows(NameNotFoundException.class, () -> run("transform ghost { rotate: 5 }"));
        assertEquals("Transform target not found: ghost", ex.getMessage());
    }

    @Test
    void drawBlock_makesOpenPath() {
        InterpretResult r = run("draw pen { forward 10 right 90 forward 10 penup goto [50, 50] pendown forward 5 }");

        ShapeRecord pen = shape(r, "pen");
        assertEquals(ShapeType.PATH, pen.getType());
        assertEquals(Value.bool(true), pen.getParam("isTurtlePath"));
        assertEquals(Value.bool(false), pen.getParam("closed"));
        assertEquals(Value.bool(false), pen.getParam("fill"));
        assertEquals(2, pen.getParam("subPaths").asArray().size());
        assertEquals(5, pen.getParam("points").asArray().size());
    }

    @Test
    void drawWithoutStrokes_makesNoShape() {
        InterpretResult r = run("draw pen { penup forward 5 }");
        assertTrue(r.getShapes().isEmpty());
    }

    @Test
    void constraintsAreRecorded() {
        InterpretResult r = run("param gap 15\nconstraints { coincident a.center b.center distance a.left b.right gap horizontal a.top b.top }");

        List<Constraint> constraints = r.getConstraints();
        assertEquals(3, constraints.size());
        assertEquals(ConstraintKind.COINCIDENT, constraints.get(0).getKind());
        assertEquals("center", constraints.get(0).getA().anchor);
        assertEquals(ConstraintKind.DISTANCE, constraints.get(1).getKind());
        assertEquals(15.0, constraints.get(1).getDistance(), 1e-9);
        assertEquals("right", constraints.get(1).getB().anchor);
        assertNull(constraints.get(2).getDistance());
    }

    // -------------------------
    // Boolean statements
    // -------------------------

    private static final String UNION_SCRIPT =
            "shape rectangle a { width: 100 height: 60 }\n"
            + "shape circle b { radius: 20 }\n"
            + "union u { add a add b }";

    @Test
    void union_consumesOperands_andRegistersResult() {
        InterpretResult r = run(UNION_SCRIPT);

        ShapeRecord u = shape(r, "u");
        assertEquals(ShapeType.PATH, u.getType());
        assertEquals("a_U1", u.getId());
        assertEquals(Value.array(List.of(Value.string("a"), Value.string("b"))), u.getParam("operands"));
        assertTrue(shape(r, "a").isConsumedByBoolean());
        assertTrue(shape(r, "b").isConsumedByBoolean());
        assertFalse(u.isConsumedByBoolean());
    }

    @Test
    void difference_onUnknownOperand_fails() {
        NameNotFoundException ex = assertThrows(NameNotFoundException.class,
                () -> run("shape circle a { radius: 3 }\ndifference d { add a add ghost }"));
        assertTrue(ex.getMessage().contains("Shape not found: ghost"), ex.getMessage());
    }

    @Test
    void booleanNaming_restartsEveryRun() {
        Interpreter interpreter = new Interpreter();
        InterpretResult first = run(interpreter, UNION_SCRIPT);
        InterpretResult second = run(interpreter, UNION_SCRIPT);

        assertEquals("a_U1", shape(first, "u").getId());
        assertEquals("a_U1", shape(second, "u").getId());
    }

    @Test
    void sameScript_sameResult() {
        String src = UNION_SCRIPT + "\nfor i from 0 to 2 { shape circle s { radius: i + 1 } }\nparam k 3";
        InterpretResult a = run(src);
        InterpretResult b = run(src);

        assertEquals(a.getParameters(), b.getParameters());
        assertEquals(a.shapesByName(), b.shapesByName());
    }
}
