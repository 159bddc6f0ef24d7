import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.otto.debug.Debug;
import com.otto.debug.DebugLevel;
import com.otto.script.RunOptions;
import com.otto.script.RunResult;
import com.otto.script.ScriptRunner;
import com.otto.script.model.ShapeRecord;
import com.otto.script.store.DefaultShapeFactory;
import com.otto.script.store.InMemoryParameterStore;
import com.otto.script.store.InMemoryShapeStore;
import com.otto.script.store.ShapeFactory;
import com.otto.script.store.StoredParameter;
import com.otto.script.store.StoredShape;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptRunnerTest {

    private final InMemoryShapeStore shapes = new InMemoryShapeStore();
    private final InMemoryParameterStore parameters = new InMemoryParameterStore();
    private final ScriptRunner runner = new ScriptRunner(shapes, parameters, new DefaultShapeFactory());

    @AfterEach
    void restoreDebug() {
        Debug.get().resetSink();
        Debug.get().setLevel(DebugLevel.INFO);
    }

    @Test
    void run_logsStartAndFinish() {
        List<String> infos = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.INFO) infos.add(message);
        });

        runner.run("param size 5");

        assertEquals("Run started", infos.get(0));
        assertEquals("Run finished: 0 shape(s), 1 parameter(s)", infos.get(infos.size() - 1));
    }

    @Test
    void run_copiesParametersAndShapes() {
        RunResult result = runner.run("param size 50\nshape circle c { radius: size position: [3, 4] }");

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(1, result.getShapesCreated());
        assertEquals(1, result.getParametersCreated());

        assertEquals(50.0, parameters.getByName("size").getValue(), 1e-9);
        StoredShape c = shapes.getByName("c");
        assertNotNull(c);
        assertEquals("circle", c.getType());
        assertEquals(50.0, c.getOptions().get("radius"));
        assertEquals(3.0, c.getX(), 1e-9);
        assertEquals(4.0, c.getY(), 1e-9);
    }

    @Test
    void union_storesOnlyTheResult() {
        RunResult result = runner.run(
                "shape rectangle a { width: 100 height: 60 }\n"
                + "shape circle b { radius: 20 }\n"
                + "union u { add a add b }");

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(1, shapes.size());
        StoredShape u = shapes.getByName("u");
        assertEquals("path", u.getType());
        assertEquals("a_U1", u.getId());
        assertEquals(List.of("a", "b"), u.getOptions().get("operands"));
        assertEquals("union", u.getOptions().get("operation"));
        assertEquals(1, result.getShapesCreated());

        // the evaluator output still has the consumed operands
        ShapeRecord a = result.getInterpretResult().shapesByName().get("a");
        assertTrue(a.isConsumedByBoolean());
    }

    @Test
    void failedRun_leavesStoresUntouched() {
        runner.run("param keep 1\nshape circle old { radius: 2 }");
        assertEquals(1, shapes.size());
        assertEquals(1, parameters.size());

        RunResult result = runner.run("param fresh 2\nshape x circle { radius: 10 / 0 }");

        assertFalse(result.isSuccess());
        assertEquals("Division by zero", result.getError());
        assertNull(result.getShapesCreated());
        assertNull(result.getInterpretResult());
        assertNotNull(shapes.getByName("old"));
        assertNotNull(parameters.getByName("keep"));
        assertNull(parameters.getByName("fresh"));
        assertEquals(1, shapes.size());
        assertEquals(1, parameters.size());
    }

    @Test
    void parseError_reportsPosition() {
        RunResult result = runner.run("param a 1\nshape circle c { radius 10 }");

        assertFalse(result.isSuccess());
        assertEquals(2, result.getLine());
        assertEquals(25, result.getColumn());
        assertTrue(result.getError().startsWith("Parser error at line 2, col 25"), result.getError());
    }

    @Test
    void lexError_reportsPosition() {
        RunResult result = runner.run("param c #12345");
        assertFalse(result.isSuccess());
        assertEquals(1, result.getLine());
        assertEquals(9, result.getColumn());
    }

    @Test
    void geometryError_isReported() {
        RunResult result = runner.run(
                "shape rectangle a { width: 10 height: 10 }\n"
                + "shape rectangle b { width: 10 height: 10 position: [100, 100] }\n"
                + "intersection i { add a add b }");
        assertFalse(result.isSuccess());
        assertEquals("Intersection operation resulted in empty geometry", result.getError());
        assertEquals(0, shapes.size());
    }

    @Test
    void existingParameter_isUpdatedInPlace() {
        StoredParameter existing = parameters.add("size", 10);

        RunResult result = runner.run("param size 75\nparam label \"abc\"",
                RunOptions.defaults().withClearParameters(false));

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(2, result.getParametersCreated());
        assertSame(existing, parameters.getByName("size"));
        assertEquals(75.0, existing.getValue(), 1e-9);
        assertEquals(0.0, parameters.getByName("label").getValue(), 1e-9);
        assertEquals(2, parameters.size());
    }

    @Test
    void clearOptions_controlWhatIsWiped() {
        runner.run("param a 1\nshape circle old { radius: 2 }");

        runner.run("shape circle next { radius: 3 }", RunOptions.defaults().withClearShapes(false));
        assertNotNull(shapes.getByName("old"));
        assertNotNull(shapes.getByName("next"));
        assertNull(parameters.getByName("a"));

        runner.run("shape circle last { radius: 3 }");
        assertEquals(1, shapes.size());
        assertNotNull(shapes.getByName("last"));
    }

    @Test
    void unsupportedShapeTypes_areSkipped() {
        DefaultShapeFactory defaults = new DefaultShapeFactory();
        ShapeFactory circlesOnly = new ShapeFactory() {
            @Override
            public boolean supports(String type) {
                return type.equals("circle");
            }

            @Override
            public StoredShape create(String name, ShapeRecord shape) {
                return defaults.create(name, shape);
            }
        };
        ScriptRunner picky = new ScriptRunner(shapes, parameters, circlesOnly);

        RunResult result = picky.run("shape circle c { radius: 1 }\nshape rectangle r { width: 2 }");

        assertTrue(result.isSuccess());
        assertEquals(1, result.getShapesCreated());
        assertNull(shapes.getByName("r"));
    }

    @Test
    void snakeCaseOptions_becomeCamelCase() {
        runner.run("shape roundedRectangle r { corner_radius: 4 }");
        assertEquals(4.0, shapes.getByName("r").getOptions().get("cornerRadius"));
    }

    @Test
    void loopAndCallShapes_useRenderedNames() {
        runner.run("def make(r) { shape circle dot { radius: r } }\n"
                + "for i from 0 to 1 { shape circle s { radius: i + 1 } }\n"
                + "param x make(3)");
        assertNotNull(shapes.getByName("s_0"));
        assertNotNull(shapes.getByName("s_1"));
        assertNotNull(shapes.getByName("dot_make_1"));
    }

    @Test
    void runResult_json() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        JsonNode failure = mapper.readTree(mapper.writeValueAsString(runner.run("param x 1 / 0")));
        assertFalse(failure.get("success").asBoolean());
        assertEquals("Division by zero", failure.get("error").asText());
        assertFalse(failure.has("shapesCreated"));
        assertFalse(failure.has("line"));
        assertFalse(failure.has("interpretResult"));

        JsonNode success = mapper.readTree(mapper.writeValueAsString(runner.run("shape circle c { radius: 1 }")));
        assertTrue(success.get("success").asBoolean());
        assertEquals(1, success.get("shapesCreated").asInt());
        assertFalse(success.has("error"));
        assertFalse(success.has("interpretResult"));
    }

    @Test
    void storedShapes_serializeToJson() throws Exception {
        runner.run("draw pen { forward 10 }");
        ObjectMapper mapper = new ObjectMapper();
        JsonNode all = mapper.readTree(mapper.writeValueAsString(shapes.getAll()));

        assertEquals(1, all.size());
        JsonNode pen = all.get(0);
        assertEquals("pen", pen.get("name").asText());
        assertEquals("path", pen.get("type").asText());
        assertTrue(pen.get("options").get("isTurtlePath").asBoolean());
        assertEquals(2, pen.get("options").get("points").size());
    }
}
