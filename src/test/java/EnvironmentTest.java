import org.junit.jupiter.api.Test;

import com.otto.script.error.NameNotFoundException;
import com.otto.script.model.FunctionDef;
import com.otto.script.model.Layer;
import com.otto.script.model.ShapeId;
import com.otto.script.model.ShapeRecord;
import com.otto.script.model.ShapeTransform;
import com.otto.script.model.ShapeType;
import com.otto.script.model.Value;
import com.otto.script.runtime.Environment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentTest {

    private static ShapeRecord circle(String id) {
        LinkedHashMap<String, Value> params = new LinkedHashMap<>();
        params.put("radius", Value.number(5));
        return new ShapeRecord(ShapeType.CIRCLE, id, params, ShapeTransform.identity());
    }

    @Test
    void parameters_resolveThroughParentFrames() {
        Environment env = new Environment();
        env.setParameter("size", Value.number(10));
        env.pushScope();

        assertEquals(1, env.depth());
        assertEquals(Value.number(10), env.getParameter("size"));
        assertTrue(env.hasParameter("size"));
    }

    @Test
    void innerBinding_shadowsOuter_untilPopped() {
        Environment env = new Environment();
        env.setParameter("x", Value.number(1));
        env.pushScope();
        env.setParameter("x", Value.number(2));
        env.setParameter("local", Value.bool(true));

        assertEquals(Value.number(2), env.getParameter("x"));

        env.popScope();
        assertEquals(Value.number(1), env.getParameter("x"));
        assertFalse(env.hasParameter("local"));
        assertEquals(0, env.depth());
    }

    @Test
    void popScope_onGlobal_throws() {
        Environment env = new Environment();
        IllegalStateException ex = assertThrows(IllegalStateException.class, env::popScope);
        assertEquals("Cannot pop global scope", ex.getMessage());
    }

    @Test
    void missingNames_throwNameNotFound() {
        Environment env = new Environment();
        NameNotFoundException p = assertThrows(NameNotFoundException.class, () -> env.getParameter("ghost"));
        assertEquals("Parameter not found: ghost", p.getMessage());
        NameNotFoundException s = assertThrows(NameNotFoundException.class, () -> env.getShape("ghost"));
        assertEquals("Shape not found: ghost", s.getMessage());
        assertThrows(NameNotFoundException.class, () -> env.getFunction("ghost"));
        assertThrows(NameNotFoundException.class, () -> env.getLayer("ghost"));
        assertNull(env.findShape("ghost"));
    }

    @Test
    void loopShapes_areKeyedByIteration() {
        Environment env = new Environment();
        env.pushScope();
        ShapeId first = env.addShape("s", 0.0, circle("a"));
        ShapeId second = env.addShape("s", 1.0, circle("b"));

        assertEquals("s_0", first.render());
        assertEquals("s_1", second.render());
        assertEquals("b", env.getShape("s_1").getId());
        assertTrue(env.hasShape("s_0"));
        assertFalse(env.hasShape("s"));

        env.popScope();
        assertFalse(env.hasShape("s_1"));
    }

    @Test
    void plainId_winsOverRenderedMatch() {
        Environment env = new Environment();
        env.addShape("s_1", null, circle("plain"));
        env.addShape("s", 1.0, circle("looped"));
        assertEquals("plain", env.getShape("s_1").getId());
    }

    @Test
    void globalShapes_surviveNestedScopes() {
        Environment env = new Environment();
        env.pushScope();
        env.pushScope();
        env.defineGlobalShape(ShapeId.inCall("box", "make", 1), circle("g"));
        env.popScope();
        env.popScope();

        assertEquals("g", env.getShape("box_make_1").getId());
        assertEquals(1, env.global().shapes().size());
    }

    @Test
    void layers_tagMemberShapes() {
        Environment env = new Environment();
        ShapeRecord c = circle("c1");
        env.addShape("c", null, c);
        Layer layer = env.createLayer("front");
        env.addShapeToLayer("front", "c");
        env.addShapeToLayer("front", "notYetDefined");

        assertEquals("front", c.getLayerName());
        assertEquals(List.of("c", "notYetDefined"), List.copyOf(layer.getMemberNames()));
        assertEquals(List.of(c), layer.shapes(env::findShape));
        assertSame(layer, env.getLayer("front"));
    }

    @Test
    void functions_visibleFromInnerScopes() {
        Environment env = new Environment();
        env.defineFunction(new FunctionDef("make", List.of("r"), Collections.emptyList()));
        env.pushScope();
        assertTrue(env.hasFunction("make"));
        assertEquals(1, env.getFunction("make").arity());
    }
}
