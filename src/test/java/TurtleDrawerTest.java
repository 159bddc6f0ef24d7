import org.junit.jupiter.api.Test;

import com.otto.script.runtime.TurtleDrawer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TurtleDrawerTest {

    private static void assertPoint(double x, double y, double[] p) {
        assertEquals(x, p[0], 1e-9);
        assertEquals(y, p[1], 1e-9);
    }

    @Test
    void forwardAndTurn_traceOnePath() {
        TurtleDrawer t = new TurtleDrawer();
        t.forward(10);
        t.right(90);
        t.forward(10);

        List<List<double[]>> paths = t.getDrawingPaths();
        assertEquals(1, paths.size());
        List<double[]> path = paths.get(0);
        assertEquals(3, path.size());
        assertPoint(0, 0, path.get(0));
        assertPoint(10, 0, path.get(1));
        assertPoint(10, 10, path.get(2));
    }

    @Test
    void heading_isNormalized() {
        TurtleDrawer t = new TurtleDrawer();
        t.right(450);
        assertEquals(90, t.getAngle(), 1e-9);
        t.left(120);
        assertEquals(330, t.getAngle(), 1e-9);
        t.left(720);
        assertEquals(330, t.getAngle(), 1e-9);
    }

    @Test
    void backward_movesAgainstHeading() {
        TurtleDrawer t = new TurtleDrawer();
        t.backward(5);
        assertEquals(-5, t.getX(), 1e-9);
        assertEquals(0, t.getY(), 1e-9);
    }

    @Test
    void penUp_splitsPaths() {
        TurtleDrawer t = new TurtleDrawer();
        t.forward(10);
        t.penUp();
        assertFalse(t.isPenDown());
        t.moveTo(20, 0);
        t.penDown();
        t.forward(5);

        List<List<double[]>> paths = t.getDrawingPaths();
        assertEquals(2, paths.size());
        assertPoint(0, 0, paths.get(0).get(0));
        assertPoint(10, 0, paths.get(0).get(1));
        assertPoint(20, 0, paths.get(1).get(0));
        assertPoint(25, 0, paths.get(1).get(1));
    }

    @Test
    void freshOrReset_hasNoPaths() {
        TurtleDrawer t = new TurtleDrawer();
        assertTrue(t.getDrawingPaths().isEmpty());

        t.forward(3);
        t.right(45);
        t.reset();
        assertTrue(t.getDrawingPaths().isEmpty());
        assertEquals(0, t.getAngle(), 1e-9);
        assertTrue(t.isPenDown());
    }

    @Test
    void movesWithPenUp_drawNothing() {
        TurtleDrawer t = new TurtleDrawer();
        t.penUp();
        t.forward(10);
        t.moveTo(3, 4);
        assertTrue(t.getDrawingPaths().isEmpty());
        assertEquals(3, t.getX(), 1e-9);
        assertEquals(4, t.getY(), 1e-9);
    }
}
