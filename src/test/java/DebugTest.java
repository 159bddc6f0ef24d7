import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.otto.debug.Debug;
import com.otto.debug.DebugLevel;
import com.otto.debug.Slf4jDebugSink;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @AfterEach
    void restore() {
        Debug.get().resetSink();
        Debug.get().setLevel(DebugLevel.INFO);
    }

    @Test
    void defaultSink_isSlf4j() {
        assertInstanceOf(Slf4jDebugSink.class, Debug.get().getSink());
        assertEquals(DebugLevel.INFO, Debug.get().getLevel());
        // must not throw with or without an error attached
        Debug.get().w("DebugTest", "warning through slf4j");
        Debug.get().e("DebugTest", "error through slf4j", new IllegalStateException("boom"));
    }

    @Test
    void levelFiltersBeforeTheSink() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + tag + " " + message));

        Debug.get().d("T", "hidden");
        Debug.get().i("T", "shown");
        Debug.get().setLevel(DebugLevel.TRACE);
        Debug.get().t("T", "now shown");

        assertEquals(List.of("INFO T shown", "TRACE T now shown"), seen);
    }

    @Test
    void nullSink_silencesOutput() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        Debug.get().e("T", "dropped");
    }
}
