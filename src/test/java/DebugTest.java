import com.posh.debug.Debug;
import com.posh.debug.DebugLevel;
import com.posh.script.PoshScript;
import com.posh.script.parser.ScriptRuntimeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    private final List<String> lines = new ArrayList<>();

    private void capture(DebugLevel threshold) {
        Debug.get().setThreshold(threshold);
        Debug.get().setSink((level, tag, message, error) -> lines.add(level + " " + tag + " " + message));
    }

    @AfterEach
    void reset() {
        Debug.get().setSink(null);
        Debug.get().setThreshold(DebugLevel.TRACE);
    }

    @Test
    void silentWithoutSink() {
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));
    }

    @Test
    void pipelineAndStageActivityIsTraced() {
        capture(DebugLevel.TRACE);
        new PoshScript().run("@(1, 2) | Where-Object { $_ -gt 1 }");
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("DEBUG Pipeline start stages=2")));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("TRACE Interpreter stage Where-Object input=2")));
    }

    @Test
    void failuresAreLoggedAsWarnings() {
        capture(DebugLevel.WARN);
        assertThrows(ScriptRuntimeException.class, () -> new PoshScript().run("$nope"));
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).startsWith("WARN PoshScript Undefined variable"));
    }

    @Test
    void thresholdDropsLowerLevels() {
        capture(DebugLevel.INFO);
        Debug.get().d("T", "hidden");
        Debug.get().i("T", "shown");
        assertEquals(List.of("INFO T shown"), lines);
        assertFalse(Debug.get().isEnabled(DebugLevel.DEBUG));
        assertTrue(Debug.get().isEnabled(DebugLevel.ERROR));
    }

    @Test
    void levelNamesParseLeniently() {
        assertEquals(DebugLevel.TRACE, DebugLevel.parse(" trace "));
        assertEquals(DebugLevel.DEBUG, DebugLevel.parse("nonsense"));
    }
}
