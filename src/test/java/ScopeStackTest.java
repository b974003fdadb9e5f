import com.posh.script.parser.ScopeStack;
import com.posh.script.parser.ScopeStack.FrameKind;
import com.posh.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeStackTest {

    private static double num(ScopeStack s, String name) {
        return s.read(name).orElseThrow().asNumber();
    }

    @Test
    void namesAreCaseInsensitive() {
        ScopeStack s = new ScopeStack();
        s.write("Total", Value.number(3));
        assertEquals(3.0, num(s, "total"), 1e-9);
        assertEquals(3.0, num(s, "TOTAL"), 1e-9);
        assertTrue(s.read("other").isEmpty());
    }

    @Test
    void globalFrameCannotBePopped() {
        ScopeStack s = new ScopeStack();
        assertThrows(IllegalStateException.class, s::popFrame);
        assertThrows(IllegalArgumentException.class, () -> s.pushFrame(FrameKind.GLOBAL));
        assertEquals(1, s.depth());
    }

    @Test
    void globalQualifierReachesRootFromAnyDepth() {
        ScopeStack s = new ScopeStack();
        s.pushFrame(FrameKind.FUNCTION);
        s.pushFrame(FrameKind.BLOCK);
        s.write("global:g", Value.number(1));
        s.popFrame();
        s.popFrame();
        assertEquals(1.0, num(s, "g"), 1e-9);
    }

    @Test
    void scriptQualifierIsTheGlobalFrame() {
        assertEquals(ScopeStack.GLOBAL_FRAME, ScopeStack.SCRIPT_FRAME);
        ScopeStack s = new ScopeStack();
        s.pushFrame(FrameKind.FUNCTION);
        s.write("script:s", Value.number(3));
        assertEquals(3.0, num(s, "global:s"), 1e-9);
    }

    @Test
    void localQualifierShadowsOuterBinding() {
        ScopeStack s = new ScopeStack();
        s.write("x", Value.number(1));
        s.pushFrame(FrameKind.BLOCK);
        s.write("local:x", Value.number(2));
        assertEquals(2.0, num(s, "x"), 1e-9);
        assertEquals(1.0, num(s, "global:x"), 1e-9);
        s.popFrame();
        assertEquals(1.0, num(s, "x"), 1e-9);
    }

    @Test
    void blockWritesUpdateTheNearestBinding() {
        ScopeStack s = new ScopeStack();
        s.write("x", Value.number(1));
        s.pushFrame(FrameKind.BLOCK);
        s.write("x", Value.number(5));
        s.write("y", Value.number(9));
        s.popFrame();
        assertEquals(5.0, num(s, "x"), 1e-9);
        assertTrue(s.read("y").isEmpty());
    }

    @Test
    void functionFrameIsAWriteBoundary() {
        ScopeStack s = new ScopeStack();
        s.write("n", Value.number(1));
        s.pushFrame(FrameKind.FUNCTION);
        assertTrue(s.isInFunction());
        assertEquals(1.0, num(s, "n"), 1e-9);
        s.write("n", Value.number(2));
        assertEquals(2.0, num(s, "n"), 1e-9);
        s.popFrame();
        assertFalse(s.isInFunction());
        assertEquals(1.0, num(s, "n"), 1e-9);
    }

    @Test
    void calleeDoesNotSeeCallerLocals() {
        ScopeStack s = new ScopeStack();
        s.write("shared", Value.number(7));
        s.pushFrame(FrameKind.FUNCTION);
        s.defineLocal("secret", Value.number(1));
        s.pushFrame(FrameKind.FUNCTION);
        assertTrue(s.read("secret").isEmpty());
        assertEquals(7.0, num(s, "shared"), 1e-9);
        s.pushFrame(FrameKind.BLOCK);
        assertEquals(7.0, num(s, "shared"), 1e-9);
    }

    @Test
    void unknownPrefixIsPartOfTheName() {
        ScopeStack s = new ScopeStack();
        s.write("env:path", Value.string("/bin"));
        assertEquals("/bin", s.read("env:path").orElseThrow().asString());
        assertTrue(s.read("path").isEmpty());
        assertEquals(ScopeStack.Qualifier.NONE, ScopeStack.QualifiedName.parse("env:path").qualifier);
    }

    @Test
    void qualifierParsingIgnoresCase() {
        ScopeStack.QualifiedName q = ScopeStack.QualifiedName.parse("GLOBAL:Count");
        assertEquals(ScopeStack.Qualifier.GLOBAL, q.qualifier);
        assertEquals("Count", q.name);
    }

    @Test
    void globalsSnapshotIsDetached() {
        ScopeStack s = new ScopeStack();
        s.write("a", Value.number(1));
        Map<String, Value> snapshot = s.globals();
        s.write("b", Value.number(2));
        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("c", Value.nil()));
    }
}
