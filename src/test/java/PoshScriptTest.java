import com.posh.script.PoshScript;
import com.posh.script.PoshSession;
import com.posh.script.parser.ScriptRuntimeException;
import com.posh.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PoshScriptTest {

    private static Value run(String src) {
        return new PoshScript().run(src);
    }

    private static ScriptRuntimeException fails(String src) {
        return assertThrows(ScriptRuntimeException.class, () -> run(src));
    }

    private static List<Double> numbers(Value v) {
        List<Double> out = new ArrayList<>();
        for (Value item : v.asList()) out.add(item.asNumber());
        return out;
    }

    @Test
    void variablesAndAddition() {
        Value v = run("$x = 5; $y = 10; $x + $y");
        assertEquals(15.0, v.asNumber(), 1e-9);
    }

    @Test
    void functionWithReturn() {
        Value v = run("function Add($a, $b) { return $a + $b }\nAdd 5 10");
        assertEquals(15.0, v.asNumber(), 1e-9);
    }

    @Test
    void recordPropertyAccessIsCaseInsensitive() {
        assertEquals("John", run("$obj = @{Name=\"John\"; Age=30}; $obj.Name").asString());
        assertEquals("John", run("$obj = @{Name=\"John\"; Age=30}; $obj.name").asString());
        assertEquals(30.0, run("$obj = @{Name=\"John\"; Age=30}; $obj.AGE").asNumber(), 1e-9);
    }

    @Test
    void pipelineFilterKeepsOrder() {
        Value v = run("@(1, 2, 3, 4, 5) | Where-Object { $_ -gt 2 }");
        assertEquals(List.of(3.0, 4.0, 5.0), numbers(v));
    }

    @Test
    void fullPipelineScenario() {
        String src = ""
                + "$data = @(@{Name=\"A\"; Value=10}, @{Name=\"B\"; Value=20}, @{Name=\"C\"; Value=5})\n"
                + "$result = $data | Where-Object { $_.Value -gt 8 } | Sort-Object Value -Descending\n"
                + "$result.Count";
        // $result is a List, which has no properties
        ScriptRuntimeException e = fails(src);
        assertEquals(ScriptRuntimeException.Kind.INVALID_PROPERTY_ACCESS, e.getKind());

        Value names = run(""
                + "$data = @(@{Name=\"A\"; Value=10}, @{Name=\"B\"; Value=20}, @{Name=\"C\"; Value=5})\n"
                + "$data | Where-Object { $_.Value -gt 8 } | Sort-Object Value -Descending | ForEach-Object -MemberName Name");
        assertEquals(List.of(Value.string("B"), Value.string("A")), names.asList());
    }

    @Test
    void groupedCountScenario() {
        Value v = run("$g = @(\"x\", \"y\", \"x\") | Group-Object\n$g[0].Count");
        assertEquals(2.0, v.asNumber(), 1e-9);
    }

    @Test
    void globalCounterThroughFunction() {
        Value v = run("$global:c = 0; function Inc { $global:c = $global:c + 1 }; Inc; Inc; $c");
        assertEquals(2.0, v.asNumber(), 1e-9);
    }

    @Test
    void arithmeticFollowsDoubleSemantics() {
        assertEquals(0.1 + 0.2, run("0.1 + 0.2").asNumber(), 0.0);
        assertEquals(3.5, run("7 / 2").asNumber(), 1e-9);
        assertEquals(1.0, run("7 % 3").asNumber(), 1e-9);
        assertEquals(7.0, run("1 + 2 * 3").asNumber(), 1e-9);
        assertEquals(9.0, run("(1 + 2) * 3").asNumber(), 1e-9);
        assertEquals(-4.0, run("-(2 + 2)").asNumber(), 1e-9);
    }

    @Test
    void divisionByZeroIsAnError() {
        assertEquals(ScriptRuntimeException.Kind.DIVISION_BY_ZERO, fails("7 / 0").getKind());
        assertEquals(ScriptRuntimeException.Kind.DIVISION_BY_ZERO, fails("7 % 0").getKind());
    }

    @Test
    void plusConcatenatesWhenEitherSideIsText() {
        assertEquals("a1", run("\"a\" + 1").asString());
        assertEquals("12", run("1 + \"2\"").asString());
        assertEquals(6.0, run("\"3\" * 2").asNumber(), 1e-9);
        ScriptRuntimeException e = fails("\"abc\" * 2");
        assertEquals(ScriptRuntimeException.Kind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    void comparisonsAreNumericOrCaseInsensitive() {
        assertTrue(run("5 -gt 3").asBool());
        assertTrue(run("\"abc\" -eq \"ABC\"").asBool());
        assertTrue(run("\"10\" -gt 9").asBool());
        assertTrue(run("\"b\" -gt \"A\"").asBool());
        assertTrue(run("0 -eq -0").asBool());
        assertFalse(run("1 -ne 1").asBool());
        assertTrue(run("3 -le 3 -and 2 -ge 1").asBool());
    }

    @Test
    void logicalOperatorsShortCircuit() {
        assertFalse(run("$false -and (Does-Not-Exist)").asBool());
        assertTrue(run("$true -or (Does-Not-Exist)").asBool());
        assertTrue(run("-not $false").asBool());
        assertTrue(run("!0").asBool());
    }

    @Test
    void stringInterpolation() {
        assertEquals("Hello World! 3", run("$name = \"World\"; \"Hello $name! $(1 + 2)\"").asString());
        assertEquals("Hello $name", run("$name = \"World\"; 'Hello $name'").asString());
        assertEquals("it's", run("'it''s'").asString());
    }

    @Test
    void ifElseIfElseYieldsBranchValue() {
        String src = "$x = 5\nif ($x -gt 10) { \"big\" } elseif ($x -gt 3) { \"medium\" } else { \"small\" }";
        assertEquals("medium", run(src).asString());
        assertTrue(run("if ($false) { 1 }").isNull());
    }

    @Test
    void implicitReturnOfLastStatement() {
        assertEquals(2.0, run("function F { $x = 1; $x = 2; $x }\nF").asNumber(), 1e-9);
        assertTrue(run("function E { }\nE").isNull());
    }

    @Test
    void recursion() {
        String src = "function Fact($n) { if ($n -le 1) { return 1 }; return $n * (Fact ($n - 1)) }\nFact 5";
        assertEquals(120.0, run(src).asNumber(), 1e-9);
    }

    @Test
    void parameterDefaultsAndMissingArguments() {
        assertEquals(9.0, run("function G($a, $b = $a * 2) { $a + $b }\nG 3").asNumber(), 1e-9);
        assertTrue(run("function H($a, $b) { $b -eq $null }\nH 1").asBool());
    }

    @Test
    void namedArgumentsBindByName() {
        assertEquals(9.0, run("function Sub($a, $b) { $a - $b }\nSub -b 1 -a 10").asNumber(), 1e-9);
        ScriptRuntimeException e = fails("function Sub($a, $b) { $a - $b }\nSub -c 1");
        assertEquals(ScriptRuntimeException.Kind.INVALID_OPERATION, e.getKind());
    }

    @Test
    void paramBlockDeclaresParameters() {
        String src = "function Greet {\n  param($who = \"you\")\n  \"hi $who\"\n}\nGreet; Greet -who me";
        Value v = new PoshScript().newSession().evaluateLine(src).get(1);
        assertEquals("hi me", v.asString());
    }

    @Test
    void leftoverArgumentsGoToArgs() {
        assertEquals(List.of(1.0, 2.0, 3.0), numbers(run("function Cnt { $args }\nCnt 1 2 3")));
    }

    @Test
    void compoundAssignment() {
        assertEquals(5.0, run("$i = 1; $i += 4; $i").asNumber(), 1e-9);
        assertEquals(-3.0, run("$i = 1; $i -= 4; $i").asNumber(), 1e-9);
    }

    @Test
    void listIndexing() {
        assertEquals(20.0, run("$l = @(10, 20, 30); $l[1]").asNumber(), 1e-9);
        assertEquals(30.0, run("$l = @(10, 20, 30); $l[-1]").asNumber(), 1e-9);
        assertTrue(run("$l = @(10, 20, 30); $l[5]").isNull());
        assertEquals(List.of(1.0, 2.0, 3.0), numbers(run("@(1, 2) + 3")));
    }

    @Test
    void recordKeysFoldCaseAndKeepFirstSpelling() {
        Value r = run("@{a=1; A=2}");
        Map<String, Value> props = r.asRecord();
        assertEquals(1, props.size());
        assertEquals(2.0, props.get("a").asNumber(), 1e-9);
    }

    @Test
    void missingPropertyAndNonRecordAccess() {
        ScriptRuntimeException missing = fails("$obj = @{Name=\"x\"}; $obj.Missing");
        assertEquals(ScriptRuntimeException.Kind.INVALID_PROPERTY_ACCESS, missing.getKind());
        assertEquals(ScriptRuntimeException.PropertyFailure.MISSING_PROPERTY, missing.getPropertyFailure());

        ScriptRuntimeException notRecord = fails("$n = 5; $n.Name");
        assertEquals(ScriptRuntimeException.Kind.INVALID_PROPERTY_ACCESS, notRecord.getKind());
        assertEquals(ScriptRuntimeException.PropertyFailure.NOT_A_RECORD, notRecord.getPropertyFailure());
    }

    @Test
    void undefinedVariable() {
        ScriptRuntimeException e = fails("$nope");
        assertEquals(ScriptRuntimeException.Kind.UNDEFINED_VARIABLE, e.getKind());
        assertEquals("nope", e.getName());
    }

    @Test
    void unknownCommand() {
        ScriptRuntimeException e = fails("Get-Nothing -Force");
        assertEquals(ScriptRuntimeException.Kind.COMMAND_NOT_FOUND, e.getKind());
        assertEquals("Get-Nothing", e.getName());
    }

    @Test
    void returnAtTopLevelIsRejected() {
        assertEquals(ScriptRuntimeException.Kind.RETURN_OUTSIDE_FUNCTION, fails("return 5").getKind());
    }

    @Test
    void callDepthIsBounded() {
        PoshScript engine = new PoshScript();
        engine.setMaxCallDepth(10);
        PoshSession session = engine.newSession();
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> session.evaluate("function Loop($n) { Loop ($n + 1) }\nLoop 0"));
        assertEquals(ScriptRuntimeException.Kind.CALL_DEPTH_EXCEEDED, e.getKind());

        // the session is still usable and every frame was released
        assertEquals(1, session.interpreter().getScope().depth());
        assertEquals(3.0, session.evaluate("$x = 3; $x").asNumber(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> engine.setMaxCallDepth(0));
    }

    @Test
    void recursiveBlocksHitTheDepthLimit() {
        PoshScript engine = new PoshScript();
        engine.setMaxCallDepth(20);
        PoshSession session = engine.newSession();
        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> session.evaluate("$f = { & $f }; & $f"));
        assertEquals(ScriptRuntimeException.Kind.CALL_DEPTH_EXCEEDED, e.getKind());
        assertEquals(1, session.interpreter().getScope().depth());

        ScriptRuntimeException viaStage = assertThrows(ScriptRuntimeException.class,
                () -> new PoshScript().run("$g = { 1 | ForEach-Object $g }; 1 | ForEach-Object $g"));
        assertEquals(ScriptRuntimeException.Kind.CALL_DEPTH_EXCEEDED, viaStage.getKind());
    }

    @Test
    void blocksWithinTheLimitStillRun() {
        PoshScript engine = new PoshScript();
        engine.setMaxCallDepth(4);
        Value v = engine.run("function Twice($n) { & { $n * 2 } }\n@(1, 2) | ForEach-Object { Twice $_ }");
        assertEquals(List.of(2.0, 4.0), numbers(v));
    }

    @Test
    void nanIsUnequalToEverything() {
        PoshSession session = new PoshScript().newSession();
        session.setVariable("nan", Value.number(Double.NaN));
        assertFalse(session.evaluate("$nan -eq 1").asBool());
        assertFalse(session.evaluate("$nan -eq $nan").asBool());
        assertTrue(session.evaluate("$nan -ne 1").asBool());
        assertTrue(session.evaluate("1 -ne $nan").asBool());
        assertFalse(session.evaluate("$nan -gt 1").asBool());
        assertFalse(session.evaluate("$nan -le 1").asBool());
    }

    @Test
    void functionWritesStayLocal() {
        assertEquals(1.0, run("$n = 1\nfunction Set-N { $n = 2 }\nSet-N\n$n").asNumber(), 1e-9);
        assertEquals(2.0, run("$n = 1\nfunction Set-N { $global:n = 2 }\nSet-N\n$n").asNumber(), 1e-9);
        assertEquals(2.0, run("$n = 1\nfunction Set-N { $script:n = 2 }\nSet-N\n$n").asNumber(), 1e-9);
    }

    @Test
    void functionsSeeGlobalsButNotCallerLocals() {
        assertEquals(7.0, run("$g = 7\nfunction Read-G { $g }\nRead-G").asNumber(), 1e-9);
        ScriptRuntimeException e = fails("function Inner { $secret }\nfunction Outer { $secret = 1; Inner }\nOuter");
        assertEquals(ScriptRuntimeException.Kind.UNDEFINED_VARIABLE, e.getKind());
    }

    @Test
    void blocksAreValues() {
        assertEquals(42.0, run("$b = { 42 }; & $b").asNumber(), 1e-9);
        assertEquals("{ $_ * 2 }", run("$b = { $_ * 2 }; \"$b\"").asString());
        assertEquals(Value.Type.BLOCK, run("{ 1 }").type);
    }

    @Test
    void functionsAndBlocksAreInspectableFromTheHost() {
        PoshSession session = new PoshScript().newSession();
        session.evaluate("function Add($a, $b = 1) { $a + $b }\n$blk = { $_ }");
        assertEquals(List.of("a", "b"), session.getVariable("add").asFunction().getParameterNames());
        assertEquals("Add", session.getVariable("Add").asFunction().getName());
        assertEquals("{ $_ }", session.getVariable("blk").asBlock().getSource());
        assertNull(session.interpreter().currentFunctionName());
    }

    @Test
    void ampersandInvokesCommandByName() {
        assertEquals(3.0, run("function Three { 3 }\n$name = \"Three\"; & $name").asNumber(), 1e-9);
    }

    @Test
    void runWithInitialGlobals() {
        Value v = new PoshScript().run("$seed * 2", Map.of("seed", Value.number(21)));
        assertEquals(42.0, v.asNumber(), 1e-9);
    }

    @Test
    void sessionKeepsGlobalsBetweenLines() {
        PoshSession session = new PoshScript().newSession();
        assertTrue(session.evaluateLine("$a = 1").isEmpty());
        List<Value> out = session.evaluateLine("$a + 1");
        assertEquals(1, out.size());
        assertEquals(2.0, out.get(0).asNumber(), 1e-9);

        List<Value> items = session.evaluateLine("@(1, 2) | ForEach-Object { $_ * 10 }");
        assertEquals(List.of(Value.number(10), Value.number(20)), items);
        assertEquals(1.0, session.getVariable("A").asNumber(), 1e-9);

        session.setVariable("b", Value.string("x"));
        assertTrue(session.globals().containsKey("b"));
    }

    @Test
    void errorReporterSeesFailures() {
        PoshScript engine = new PoshScript();
        List<RuntimeException> seen = new ArrayList<>();
        engine.setErrorReporter((e, source) -> seen.add(e));
        assertThrows(ScriptRuntimeException.class, () -> engine.run("$nope"));
        assertEquals(1, seen.size());
    }
}
