import com.posh.script.PoshScript;
import com.posh.script.PoshSession;
import com.posh.script.StageRegistry;
import com.posh.script.parser.Interpreter;
import com.posh.script.parser.ScopeStack;
import com.posh.script.parser.ScriptRuntimeException;
import com.posh.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineTest {

    private static List<Double> numbers(Value v) {
        List<Double> out = new ArrayList<>();
        for (Value item : v.asList()) out.add(item.asNumber());
        return out;
    }

    @Test
    void blockStageRunsOncePerItemInOrder() {
        Value v = new PoshScript().run("@(3, 1, 2) | { $_ * 10 }");
        assertEquals(List.of(30.0, 10.0, 20.0), numbers(v));
    }

    @Test
    void psItemIsAnAliasForTheCurrentItem() {
        Value v = new PoshScript().run("@(1, 2) | ForEach-Object { $PSItem + 1 }");
        assertEquals(List.of(2.0, 3.0), numbers(v));
    }

    @Test
    void leadingBlockIsAValue() {
        Value v = new PoshScript().run("{ 1 } | Write-Output");
        assertEquals(Value.Type.BLOCK, v.type);
    }

    @Test
    void leadingListIsUnrolled() {
        Value v = new PoshScript().run("$l = @(1, 2, 3); $l | Where-Object { $_ -ne 2 }");
        assertEquals(List.of(1.0, 3.0), numbers(v));
    }

    @Test
    void stageReceivesTheWholeCollectionOnce() {
        PoshScript engine = new PoshScript();
        List<Integer> sizes = new ArrayList<>();
        engine.registerStage("Probe", ctx -> {
            sizes.add(ctx.input().size());
            return Value.list(ctx.input());
        });
        engine.run("@(1, 2, 3) | Probe");
        assertEquals(List.of(3), sizes);
    }

    @Test
    void scalarStageResultIsOneItem() {
        PoshScript engine = new PoshScript();
        engine.registerStage("Sum", ctx -> {
            double total = 0;
            for (Value v : ctx.input()) total += v.asNumber();
            return Value.number(total);
        });
        assertEquals(6.0, engine.run("@(1, 2, 3) | Sum").asNumber(), 1e-9);
        assertEquals(12.0, engine.run("@(1, 2, 3) | Sum | { $_ * 2 }").asNumber(), 1e-9);
    }

    @Test
    void emptyResultIsNull() {
        assertTrue(new PoshScript().run("@(1, 2) | Where-Object { $_ -gt 5 }").isNull());
    }

    @Test
    void failingStageStopsLaterStages() {
        PoshScript engine = new PoshScript();
        AtomicInteger calls = new AtomicInteger();
        engine.registerStage("Count-Calls", ctx -> {
            calls.incrementAndGet();
            return Value.list(ctx.input());
        });
        engine.registerStage("Boom", ctx -> {
            throw ScriptRuntimeException.invalidOperation("boom");
        });

        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> engine.run("@(1, 2) | Boom | Count-Calls"));
        assertEquals(ScriptRuntimeException.Kind.INVALID_OPERATION, e.getKind());

        ScriptRuntimeException div = assertThrows(ScriptRuntimeException.class,
                () -> engine.run("@(1, 0, 2) | { 10 / $_ } | Count-Calls"));
        assertEquals(ScriptRuntimeException.Kind.DIVISION_BY_ZERO, div.getKind());
        assertEquals(0, calls.get());
    }

    @Test
    void framesAreReleasedAfterAFailedBlock() {
        PoshSession session = new PoshScript().newSession();
        assertThrows(ScriptRuntimeException.class, () -> session.evaluate("@(1, 0) | { 1 / $_ }"));
        assertEquals(1, session.interpreter().getScope().depth());

        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> session.evaluate("$_"));
        assertEquals(ScriptRuntimeException.Kind.UNDEFINED_VARIABLE, e.getKind());
    }

    @Test
    void userFunctionAsStageSeesInput() {
        String src = "function Double-All { $input | ForEach-Object { $_ * 2 } }\n@(1, 2, 3) | Double-All";
        assertEquals(List.of(2.0, 4.0, 6.0), numbers(new PoshScript().run(src)));
    }

    @Test
    void expressionStageIsEvaluatedPerItem() {
        Value v = new PoshScript().run("@(@{A=1}, @{A=2}) | $_.A");
        assertEquals(List.of(1.0, 2.0), numbers(v));
    }

    @Test
    void blocksWriteThroughToEnclosingBindings() {
        Value v = new PoshScript().run("$total = 0\n@(1, 2, 3) | ForEach-Object { $total = $total + $_ }\n$total");
        assertEquals(6.0, v.asNumber(), 1e-9);
    }

    @Test
    void userFunctionShadowsRegisteredStage() {
        assertEquals("mine", new PoshScript().run("function Write-Output { \"mine\" }\nWrite-Output 1").asString());
    }

    @Test
    void stageLookupIsCaseInsensitive() {
        Value v = new PoshScript().run("@(2, 1) | sort-object");
        assertEquals(List.of(1.0, 2.0), numbers(v));
    }

    @Test
    void pipelineContinuesOnTheNextLine() {
        Value v = new PoshScript().run("@(1, 2, 3) |\n    Where-Object { $_ -gt 1 }");
        assertEquals(List.of(2.0, 3.0), numbers(v));
    }

    @Test
    void commandsInsideListLiteralAreSpliced() {
        PoshScript engine = new PoshScript();
        assertEquals(List.of(1.0, 2.0), numbers(engine.run("@(Write-Output 1 2)")));
        assertEquals(List.of(1.0, 2.0, 3.0), numbers(engine.run("@(@(1, 2) | Write-Output; 3)")));
    }

    @Test
    void interpreterRunsAgainstAnyRegistry() {
        StageRegistry registry = name -> name.equalsIgnoreCase("Echo")
                ? Optional.<PoshScript.Stage>of(ctx -> Value.list(ctx.input()))
                : Optional.empty();
        Interpreter interpreter = new Interpreter(new ScopeStack(), registry, 64);
        Value v = interpreter.evaluateProgram(PoshScript.parse("@(1, 2) | echo"));
        assertEquals(List.of(1.0, 2.0), numbers(v));

        ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class,
                () -> interpreter.evaluateProgram(PoshScript.parse("@(1, 2) | Where-Object { $_ }")));
        assertEquals(ScriptRuntimeException.Kind.COMMAND_NOT_FOUND, e.getKind());
    }
}
