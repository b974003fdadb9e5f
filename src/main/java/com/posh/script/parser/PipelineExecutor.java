package com.posh.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.posh.debug.Debug;
import com.posh.script.parser.Expr.BlockLiteral;
import com.posh.script.parser.Expr.Call;
import com.posh.script.parser.Expr.ExprInterface;
import com.posh.script.parser.Expr.Invoke;

/**
 * Threads a collection of values through pipeline stages, left to right.
 *
 * Command stages get the whole collection once. Block stages run once per item.
 * The leading stage seeds the collection; a List it produces is unrolled.
 * Any error aborts the pipeline with no partial output.
 */
final class PipelineExecutor {
    private static final String TAG = "Pipeline";

    private final Interpreter interpreter;

    PipelineExecutor(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    List<Value> execute(List<ExprInterface> stages) {
        Debug.get().d(TAG, "start stages=" + stages.size());
        List<Value> current = new ArrayList<>();

        for (int i = 0; i < stages.size(); i++) {
            ExprInterface stage = stages.get(i);
            boolean first = i == 0;

            if (stage instanceof Call) {
                current = runCommand((Call) stage, current);
            } else if (stage instanceof Invoke) {
                current = runInvoke((Invoke) stage, current, first);
            } else if (stage instanceof BlockLiteral) {
                if (first) {
                    // Nothing to feed it yet: the block is just a value.
                    current = new ArrayList<>();
                    current.add(interpreter.evaluate(stage));
                } else {
                    DeferredBlock block = interpreter.evaluate(stage).asBlock();
                    List<Value> out = new ArrayList<>(current.size());
                    for (Value item : current) out.add(interpreter.executeBlock(block, item));
                    current = out;
                }
            } else if (first) {
                current = flatten(interpreter.evaluate(stage));
            } else {
                List<Value> out = new ArrayList<>(current.size());
                for (Value item : current) out.add(interpreter.evaluateWithItem(stage, item));
                current = out;
            }
        }

        Debug.get().d(TAG, "done items=" + current.size());
        return current;
    }

    private List<Value> runCommand(Call call, List<Value> input) {
        CallTarget target = interpreter.resolveCommand(call.name.lexeme);
        if (target.kind == CallTarget.Kind.NOT_FOUND) {
            throw ScriptRuntimeException.commandNotFound(call.name.lexeme);
        }
        List<Value> args = interpreter.evaluateArguments(call.arguments);
        PropertyMap<Value> named = interpreter.evaluateNamed(call.namedArguments);
        return flatten(interpreter.invokeTarget(target, args, named, input));
    }

    private List<Value> runInvoke(Invoke invoke, List<Value> input, boolean first) {
        if (first) return flatten(interpreter.evaluate(invoke));
        Value target = interpreter.evaluate(invoke.target);
        List<Value> args = interpreter.evaluateArguments(invoke.arguments);
        PropertyMap<Value> named = interpreter.evaluateNamed(invoke.namedArguments);
        if (target.type == Value.Type.BLOCK) {
            List<Value> out = new ArrayList<>(input.size());
            for (Value item : input) out.add(interpreter.executeBlock(target.asBlock(), item, args));
            return out;
        }
        return flatten(interpreter.invokeValue(target, args, named, input));
    }

    /** A List result contributes its elements; anything else is one item. */
    static List<Value> flatten(Value result) {
        if (result.type == Value.Type.LIST) return new ArrayList<>(result.asList());
        List<Value> one = new ArrayList<>(1);
        one.add(result);
        return one;
    }
}
