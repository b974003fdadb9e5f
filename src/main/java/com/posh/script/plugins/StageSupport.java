package com.posh.script.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import com.posh.script.parser.ScriptRuntimeException;
import com.posh.script.parser.StageContext;
import com.posh.script.parser.Value;

/** Argument helpers shared by the stage plugins. */
final class StageSupport {

    private StageSupport() {}

    /** Items of a collection with List items expanded one level. */
    static List<Value> unroll(List<Value> values) {
        List<Value> out = new ArrayList<>(values.size());
        for (Value v : values) {
            if (v.type == Value.Type.LIST) out.addAll(v.asList());
            else out.add(v);
        }
        return out;
    }

    /** Property names from -Property, or else from the positional arguments. */
    static List<String> propertyNames(StageContext ctx) {
        List<Value> raw = new ArrayList<>();
        Value named = ctx.named("Property");
        if (named != null) {
            raw.add(named);
        } else {
            for (Value a : ctx.arguments()) {
                if (a.type == Value.Type.STRING || a.type == Value.Type.LIST) raw.add(a);
            }
        }
        List<String> names = new ArrayList<>();
        for (Value v : unroll(raw)) {
            if (!v.isNull()) names.add(v.toDisplayString());
        }
        return names;
    }

    /** Named numeric argument truncated to int, or null when absent. */
    static Integer intParameter(StageContext ctx, String name) {
        Value v = ctx.named(name);
        if (v == null) return null;
        OptionalDouble d = v.toNumber();
        if (d.isEmpty()) {
            throw ScriptRuntimeException.invalidOperation(
                    ctx.stageName() + ": -" + name + " expects a number, got " + v.type);
        }
        return (int) d.getAsDouble();
    }

    /** -Path, or the first positional argument. */
    static String requirePath(StageContext ctx) {
        String path = optionalPath(ctx);
        if (path == null) {
            throw ScriptRuntimeException.invalidOperation(ctx.stageName() + ": -Path is required");
        }
        return path;
    }

    static String optionalPath(StageContext ctx) {
        Value v = ctx.named("Path");
        if (v == null) v = ctx.named("LiteralPath");
        if (v == null) v = ctx.argument(0);
        if (v == null || v.isNull()) return null;
        String s = v.toDisplayString().trim();
        return s.isEmpty() ? null : s;
    }

    static boolean isCallable(Value v) {
        return v != null && (v.type == Value.Type.BLOCK || v.type == Value.Type.FUNCTION);
    }
}
