package com.posh.script.plugins;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.posh.script.PoshScript;
import com.posh.script.json.ValueJson;
import com.posh.script.parser.ScriptRuntimeException;
import com.posh.script.parser.StageContext;
import com.posh.script.parser.Value;

/**
 * JsonPlugin
 *
 * ConvertTo-Json [-Compress] [-Depth n]: one input renders as that value, several as an array.
 * ConvertFrom-Json: parses the piped text (lines joined) or the first argument; arrays are
 * unrolled into the pipeline.
 */
public final class JsonPlugin {

    /** Nesting kept before values are flattened to their display text. */
    public static final int DEFAULT_DEPTH = 2;

    private JsonPlugin() {}

    public static void register(PoshScript engine) {
        engine.registerStage("ConvertTo-Json", JsonPlugin::convertTo);
        engine.registerStage("ConvertFrom-Json", JsonPlugin::convertFrom);
    }

    static Value convertTo(StageContext ctx) {
        List<Value> items = ctx.hasInput() ? ctx.input() : ctx.arguments();
        Integer depth = StageSupport.intParameter(ctx, "Depth");
        int limit = depth == null ? DEFAULT_DEPTH : depth;
        if (limit < 0) throw ScriptRuntimeException.invalidOperation("ConvertTo-Json: -Depth must be non-negative");

        Value subject = items.size() == 1 ? items.get(0) : Value.list(items);
        JsonNode node = ValueJson.toJson(subject, limit + 1);
        try {
            return Value.string(ValueJson.write(node, ctx.isSwitch("Compress")));
        } catch (JsonProcessingException e) {
            throw ScriptRuntimeException.invalidOperation("ConvertTo-Json: " + e.getOriginalMessage(), e);
        }
    }

    static Value convertFrom(StageContext ctx) {
        String text;
        if (ctx.hasInput()) {
            List<String> parts = new ArrayList<>();
            for (Value v : ctx.input()) parts.add(v.toDisplayString());
            text = String.join("\n", parts);
        } else if (ctx.argument(0) != null) {
            text = ctx.argument(0).toDisplayString();
        } else {
            throw ScriptRuntimeException.invalidOperation("ConvertFrom-Json: no input");
        }
        try {
            return ValueJson.fromJson(ValueJson.read(text));
        } catch (JsonProcessingException e) {
            throw ScriptRuntimeException.invalidOperation("ConvertFrom-Json: " + e.getOriginalMessage(), e);
        }
    }
}
