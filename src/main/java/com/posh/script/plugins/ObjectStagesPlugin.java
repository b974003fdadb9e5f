package com.posh.script.plugins;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

import com.posh.script.PoshScript;
import com.posh.script.parser.PropertyMap;
import com.posh.script.parser.StageContext;
import com.posh.script.parser.Value;

/**
 * ObjectStagesPlugin
 *
 * The object pipeline stages every engine starts with: Write-Output, Where-Object,
 * ForEach-Object, Select-Object, Sort-Object and Group-Object.
 *
 * Each stage receives the whole input collection and returns a List.
 *
 * Usage:
 *   @(3,1,2) | Sort-Object -Descending
 *   $procs | Where-Object { $_.CPU -gt 10 } | Select-Object Name, CPU -First 5
 */
public final class ObjectStagesPlugin {

    private ObjectStagesPlugin() {}

    public static void register(PoshScript engine) {
        engine.registerStage("Write-Output", ObjectStagesPlugin::writeOutput);
        engine.registerStage("Where-Object", ObjectStagesPlugin::whereObject);
        engine.registerStage("ForEach-Object", ObjectStagesPlugin::forEachObject);
        engine.registerStage("Select-Object", ObjectStagesPlugin::selectObject);
        engine.registerStage("Sort-Object", ObjectStagesPlugin::sortObject);
        engine.registerStage("Group-Object", ObjectStagesPlugin::groupObject);
    }

    static Value writeOutput(StageContext ctx) {
        if (ctx.hasInput()) return Value.list(StageSupport.unroll(ctx.input()));
        return Value.list(StageSupport.unroll(ctx.arguments()));
    }

    static Value whereObject(StageContext ctx) {
        Value filter = ctx.named("FilterScript");
        if (filter == null && StageSupport.isCallable(ctx.argument(0))) filter = ctx.argument(0);

        List<Value> out = new ArrayList<>();
        if (filter != null) {
            for (Value item : ctx.input()) {
                if (ctx.invokeBlock(filter, item).toBoolean()) out.add(item);
            }
            return Value.list(out);
        }

        Value property = ctx.named("Property");
        if (property != null) {
            String name = property.toDisplayString();
            for (Value item : ctx.input()) {
                if (item.getProperty(name).map(Value::toBoolean).orElse(false)) out.add(item);
            }
            return Value.list(out);
        }

        return Value.list(ctx.input());
    }

    static Value forEachObject(StageContext ctx) {
        Value process = ctx.named("Process");
        if (process == null && StageSupport.isCallable(ctx.argument(0))) process = ctx.argument(0);

        List<Value> out = new ArrayList<>(ctx.input().size());
        if (process != null) {
            for (Value item : ctx.input()) out.add(ctx.invokeBlock(process, item));
            return Value.list(out);
        }

        Value member = ctx.named("MemberName");
        if (member == null && ctx.argument(0) != null && ctx.argument(0).type == Value.Type.STRING) {
            member = ctx.argument(0);
        }
        if (member != null) {
            String name = member.toDisplayString();
            for (Value item : ctx.input()) out.add(item.getProperty(name).orElse(Value.nil()));
            return Value.list(out);
        }

        return Value.list(ctx.input());
    }

    static Value selectObject(StageContext ctx) {
        List<String> props = StageSupport.propertyNames(ctx);
        Integer first = StageSupport.intParameter(ctx, "First");
        Integer last = StageSupport.intParameter(ctx, "Last");

        List<Value> items = new ArrayList<>();
        for (Value item : ctx.input()) {
            items.add(props.isEmpty() ? item : project(item, props));
        }

        if (first != null) {
            items = new ArrayList<>(items.subList(0, clamp(first, items.size())));
        }
        if (last != null) {
            int n = clamp(last, items.size());
            items = new ArrayList<>(items.subList(items.size() - n, items.size()));
        }
        return Value.list(items);
    }

    private static Value project(Value item, List<String> props) {
        if (item.type != Value.Type.RECORD) return item;
        PropertyMap<Value> out = new PropertyMap<>();
        for (String p : props) out.put(p, item.getProperty(p).orElse(Value.nil()));
        return Value.record(out);
    }

    private static int clamp(int n, int size) {
        return Math.max(0, Math.min(n, size));
    }

    static Value sortObject(StageContext ctx) {
        List<String> props = StageSupport.propertyNames(ctx);
        boolean descending = ctx.isSwitch("Descending");

        List<Value> items;
        if (ctx.hasInput()) {
            items = new ArrayList<>(ctx.input());
        } else {
            // Nothing piped in: sort the arguments themselves.
            items = StageSupport.unroll(ctx.arguments());
            props = new ArrayList<>();
        }

        Comparator<Value> cmp = sortKeyComparator(props);
        if (descending) cmp = cmp.reversed();
        items.sort(cmp);
        return Value.list(items);
    }

    private static Comparator<Value> sortKeyComparator(List<String> props) {
        if (props.isEmpty()) return ObjectStagesPlugin::compareValues;
        return (a, b) -> {
            for (String p : props) {
                int c = compareValues(a.getProperty(p).orElse(Value.nil()), b.getProperty(p).orElse(Value.nil()));
                if (c != 0) return c;
            }
            return 0;
        };
    }

    /**
     * Total order for sorting: nulls, then numeric values by magnitude, then everything else
     * as case-insensitive text.
     */
    static int compareValues(Value a, Value b) {
        int rank = Integer.compare(sortRank(a), sortRank(b));
        if (rank != 0) return rank;
        if (a.isNull()) return 0;
        OptionalDouble x = a.toNumber();
        if (x.isPresent()) return Double.compare(x.getAsDouble(), b.toNumber().getAsDouble());
        return String.CASE_INSENSITIVE_ORDER.compare(a.toDisplayString(), b.toDisplayString());
    }

    private static int sortRank(Value v) {
        if (v.isNull()) return 0;
        return v.toNumber().isPresent() ? 1 : 2;
    }

    static Value groupObject(StageContext ctx) {
        List<String> props = StageSupport.propertyNames(ctx);
        boolean noElement = ctx.isSwitch("NoElement");
        boolean asHashTable = ctx.isSwitch("AsHashTable");

        // keys compare case-insensitively; a group keeps the spelling it was first seen with
        TreeMap<String, List<Value>> groups = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Value item : ctx.input()) {
            groups.computeIfAbsent(groupKey(item, props), k -> new ArrayList<>()).add(item);
        }

        if (asHashTable) {
            PropertyMap<Value> table = new PropertyMap<>();
            for (Map.Entry<String, List<Value>> g : groups.entrySet()) {
                table.put(g.getKey(), Value.list(g.getValue()));
            }
            return Value.record(table);
        }

        List<Value> out = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Value>> g : groups.entrySet()) {
            PropertyMap<Value> rec = new PropertyMap<>();
            rec.put("Count", Value.number(g.getValue().size()));
            rec.put("Name", Value.string(g.getKey()));
            if (!noElement) rec.put("Group", Value.list(g.getValue()));
            out.add(Value.record(rec));
        }
        return Value.list(out);
    }

    private static String groupKey(Value item, List<String> props) {
        if (props.isEmpty()) return item.toDisplayString();
        List<String> parts = new ArrayList<>(props.size());
        for (String p : props) {
            Optional<Value> v = item.getProperty(p);
            parts.add(v.map(Value::toDisplayString).orElse(""));
        }
        return String.join(",", parts);
    }
}
