package com.posh.script.plugins;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.posh.script.PoshScript;
import com.posh.script.parser.PropertyMap;
import com.posh.script.parser.StageContext;
import com.posh.script.parser.Value;

/**
 * ProcessPlugin
 *
 * Get-Process: one record per visible OS process with Name, Id and CPU (seconds).
 * -Name filters by case-insensitive process name.
 */
public final class ProcessPlugin {

    private ProcessPlugin() {}

    public static void register(PoshScript engine) {
        engine.registerStage("Get-Process", ProcessPlugin::getProcess);
    }

    static Value getProcess(StageContext ctx) {
        Value nameArg = ctx.named("Name");
        if (nameArg == null) nameArg = ctx.argument(0);
        String filter = nameArg == null ? null : nameArg.toDisplayString().toLowerCase(Locale.ROOT);

        List<ProcessHandle> handles = ProcessHandle.allProcesses()
                .sorted(Comparator.comparingLong(ProcessHandle::pid))
                .collect(Collectors.toList());

        List<Value> out = new ArrayList<>();
        for (ProcessHandle h : handles) {
            String name = processName(h);
            if (filter != null && !name.toLowerCase(Locale.ROOT).equals(filter)) continue;
            out.add(describe(h, name));
        }
        return Value.list(out);
    }

    static String processName(ProcessHandle h) {
        String cmd = h.info().command().orElse("");
        int slash = Math.max(cmd.lastIndexOf('/'), cmd.lastIndexOf('\\'));
        String base = slash >= 0 ? cmd.substring(slash + 1) : cmd;
        if (base.toLowerCase(Locale.ROOT).endsWith(".exe")) base = base.substring(0, base.length() - 4);
        return base;
    }

    private static Value describe(ProcessHandle h, String name) {
        double cpu = h.info().totalCpuDuration().map(Duration::toMillis).orElse(0L) / 1000.0;
        PropertyMap<Value> rec = new PropertyMap<>();
        rec.put("Name", Value.string(name));
        rec.put("Id", Value.number(h.pid()));
        rec.put("CPU", Value.number(cpu));
        return Value.record(rec);
    }
}
