package com.posh.script.plugins;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import com.posh.debug.Debug;
import com.posh.script.PoshScript;
import com.posh.script.parser.PropertyMap;
import com.posh.script.parser.ScriptRuntimeException;
import com.posh.script.parser.StageContext;
import com.posh.script.parser.Value;

/**
 * FileSystemPlugin
 *
 * File stages: Get-Content, Set-Content, Test-Path, New-Item, Remove-Item, Get-ChildItem.
 * Relative paths resolve against the base directory given at registration.
 *
 * Usage:
 *   FileSystemPlugin.register(engine);                 // relative to the working directory
 *   FileSystemPlugin.register(engine, Path.of("/srv")); // relative to /srv
 */
public final class FileSystemPlugin {
    private static final String TAG = "FileSystemPlugin";

    private final Path baseDir;

    private FileSystemPlugin(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public static void register(PoshScript engine) {
        register(engine, Paths.get(""));
    }

    public static void register(PoshScript engine, Path baseDir) {
        FileSystemPlugin fs = new FileSystemPlugin(baseDir);
        engine.registerStage("Get-Content", fs::getContent);
        engine.registerStage("Set-Content", fs::setContent);
        engine.registerStage("Test-Path", fs::testPath);
        engine.registerStage("New-Item", fs::newItem);
        engine.registerStage("Remove-Item", fs::removeItem);
        engine.registerStage("Get-ChildItem", fs::getChildItem);
    }

    private Path resolve(String path) {
        return baseDir.resolve(path).normalize();
    }

    Value getContent(StageContext ctx) {
        Path path = resolve(StageSupport.requirePath(ctx));
        Integer totalCount = StageSupport.intParameter(ctx, "TotalCount");
        Integer tail = StageSupport.intParameter(ctx, "Tail");
        if (totalCount != null && tail != null) {
            throw ScriptRuntimeException.invalidOperation("Get-Content: -TotalCount and -Tail cannot be used together");
        }
        if ((totalCount != null && totalCount < 0) || (tail != null && tail < 0)) {
            throw ScriptRuntimeException.invalidOperation("Get-Content: line counts must be non-negative");
        }
        Charset charset = charset(ctx.named("Encoding"));

        List<String> lines;
        try {
            lines = Files.readAllLines(path, charset);
        } catch (IOException e) {
            throw ScriptRuntimeException.invalidOperation("Get-Content: cannot read " + path + ": " + e.getMessage(), e);
        }
        if (totalCount != null) {
            lines = lines.subList(0, Math.min(totalCount, lines.size()));
        } else if (tail != null) {
            lines = lines.subList(Math.max(0, lines.size() - tail), lines.size());
        }

        List<Value> out = new ArrayList<>(lines.size());
        for (String line : lines) out.add(Value.string(line));
        return Value.list(out);
    }

    static Charset charset(Value encoding) {
        if (encoding == null) return StandardCharsets.UTF_8;
        switch (encoding.toDisplayString().trim().toLowerCase(Locale.ROOT)) {
            case "":
            case "utf8":
            case "utf-8":
            case "utf8bom":
                return StandardCharsets.UTF_8;
            case "ascii":
            case "us-ascii":
                return StandardCharsets.US_ASCII;
            case "unicode":
            case "utf16":
            case "utf-16":
            case "utf-16le":
                return StandardCharsets.UTF_16LE;
            case "bigendianunicode":
            case "utf-16be":
                return StandardCharsets.UTF_16BE;
            default:
                throw ScriptRuntimeException.invalidOperation("Unsupported encoding: " + encoding.toDisplayString());
        }
    }

    Value setContent(StageContext ctx) {
        Path path = resolve(StageSupport.requirePath(ctx));
        List<Value> values = new ArrayList<>();
        Value value = ctx.named("Value");
        if (value == null && !ctx.hasNamed("Path")) value = ctx.argument(1);
        if (value == null && ctx.hasNamed("Path")) value = ctx.argument(0);
        if (value != null) values.add(value);
        else values.addAll(ctx.input());

        StringBuilder sb = new StringBuilder();
        for (Value v : StageSupport.unroll(values)) sb.append(v.toDisplayString()).append('\n');
        try {
            Files.writeString(path, sb.toString(), charset(ctx.named("Encoding")));
        } catch (IOException e) {
            throw ScriptRuntimeException.invalidOperation("Set-Content: cannot write " + path + ": " + e.getMessage(), e);
        }
        Debug.get().d(TAG, "wrote " + path);
        return Value.list(List.of());
    }

    Value testPath(StageContext ctx) {
        String p = StageSupport.optionalPath(ctx);
        return Value.bool(p != null && Files.exists(resolve(p)));
    }

    Value newItem(StageContext ctx) {
        Path path = resolve(StageSupport.requirePath(ctx));
        Value typeArg = ctx.named("ItemType");
        if (typeArg == null) typeArg = ctx.named("Type");
        String type = typeArg == null ? "file" : typeArg.toDisplayString().trim().toLowerCase(Locale.ROOT);
        boolean force = ctx.isSwitch("Force");
        boolean directory;
        switch (type) {
            case "file": directory = false; break;
            case "directory":
            case "dir":
                directory = true;
                break;
            default:
                throw ScriptRuntimeException.invalidOperation("New-Item: unsupported item type '" + typeArg.toDisplayString() + "'");
        }

        try {
            if (directory) {
                if (Files.exists(path) && !force) {
                    throw ScriptRuntimeException.invalidOperation("New-Item: an item already exists at " + path);
                }
                Files.createDirectories(path);
            } else {
                if (Files.exists(path) && !force) {
                    throw ScriptRuntimeException.invalidOperation("New-Item: an item already exists at " + path);
                }
                if (path.getParent() != null) {
                    if (force) Files.createDirectories(path.getParent());
                    else if (!Files.isDirectory(path.getParent())) {
                        throw ScriptRuntimeException.invalidOperation("New-Item: parent directory does not exist: " + path.getParent());
                    }
                }
                Value value = ctx.named("Value");
                Files.writeString(path, value == null ? "" : value.toDisplayString());
            }
        } catch (IOException e) {
            throw ScriptRuntimeException.invalidOperation("New-Item: " + e.getMessage(), e);
        }

        PropertyMap<Value> rec = new PropertyMap<>();
        rec.put("Name", Value.string(path.getFileName() == null ? path.toString() : path.getFileName().toString()));
        rec.put("FullName", Value.string(path.toString()));
        rec.put("ItemType", Value.string(directory ? "Directory" : "File"));
        rec.put("Directory", Value.bool(directory));
        return Value.record(rec);
    }

    Value removeItem(StageContext ctx) {
        Path path = resolve(StageSupport.requirePath(ctx));
        boolean recurse = ctx.isSwitch("Recurse");
        if (!Files.exists(path)) {
            throw ScriptRuntimeException.invalidOperation("Remove-Item: cannot find path " + path);
        }
        try {
            if (Files.isDirectory(path) && recurse) {
                deleteTree(path);
            } else {
                Files.delete(path);
            }
        } catch (DirectoryNotEmptyException e) {
            throw ScriptRuntimeException.invalidOperation(
                    "Remove-Item: directory " + path + " is not empty; use -Recurse", e);
        } catch (IOException e) {
            throw ScriptRuntimeException.invalidOperation("Remove-Item: " + e.getMessage(), e);
        }
        return Value.list(List.of());
    }

    private static void deleteTree(Path root) throws IOException {
        Deque<Path> ordered = new ArrayDeque<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.forEach(ordered::push);
        }
        // deepest first
        while (!ordered.isEmpty()) Files.delete(ordered.pop());
    }

    Value getChildItem(StageContext ctx) {
        String p = StageSupport.optionalPath(ctx);
        Path dir = p == null ? baseDir : resolve(p);
        if (!Files.exists(dir)) {
            throw ScriptRuntimeException.invalidOperation("Get-ChildItem: cannot find path " + dir);
        }
        if (!Files.isDirectory(dir)) return Value.list(describe(dir));

        List<Path> children;
        try (Stream<Path> list = Files.list(dir)) {
            children = new ArrayList<>();
            list.forEach(children::add);
        } catch (IOException e) {
            throw ScriptRuntimeException.invalidOperation("Get-ChildItem: " + e.getMessage(), e);
        }
        children.sort(Comparator.comparing(c -> c.getFileName().toString().toLowerCase(Locale.ROOT)));

        List<Value> out = new ArrayList<>(children.size());
        for (Path c : children) out.add(describe(c));
        return Value.list(out);
    }

    private static Value describe(Path p) {
        boolean dir = Files.isDirectory(p);
        long length = 0;
        if (!dir) {
            try {
                length = Files.size(p);
            } catch (IOException e) {
                Debug.get().w(TAG, "cannot stat " + p, e);
            }
        }
        PropertyMap<Value> rec = new PropertyMap<>();
        rec.put("Name", Value.string(p.getFileName().toString()));
        rec.put("FullName", Value.string(p.toString()));
        rec.put("Length", Value.number(length));
        rec.put("IsDirectory", Value.bool(dir));
        return Value.record(rec);
    }
}
