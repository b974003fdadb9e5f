package com.posh.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stack of variable frames. Frame 0 is the global frame and lives as long as the stack.
 *
 * Names are case-insensitive. A name may carry a {@code global:}, {@code local:} or
 * {@code script:} qualifier; any other prefix before ':' is part of the name.
 *
 * A function-call frame is a visibility boundary: code running in it (or in blocks
 * pushed above it) sees the frames up to that boundary plus the global frame, and an
 * unqualified write never reaches past the boundary.
 */
public class ScopeStack {

    public enum FrameKind { GLOBAL, FUNCTION, BLOCK }

    public enum Qualifier { NONE, GLOBAL, LOCAL, SCRIPT }

    /** Scripts share the global frame; there is no separate script frame. */
    public static final int GLOBAL_FRAME = 0;
    public static final int SCRIPT_FRAME = GLOBAL_FRAME;

    /** Parsed variable reference: qualifier plus bare name. */
    public static final class QualifiedName {
        public final Qualifier qualifier;
        public final String name;

        QualifiedName(Qualifier qualifier, String name) {
            this.qualifier = qualifier;
            this.name = name;
        }

        public static QualifiedName parse(String raw) {
            int colon = raw.indexOf(':');
            if (colon > 0) {
                String prefix = raw.substring(0, colon).toLowerCase(Locale.ROOT);
                String rest = raw.substring(colon + 1);
                switch (prefix) {
                    case "global": return new QualifiedName(Qualifier.GLOBAL, rest);
                    case "local": return new QualifiedName(Qualifier.LOCAL, rest);
                    case "script": return new QualifiedName(Qualifier.SCRIPT, rest);
                    default: break;
                }
            }
            return new QualifiedName(Qualifier.NONE, raw);
        }
    }

    private static final class Frame {
        final FrameKind kind;
        final PropertyMap<Value> vars = new PropertyMap<>();

        Frame(FrameKind kind) {
            this.kind = kind;
        }
    }

    private final List<Frame> frames = new ArrayList<>();

    public ScopeStack() {
        frames.add(new Frame(FrameKind.GLOBAL));
    }

    public void pushFrame(FrameKind kind) {
        if (kind == FrameKind.GLOBAL) {
            throw new IllegalArgumentException("Only the root frame may be GLOBAL");
        }
        frames.add(new Frame(kind));
    }

    public void popFrame() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop the global frame");
        }
        frames.remove(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    public Optional<Value> read(String rawName) {
        QualifiedName q = QualifiedName.parse(rawName);
        switch (q.qualifier) {
            case GLOBAL:
                return Optional.ofNullable(frames.get(GLOBAL_FRAME).vars.get(q.name));
            case SCRIPT:
                return Optional.ofNullable(frames.get(SCRIPT_FRAME).vars.get(q.name));
            case LOCAL:
                return Optional.ofNullable(innermost().vars.get(q.name));
            default:
                break;
        }
        int boundary = boundaryIndex();
        for (int i = frames.size() - 1; i >= boundary; i--) {
            Value v = frames.get(i).vars.get(q.name);
            if (v != null) return Optional.of(v);
        }
        if (boundary > GLOBAL_FRAME) {
            return Optional.ofNullable(frames.get(GLOBAL_FRAME).vars.get(q.name));
        }
        return Optional.empty();
    }

    public void write(String rawName, Value value) {
        QualifiedName q = QualifiedName.parse(rawName);
        switch (q.qualifier) {
            case GLOBAL:
                frames.get(GLOBAL_FRAME).vars.put(q.name, value);
                return;
            case SCRIPT:
                frames.get(SCRIPT_FRAME).vars.put(q.name, value);
                return;
            case LOCAL:
                innermost().vars.put(q.name, value);
                return;
            default:
                break;
        }
        int boundary = boundaryIndex();
        for (int i = frames.size() - 1; i >= boundary; i--) {
            PropertyMap<Value> vars = frames.get(i).vars;
            if (vars.containsKey(q.name)) {
                vars.put(q.name, value);
                return;
            }
        }
        innermost().vars.put(q.name, value);
    }

    /** Binds in the innermost frame regardless of outer bindings (parameters, $_). */
    public void defineLocal(String name, Value value) {
        innermost().vars.put(name, value);
    }

    public boolean isInFunction() {
        return boundaryIndex() > GLOBAL_FRAME;
    }

    /** Snapshot of the global frame, for hosts and front-ends. */
    public Map<String, Value> globals() {
        return frames.get(GLOBAL_FRAME).vars.toMap();
    }

    private Frame innermost() {
        return frames.get(frames.size() - 1);
    }

    // Index of the nearest FUNCTION frame, or the global frame when none.
    private int boundaryIndex() {
        for (int i = frames.size() - 1; i > GLOBAL_FRAME; i--) {
            if (frames.get(i).kind == FrameKind.FUNCTION) return i;
        }
        return GLOBAL_FRAME;
    }
}
