package com.posh.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.posh.debug.Debug;
import com.posh.script.parser.Lexer;
import com.posh.script.parser.Parser;
import com.posh.script.parser.StageContext;
import com.posh.script.parser.Statement.Stmt;
import com.posh.script.parser.Value;
import com.posh.script.plugins.ObjectStagesPlugin;

/**
 * PoshScript engine.
 *
 * - PowerShell-flavoured syntax ($vars, -eq / -gt, @{ } records, @( ) lists, { } blocks)
 * - Values: null, bool, number (double), string, record, list, function, block
 * - Object pipeline: stages exchange values, not text
 * - Commands:
 *     - user functions (function Name($a, $b = 1) { ... })
 *     - stages registered via registerStage; the object stages are registered by default
 */
public class PoshScript {

    /** A built-in pipeline stage: whole input collection in, a value or List out. */
    @FunctionalInterface
    public interface Stage {
        Value invoke(StageContext context);
    }

    /** Host hook that sees every error escaping a run, before it is rethrown. */
    @FunctionalInterface
    public interface ErrorReporter {
        void report(RuntimeException error, String source);
    }

    private static final String TAG = "PoshScript";

    private final Map<String, Stage> stages = new LinkedHashMap<>();
    private final Map<String, String> stageNames = new LinkedHashMap<>();
    private int maxCallDepth = 64;
    private ErrorReporter errorReporter;

    public PoshScript() {
        ObjectStagesPlugin.register(this);
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be >= 1, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    public void registerStage(String name, Stage stage) {
        String key = name.toLowerCase(Locale.ROOT);
        stages.put(key, stage);
        stageNames.put(key, name);
    }

    /** Registered stage names in registration order, with their registered spelling. */
    public List<String> stageNames() {
        return Collections.unmodifiableList(new ArrayList<>(stageNames.values()));
    }

    public StageRegistry stages() {
        return name -> Optional.ofNullable(stages.get(name.toLowerCase(Locale.ROOT)));
    }

    public static List<Stmt> parse(String source) {
        return new Parser(new Lexer(source).tokenize(), source).parse();
    }

    /** Runs source in a fresh session and returns the value of its last statement. */
    public Value run(String source) {
        return run(source, Collections.emptyMap());
    }

    /** Same as {@link #run(String)}, with globals defined before the script starts. */
    public Value run(String source, Map<String, Value> initialGlobals) {
        PoshSession session = newSession();
        for (Map.Entry<String, Value> e : initialGlobals.entrySet()) {
            session.setVariable(e.getKey(), e.getValue());
        }
        return session.evaluate(source);
    }

    /** Session whose global frame survives across evaluations (REPL use). */
    public PoshSession newSession() {
        return new PoshSession(this, stages(), maxCallDepth);
    }

    void onError(RuntimeException e, String source) {
        Debug.get().w(TAG, e.getMessage(), e);
        if (errorReporter != null) errorReporter.report(e, source);
    }
}
