package com.posh.script;

import java.util.List;
import java.util.Map;

import com.posh.script.parser.Interpreter;
import com.posh.script.parser.ScopeStack;
import com.posh.script.parser.Statement.Stmt;
import com.posh.script.parser.Value;

/** One interpreter plus its scope stack; globals persist between calls. Not thread-safe. */
public class PoshSession {
    private final PoshScript engine;
    private final ScopeStack scope = new ScopeStack();
    private final Interpreter interpreter;

    PoshSession(PoshScript engine, StageRegistry stages, int maxCallDepth) {
        this.engine = engine;
        this.interpreter = new Interpreter(scope, stages, maxCallDepth);
    }

    /** Parses and runs source; returns the value of the final statement. */
    public Value evaluate(String source) {
        try {
            List<Stmt> program = PoshScript.parse(source);
            return interpreter.evaluateProgram(program);
        } catch (RuntimeException e) {
            engine.onError(e, source);
            throw e;
        }
    }

    /** Parses and runs one REPL entry; returns every value it outputs, in order. */
    public List<Value> evaluateLine(String source) {
        try {
            List<Stmt> program = PoshScript.parse(source);
            return interpreter.evaluateLine(program);
        } catch (RuntimeException e) {
            engine.onError(e, source);
            throw e;
        }
    }

    public Value getVariable(String name) {
        return scope.read(name).orElse(null);
    }

    public void setVariable(String name, Value value) {
        scope.write(name, value);
    }

    public Map<String, Value> globals() {
        return scope.globals();
    }

    public Interpreter interpreter() {
        return interpreter;
    }
}
