package com.posh.script.parser;

import com.posh.script.PoshScript.Stage;

/** Outcome of resolving a command name: a user function, a registered stage, or nothing. */
public final class CallTarget {
    public enum Kind { USER_FUNCTION, BUILTIN_STAGE, NOT_FOUND }

    public final Kind kind;
    public final String name;
    public final UserFunction function;
    public final Stage stage;

    private CallTarget(Kind kind, String name, UserFunction function, Stage stage) {
        this.kind = kind;
        this.name = name;
        this.function = function;
        this.stage = stage;
    }

    static CallTarget userFunction(String name, UserFunction fn) {
        return new CallTarget(Kind.USER_FUNCTION, name, fn, null);
    }

    static CallTarget builtinStage(String name, Stage stage) {
        return new CallTarget(Kind.BUILTIN_STAGE, name, null, stage);
    }

    static CallTarget notFound(String name) {
        return new CallTarget(Kind.NOT_FOUND, name, null, null);
    }
}
