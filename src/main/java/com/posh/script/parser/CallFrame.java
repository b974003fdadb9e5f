package com.posh.script.parser;

import java.util.List;

/** One active user-function or script-block invocation, kept for depth limiting and diagnostics. */
public class CallFrame {
    static final String SCRIPT_BLOCK = "<scriptblock>";

    final String functionName;
    final List<Value> arguments;

    CallFrame(String functionName, List<Value> arguments) {
        this.functionName = functionName;
        this.arguments = arguments;
    }

    public String getFunctionName() {
        return functionName;
    }

    boolean isScriptBlock() {
        return SCRIPT_BLOCK.equals(functionName);
    }
}
