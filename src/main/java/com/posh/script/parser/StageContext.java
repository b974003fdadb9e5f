package com.posh.script.parser;

import java.util.List;
import java.util.Map;

/**
 * Everything a stage receives for one invocation: the input collection, evaluated
 * arguments and a way to run blocks handed to it.
 */
public final class StageContext {
    private final Interpreter interpreter;
    private final String stageName;
    private final List<Value> input;
    private final List<Value> arguments;
    private final PropertyMap<Value> named;

    StageContext(Interpreter interpreter, String stageName, List<Value> input,
                 List<Value> arguments, PropertyMap<Value> named) {
        this.interpreter = interpreter;
        this.stageName = stageName;
        this.input = List.copyOf(input);
        this.arguments = List.copyOf(arguments);
        this.named = new PropertyMap<>(named);
    }

    public String stageName() { return stageName; }

    /** Pipeline input; empty when the stage is called outside a pipeline or first in one. */
    public List<Value> input() { return input; }

    public boolean hasInput() { return !input.isEmpty(); }

    public List<Value> arguments() { return arguments; }

    /** Positional argument at index, or null. */
    public Value argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    /** Named argument (case-insensitive), or null. */
    public Value named(String name) {
        return named.get(name);
    }

    public boolean hasNamed(String name) {
        return named.containsKey(name);
    }

    /** True when a switch parameter is present and not explicitly false. */
    public boolean isSwitch(String name) {
        Value v = named.get(name);
        return v != null && v.toBoolean();
    }

    public Map<String, Value> namedArguments() {
        return named.toMap();
    }

    /** Runs a block with {@code $_} bound to item; functions are called with item as argument. */
    public Value invokeBlock(Value block, Value item) {
        return interpreter.invokeWithItem(block, item);
    }
}
