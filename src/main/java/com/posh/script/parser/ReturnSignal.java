package com.posh.script.parser;

/** Unwinds a function body on {@code return}; caught at the function-call boundary. */
final class ReturnSignal extends RuntimeException {
    final Value value;

    ReturnSignal(Value value) {
        super(null, null, false, false);
        this.value = value;
    }
}
