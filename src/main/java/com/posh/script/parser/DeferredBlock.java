package com.posh.script.parser;

import java.util.List;

import com.posh.script.parser.Statement.Stmt;

/**
 * Unexecuted block body. Holds no environment: it runs against whatever scope stack is
 * live when it is executed.
 */
public final class DeferredBlock {
    final List<Stmt> body;
    final String source;

    DeferredBlock(List<Stmt> body, String source) {
        this.body = body;
        this.source = source;
    }

    /** Source text including the braces. */
    public String getSource() {
        return source;
    }
}
