package com.posh.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.posh.script.parser.Statement.Parameter;
import com.posh.script.parser.Statement.Stmt;

/** Function value created by a {@code function} statement. */
public class UserFunction {
    final String name;
    final List<Parameter> params;
    final List<Stmt> body;

    UserFunction(String name, List<Parameter> params, List<Stmt> body) {
        this.name = name;
        this.params = params;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<String> getParameterNames() {
        List<String> out = new ArrayList<>(params.size());
        for (Parameter p : params) out.add((String) p.name.literal);
        return out;
    }

    /**
     * Arguments are already evaluated in the caller's scope. Binds parameters in a fresh
     * function frame, runs the body and pops the frame on every exit path.
     */
    Value call(Interpreter interpreter, List<Value> positional, PropertyMap<Value> named, List<Value> input) {
        ScopeStack scope = interpreter.scope;
        scope.pushFrame(ScopeStack.FrameKind.FUNCTION);
        try {
            scope.defineLocal("input", Value.list(input));
            bindParameters(interpreter, positional, named);
            try {
                return interpreter.executeStatements(body);
            } catch (ReturnSignal rs) {
                return rs.value;
            }
        } finally {
            scope.popFrame();
        }
    }

    private void bindParameters(Interpreter interpreter, List<Value> positional, PropertyMap<Value> named) {
        PropertyMap<Parameter> byName = new PropertyMap<>();
        for (Parameter p : params) byName.put((String) p.name.literal, p);

        for (String key : named.keys()) {
            if (!byName.containsKey(key)) {
                throw ScriptRuntimeException.invalidOperation(
                        name + "(): a parameter cannot be found that matches parameter name '" + key + "'");
            }
        }

        int next = 0;
        for (Parameter p : params) {
            String pName = (String) p.name.literal;
            Value v;
            if (named.containsKey(pName)) {
                v = named.get(pName);
            } else if (next < positional.size()) {
                v = positional.get(next++);
            } else if (p.defaultValue != null) {
                v = interpreter.evaluate(p.defaultValue);
            } else {
                v = Value.nil();
            }
            interpreter.scope.defineLocal(pName, v);
        }

        List<Value> rest = next < positional.size()
                ? positional.subList(next, positional.size())
                : List.of();
        interpreter.scope.defineLocal("args", Value.list(rest));
    }
}
