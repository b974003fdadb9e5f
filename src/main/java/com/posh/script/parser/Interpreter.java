package com.posh.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import com.posh.debug.Debug;
import com.posh.debug.DebugLevel;
import com.posh.script.PoshScript.Stage;
import com.posh.script.StageRegistry;
import com.posh.script.parser.Expr.Binary;
import com.posh.script.parser.Expr.BlockLiteral;
import com.posh.script.parser.Expr.Call;
import com.posh.script.parser.Expr.ExprInterface;
import com.posh.script.parser.Expr.ExprVisitor;
import com.posh.script.parser.Expr.GetExpr;
import com.posh.script.parser.Expr.IndexExpr;
import com.posh.script.parser.Expr.Interpolation;
import com.posh.script.parser.Expr.Invoke;
import com.posh.script.parser.Expr.ListLiteral;
import com.posh.script.parser.Expr.Literal;
import com.posh.script.parser.Expr.Logical;
import com.posh.script.parser.Expr.PipelineExpr;
import com.posh.script.parser.Expr.RecordEntry;
import com.posh.script.parser.Expr.RecordLiteral;
import com.posh.script.parser.Expr.Unary;
import com.posh.script.parser.Expr.Variable;
import com.posh.script.parser.Statement.AssignStmt;
import com.posh.script.parser.Statement.ExprStmt;
import com.posh.script.parser.Statement.FunctionStmt;
import com.posh.script.parser.Statement.If;
import com.posh.script.parser.Statement.PipelineStmt;
import com.posh.script.parser.Statement.ReturnStmt;
import com.posh.script.parser.Statement.Stmt;
import com.posh.script.parser.Statement.StmtVisitor;

public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Value> {
    private static final String TAG = "Interpreter";

    final ScopeStack scope;
    private final StageRegistry stages;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final PipelineExecutor pipeline = new PipelineExecutor(this);
    private final int maxDepth;

    public Interpreter(ScopeStack scope, StageRegistry stages, int maxDepth) {
        this.scope = scope;
        this.stages = stages;
        this.maxDepth = maxDepth;
    }

    public ScopeStack getScope() {
        return scope;
    }

    /** Name of the innermost running user function, or null at top level. */
    public String currentFunctionName() {
        for (CallFrame frame : callStack) {
            if (!frame.isScriptBlock()) return frame.functionName;
        }
        return null;
    }

    // -------------------------
    // Entry points
    // -------------------------

    /** Runs a whole program and returns the value of its final statement. */
    public Value evaluateProgram(List<Stmt> statements) {
        try {
            return executeStatements(statements);
        } catch (ReturnSignal rs) {
            throw ScriptRuntimeException.returnOutsideFunction();
        }
    }

    /**
     * Runs statements against the persistent global frame and returns what should be
     * printed: every non-null statement result, with lists unrolled.
     */
    public List<Value> evaluateLine(List<Stmt> statements) {
        List<Value> out = new ArrayList<>();
        try {
            for (Stmt s : statements) {
                Value v = s.accept(this);
                if (s instanceof AssignStmt || s instanceof FunctionStmt) continue;
                if (v.type == Value.Type.LIST) {
                    out.addAll(v.asList());
                } else if (!v.isNull()) {
                    out.add(v);
                }
            }
        } catch (ReturnSignal rs) {
            throw ScriptRuntimeException.returnOutsideFunction();
        }
        return out;
    }

    public Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    /** Value of the last statement executed; Null for an empty body. */
    Value executeStatements(List<Stmt> statements) {
        Value last = Value.nil();
        for (Stmt s : statements) last = s.accept(this);
        return last;
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Value visitExprStmt(ExprStmt stmt) {
        return evaluate(stmt.expression);
    }

    @Override
    public Value visitAssignStmt(AssignStmt stmt) {
        Value v = evaluate(stmt.value);
        scope.write((String) stmt.name.literal, v);
        return Value.nil();
    }

    @Override
    public Value visitIfStmt(If stmt) {
        if (evaluate(stmt.condition).toBoolean()) return executeStatements(stmt.thenBranch);
        if (stmt.elseBranch != null) return executeStatements(stmt.elseBranch);
        return Value.nil();
    }

    @Override
    public Value visitFunctionStmt(FunctionStmt stmt) {
        UserFunction fn = new UserFunction(stmt.name.lexeme, stmt.params, stmt.body);
        scope.defineLocal(stmt.name.lexeme, Value.function(fn));
        return Value.nil();
    }

    @Override
    public Value visitReturnStmt(ReturnStmt stmt) {
        Value v = stmt.value == null ? Value.nil() : evaluate(stmt.value);
        throw new ReturnSignal(v);
    }

    @Override
    public Value visitPipelineStmt(PipelineStmt stmt) {
        return collapse(pipeline.execute(stmt.stages));
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return Value.of(expr.value);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = (String) expr.name.literal;
        Optional<Value> v = scope.read(name);
        if (v.isEmpty()) throw ScriptRuntimeException.undefinedVariable(name);
        return v.get();
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);

        switch (expr.operator.type) {
            case PLUS:
                if (left.type == Value.Type.LIST) {
                    List<Value> joined = new ArrayList<>(left.asList());
                    if (right.type == Value.Type.LIST) joined.addAll(right.asList());
                    else joined.add(right);
                    return Value.list(joined);
                }
                if (left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
                    return Value.string(left.toDisplayString() + right.toDisplayString());
                }
                return Value.number(num(left, "+") + num(right, "+"));
            case MINUS:
                return Value.number(num(left, "-") - num(right, "-"));
            case STAR:
                return Value.number(num(left, "*") * num(right, "*"));
            case SLASH: {
                double a = num(left, "/");
                double b = num(right, "/");
                if (b == 0.0) throw ScriptRuntimeException.divisionByZero("/");
                return Value.number(a / b);
            }
            case PERCENT: {
                double a = num(left, "%");
                double b = num(right, "%");
                if (b == 0.0) throw ScriptRuntimeException.divisionByZero("%");
                return Value.number(a % b);
            }
            case EQ: return Value.bool(!unordered(left, right) && compare(left, right) == 0);
            case NE: return Value.bool(unordered(left, right) || compare(left, right) != 0);
            case GT: return Value.bool(!unordered(left, right) && compare(left, right) > 0);
            case LT: return Value.bool(!unordered(left, right) && compare(left, right) < 0);
            case GE: return Value.bool(!unordered(left, right) && compare(left, right) >= 0);
            case LE: return Value.bool(!unordered(left, right) && compare(left, right) <= 0);
            default:
                throw ScriptRuntimeException.invalidOperation("Unknown binary operator: " + expr.operator.lexeme);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        boolean left = evaluate(expr.left).toBoolean();
        if (expr.operator.type == TokenType.OR) {
            return Value.bool(left || evaluate(expr.right).toBoolean());
        }
        return Value.bool(left && evaluate(expr.right).toBoolean());
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        switch (expr.operator.type) {
            case MINUS:
                return Value.number(-num(right, "unary -"));
            case BANG:
            case NOT:
                return Value.bool(!right.toBoolean());
            default:
                throw ScriptRuntimeException.invalidOperation("Unknown unary operator: " + expr.operator.lexeme);
        }
    }

    @Override
    public Value visitInterpolationExpr(Interpolation expr) {
        StringBuilder sb = new StringBuilder();
        for (ExprInterface part : expr.parts) sb.append(evaluate(part).toDisplayString());
        return Value.string(sb.toString());
    }

    @Override
    public Value visitGetExpr(GetExpr expr) {
        Value target = evaluate(expr.object);
        String member = expr.name.lexeme;
        if (target.type != Value.Type.RECORD) {
            throw ScriptRuntimeException.notARecord(member, target.type);
        }
        return target.getProperty(member).orElseThrow(() -> ScriptRuntimeException.missingProperty(member));
    }

    @Override
    public Value visitIndexExpr(IndexExpr expr) {
        Value target = evaluate(expr.target);
        Value index = evaluate(expr.index);

        switch (target.type) {
            case LIST: {
                List<Value> items = target.asList();
                int i = toIndex(index, items.size());
                return (i < 0 || i >= items.size()) ? Value.nil() : items.get(i);
            }
            case STRING: {
                String s = target.asString();
                int i = toIndex(index, s.length());
                return (i < 0 || i >= s.length()) ? Value.nil() : Value.string(String.valueOf(s.charAt(i)));
            }
            case RECORD:
                return target.getProperty(index.toDisplayString()).orElse(Value.nil());
            default:
                throw ScriptRuntimeException.typeMismatch("index", "LIST, STRING or RECORD", target.type.name());
        }
    }

    private static int toIndex(Value index, int size) {
        OptionalDouble d = index.toNumber();
        if (d.isEmpty()) throw ScriptRuntimeException.typeMismatch("index", "NUMBER", index.type.name());
        int i = (int) d.getAsDouble();
        return i < 0 ? size + i : i;
    }

    @Override
    public Value visitRecordLiteralExpr(RecordLiteral expr) {
        PropertyMap<Value> props = new PropertyMap<>();
        for (RecordEntry e : expr.entries) props.put(e.key, evaluate(e.value));
        return Value.record(props);
    }

    @Override
    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.elements.size());
        for (ExprInterface e : expr.elements) {
            if (e instanceof PipelineExpr) {
                items.addAll(pipeline.execute(((PipelineExpr) e).stages));
            } else {
                items.add(evaluate(e));
            }
        }
        return Value.list(items);
    }

    @Override
    public Value visitBlockLiteralExpr(BlockLiteral expr) {
        return Value.block(new DeferredBlock(expr.body, expr.source));
    }

    @Override
    public Value visitCallExpr(Call expr) {
        CallTarget target = resolveCommand(expr.name.lexeme);
        if (target.kind == CallTarget.Kind.NOT_FOUND) {
            throw ScriptRuntimeException.commandNotFound(expr.name.lexeme);
        }
        List<Value> args = evaluateArguments(expr.arguments);
        PropertyMap<Value> named = evaluateNamed(expr.namedArguments);
        Value result = invokeTarget(target, args, named, List.of());
        if (target.kind == CallTarget.Kind.BUILTIN_STAGE) {
            return collapse(PipelineExecutor.flatten(result));
        }
        return result;
    }

    @Override
    public Value visitInvokeExpr(Invoke expr) {
        Value target = evaluate(expr.target);
        List<Value> args = evaluateArguments(expr.arguments);
        PropertyMap<Value> named = evaluateNamed(expr.namedArguments);
        return invokeValue(target, args, named, List.of());
    }

    @Override
    public Value visitPipelineExpr(PipelineExpr expr) {
        return collapse(pipeline.execute(expr.stages));
    }

    // -------------------------
    // Calls
    // -------------------------

    /** User functions in scope win over registered stages. */
    public CallTarget resolveCommand(String name) {
        Optional<Value> bound = scope.read(name);
        if (bound.isPresent() && bound.get().type == Value.Type.FUNCTION) {
            return CallTarget.userFunction(name, bound.get().asFunction());
        }
        Optional<Stage> stage = stages.resolve(name);
        if (stage.isPresent()) return CallTarget.builtinStage(name, stage.get());
        return CallTarget.notFound(name);
    }

    List<Value> evaluateArguments(List<ExprInterface> exprs) {
        List<Value> out = new ArrayList<>(exprs.size());
        for (ExprInterface e : exprs) out.add(evaluate(e));
        return out;
    }

    PropertyMap<Value> evaluateNamed(Map<String, ExprInterface> exprs) {
        PropertyMap<Value> out = new PropertyMap<>();
        for (Map.Entry<String, ExprInterface> e : exprs.entrySet()) out.put(e.getKey(), evaluate(e.getValue()));
        return out;
    }

    Value invokeTarget(CallTarget target, List<Value> args, PropertyMap<Value> named, List<Value> input) {
        switch (target.kind) {
            case USER_FUNCTION:
                return callFunction(target.function, args, named, input);
            case BUILTIN_STAGE: {
                if (Debug.get().isEnabled(DebugLevel.TRACE)) {
                    Debug.get().t(TAG, "stage " + target.name + " input=" + input.size() + " args=" + args.size());
                }
                Value v = target.stage.invoke(new StageContext(this, target.name, input, args, named));
                return v == null ? Value.nil() : v;
            }
            default:
                throw ScriptRuntimeException.commandNotFound(target.name);
        }
    }

    /** Invokes a function value, block value, or command named by a string. */
    Value invokeValue(Value target, List<Value> args, PropertyMap<Value> named, List<Value> input) {
        switch (target.type) {
            case FUNCTION:
                return callFunction(target.asFunction(), args, named, input);
            case BLOCK:
                return executeBlock(target.asBlock(), input.isEmpty() ? Value.nil() : input.get(0), args);
            case STRING: {
                CallTarget t = resolveCommand(target.asString());
                if (t.kind == CallTarget.Kind.NOT_FOUND) throw ScriptRuntimeException.commandNotFound(t.name);
                return invokeTarget(t, args, named, input);
            }
            default:
                throw ScriptRuntimeException.typeMismatch("&", "FUNCTION, BLOCK or STRING", target.type.name());
        }
    }

    public Value callFunction(UserFunction fn, List<Value> args, PropertyMap<Value> named, List<Value> input) {
        if (callStack.size() >= maxDepth) throw ScriptRuntimeException.callDepthExceeded(fn.name, maxDepth);
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "call " + fn.name + " depth=" + (callStack.size() + 1));
        }
        callStack.push(new CallFrame(fn.name, args));
        try {
            return fn.call(this, args, named, input);
        } finally {
            callStack.pop();
        }
    }

    /** Runs a block in a new frame with {@code $_} bound to the implicit input. */
    public Value executeBlock(DeferredBlock block, Value implicitInput) {
        return executeBlock(block, implicitInput, List.of());
    }

    Value executeBlock(DeferredBlock block, Value implicitInput, List<Value> args) {
        // blocks share the function depth limit; & on a block can recurse too
        if (callStack.size() >= maxDepth) throw ScriptRuntimeException.callDepthExceeded(CallFrame.SCRIPT_BLOCK, maxDepth);
        callStack.push(new CallFrame(CallFrame.SCRIPT_BLOCK, args));
        scope.pushFrame(ScopeStack.FrameKind.BLOCK);
        try {
            scope.defineLocal("_", implicitInput);
            scope.defineLocal("PSItem", implicitInput);
            if (!args.isEmpty()) scope.defineLocal("args", Value.list(args));
            return executeStatements(block.body);
        } finally {
            scope.popFrame();
            callStack.pop();
        }
    }

    /** Evaluates an arbitrary expression with {@code $_} bound, for non-block mid-pipeline stages. */
    Value evaluateWithItem(ExprInterface expr, Value item) {
        scope.pushFrame(ScopeStack.FrameKind.BLOCK);
        try {
            scope.defineLocal("_", item);
            scope.defineLocal("PSItem", item);
            return evaluate(expr);
        } finally {
            scope.popFrame();
        }
    }

    Value invokeWithItem(Value callable, Value item) {
        switch (callable.type) {
            case BLOCK:
                return executeBlock(callable.asBlock(), item);
            case FUNCTION:
                return callFunction(callable.asFunction(), List.of(item), new PropertyMap<>(), List.of(item));
            default:
                throw ScriptRuntimeException.typeMismatch("script block", "BLOCK", callable.type.name());
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    /** 0 items: Null, 1 item: the item, otherwise a List. */
    public static Value collapse(List<Value> items) {
        if (items.isEmpty()) return Value.nil();
        if (items.size() == 1) return items.get(0);
        return Value.list(items);
    }

    private static double num(Value v, String op) {
        OptionalDouble d = v.toNumber();
        if (d.isEmpty()) throw ScriptRuntimeException.typeMismatch("'" + op + "'", "NUMBER", v.type.name());
        return d.getAsDouble();
    }

    /** True when both sides are numeric and either is NaN; NaN is unequal to everything. */
    static boolean unordered(Value a, Value b) {
        OptionalDouble x = a.toNumber();
        OptionalDouble y = b.toNumber();
        return x.isPresent() && y.isPresent() && (Double.isNaN(x.getAsDouble()) || Double.isNaN(y.getAsDouble()));
    }

    /** Numeric when both sides are numeric, otherwise case-insensitive text. */
    public static int compare(Value a, Value b) {
        OptionalDouble x = a.toNumber();
        OptionalDouble y = b.toNumber();
        if (x.isPresent() && y.isPresent()) {
            double l = x.getAsDouble();
            double r = y.getAsDouble();
            return l < r ? -1 : (l > r ? 1 : 0);
        }
        return a.toDisplayString().compareToIgnoreCase(b.toDisplayString());
    }
}
