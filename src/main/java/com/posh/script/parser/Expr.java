package com.posh.script.parser;

import java.util.List;
import java.util.Map;

import com.posh.script.parser.Statement.Stmt;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitUnaryExpr(Unary expr);
        R visitInterpolationExpr(Interpolation expr);
        R visitGetExpr(GetExpr expr);
        R visitIndexExpr(IndexExpr expr);
        R visitRecordLiteralExpr(RecordLiteral expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitBlockLiteralExpr(BlockLiteral expr);
        R visitCallExpr(Call expr);
        R visitInvokeExpr(Invoke expr);
        R visitPipelineExpr(PipelineExpr expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    /** Constant: null, Boolean, Double or String. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    /** Variable reference; the name may carry a scope qualifier ("global:x"). */
    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** -and / -or, short-circuiting. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Double-quoted string: literal text parts interleaved with embedded expressions. */
    public static final class Interpolation implements ExprInterface {
        public final List<ExprInterface> parts;

        public Interpolation(List<ExprInterface> parts) {
            this.parts = parts;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInterpolationExpr(this);
        }
    }

    // -------------------------
    // Access
    // -------------------------

    public static final class GetExpr implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public GetExpr(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    public static final class IndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public IndexExpr(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    // -------------------------
    // Literals with structure
    // -------------------------

    public static final class RecordEntry {
        public final String key;
        public final ExprInterface value;

        public RecordEntry(String key, ExprInterface value) {
            this.key = key;
            this.value = value;
        }
    }

    /** {@code @{ k = v; ... }}; entries kept in source order, duplicates allowed. */
    public static final class RecordLiteral implements ExprInterface {
        public final List<RecordEntry> entries;

        public RecordLiteral(List<RecordEntry> entries) {
            this.entries = entries;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRecordLiteralExpr(this);
        }
    }

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> elements;

        public ListLiteral(List<ExprInterface> elements) {
            this.elements = elements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    /** {@code { ... }}; evaluates to a deferred block, never runs its body. */
    public static final class BlockLiteral implements ExprInterface {
        public final List<Stmt> body;
        public final String source;

        public BlockLiteral(List<Stmt> body, String source) {
            this.body = body;
            this.source = source;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBlockLiteralExpr(this);
        }
    }

    // -------------------------
    // Commands
    // -------------------------

    /** {@code Name arg1 arg2 -Param value}. Named keys keep their source spelling. */
    public static final class Call implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> arguments;
        public final Map<String, ExprInterface> namedArguments;

        public Call(Token name, List<ExprInterface> arguments, Map<String, ExprInterface> namedArguments) {
            this.name = name;
            this.arguments = arguments;
            this.namedArguments = namedArguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** {@code & target args...}: invoke a function, block or command held in a value. */
    public static final class Invoke implements ExprInterface {
        public final Token ampersand;
        public final ExprInterface target;
        public final List<ExprInterface> arguments;
        public final Map<String, ExprInterface> namedArguments;

        public Invoke(Token ampersand, ExprInterface target, List<ExprInterface> arguments,
                      Map<String, ExprInterface> namedArguments) {
            this.ampersand = ampersand;
            this.target = target;
            this.arguments = arguments;
            this.namedArguments = namedArguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInvokeExpr(this);
        }
    }

    /** A pipeline in expression position, e.g. the right-hand side of an assignment. */
    public static final class PipelineExpr implements ExprInterface {
        public final List<ExprInterface> stages;

        public PipelineExpr(List<ExprInterface> stages) {
            this.stages = stages;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPipelineExpr(this);
        }
    }
}
