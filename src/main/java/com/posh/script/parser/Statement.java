package com.posh.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitAssignStmt(AssignStmt stmt);
        R visitIfStmt(If stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitPipelineStmt(PipelineStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    /** {@code $name = value}; the name may be scope-qualified. */
    public static final class AssignStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;
        public AssignStmt(Token name, Expr.ExprInterface value) { this.name = name; this.value = value; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    /** elseif chains are nested Ifs inside elseBranch. elseBranch may be null. */
    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch;
        public If(Expr.ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class Parameter {
        public final Token name;
        /** Evaluated in the callee frame when no argument is bound; may be null. */
        public final Expr.ExprInterface defaultValue;
        public Parameter(Token name, Expr.ExprInterface defaultValue) {
            this.name = name;
            this.defaultValue = defaultValue;
        }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Parameter> params;
        public final List<Stmt> body;
        public FunctionStmt(Token name, List<Parameter> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;
        public ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    /** Two or more stages joined by {@code |}. */
    public static final class PipelineStmt implements Stmt {
        public final List<Expr.ExprInterface> stages;
        public PipelineStmt(List<Expr.ExprInterface> stages) { this.stages = stages; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPipelineStmt(this); }
    }
}
