package com.kuzur.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitVarAssignStmt(VarAssign stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitDoWhileStmt(DoWhile stmt);
        void visitForStmt(For stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitContinueStmt(ContinueStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    /** {@code name = expr} at statement level; assignment doubles as declaration. */
    public static final class VarAssign implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        VarAssign(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public void accept(StmtVisitor visitor) { visitor.visitVarAssignStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        Block(List<Stmt> statements) { this.statements = statements; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    /** One {@code elif (condition) { ... }} arm; also used for the leading {@code if}. */
    public static final class Branch {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Block body;
        Branch(Token keyword, Expr.ExprInterface condition, Block body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class If implements Stmt {
        public final Branch thenBranch;
        public final List<Branch> elifBranches;
        public final Block elseBranch; // may be null
        If(Branch thenBranch, List<Branch> elifBranches, Block elseBranch) {
            this.thenBranch = thenBranch;
            this.elifBranches = elifBranches;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Block body;
        While(Token keyword, Expr.ExprInterface condition, Block body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class DoWhile implements Stmt {
        public final Block body;
        public final Token whileKeyword;
        public final Expr.ExprInterface condition;
        DoWhile(Block body, Token whileKeyword, Expr.ExprInterface condition) {
            this.body = body;
            this.whileKeyword = whileKeyword;
            this.condition = condition;
        }
        public void accept(StmtVisitor visitor) { visitor.visitDoWhileStmt(this); }
    }

    /** {@code for var = start; end { body }}: inclusive bound, step +1. */
    public static final class For implements Stmt {
        public final Token variable;
        public final Expr.ExprInterface start;
        public final Expr.ExprInterface end;
        public final Block body;
        For(Token variable, Expr.ExprInterface start, Expr.ExprInterface end, Block body) {
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final Block body;

        FunctionStmt(Token name, List<Token> params, Block body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        BreakStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;
        ContinueStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitContinueStmt(this); }
    }
}
