package com.stepflow.compiler.ast.stmt;

/**
 * 语句访问者
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface StmtVisitor<R, C> {

    R visitAssign(AssignStmt stmt, C context);

    R visitIf(IfStmt stmt, C context);

    R visitSwitch(SwitchStmt stmt, C context);

    R visitFor(ForStmt stmt, C context);

    R visitForRange(ForRangeStmt stmt, C context);

    R visitForIn(ForInStmt stmt, C context);

    R visitWhile(WhileStmt stmt, C context);

    R visitDoWhile(DoWhileStmt stmt, C context);

    R visitBreak(BreakStmt stmt, C context);

    R visitContinue(ContinueStmt stmt, C context);

    R visitReturn(ReturnStmt stmt, C context);

    R visitRaise(RaiseStmt stmt, C context);

    R visitTry(TryStmt stmt, C context);

    R visitLabelled(LabelledStmt stmt, C context);

    R visitParallel(ParallelStmt stmt, C context);

    R visitInvocation(FunctionInvocationStmt stmt, C context);
}
