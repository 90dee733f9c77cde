package com.stepflow.ir.pass.stmt;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.Expressions;
import com.stepflow.compiler.ast.expr.ListExpr;
import com.stepflow.compiler.ast.expr.MapExpr;
import com.stepflow.compiler.ast.expr.PrimitiveLiteral;
import com.stepflow.compiler.ast.stmt.FunctionInvocationStmt;
import com.stepflow.compiler.ast.stmt.RetryPolicy;
import com.stepflow.compiler.ast.stmt.Statement;
import com.stepflow.compiler.ast.stmt.TryStmt;
import com.stepflow.compiler.error.InternalTranspilerException;
import com.stepflow.compiler.error.WorkflowSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 把 retry_policy(...) 调用折叠进 try 语句的重试策略。
 * 调用必须是 try 体的第一条语句，或紧跟在 try 语句之后；其它位置的调用被丢弃并告警。
 */
public class RetryPolicyFolding extends StatementTransformer {

    private static final Logger LOG = Logger.getLogger(RetryPolicyFolding.class.getName());

    public static final String RETRY_POLICY = "retry_policy";

    public String getName() {
        return "RetryPolicyFolding";
    }

    public static boolean isRetryPolicyCall(Statement stmt) {
        return stmt instanceof FunctionInvocationStmt
                && RETRY_POLICY.equals(((FunctionInvocationStmt) stmt).getCallee());
    }

    @Override
    public List<Statement> transformBlock(List<Statement> stmts) {
        List<Statement> result = new ArrayList<>();
        for (Statement stmt : stmts) {
            if (isRetryPolicyCall(stmt)) {
                Statement prev = result.isEmpty() ? null : result.get(result.size() - 1);
                RetryPolicy policy = parse((FunctionInvocationStmt) stmt);
                if (prev instanceof TryStmt) {
                    result.set(result.size() - 1, attach((TryStmt) prev, policy));
                } else {
                    LOG.warning("retry_policy at " + stmt.getLocation()
                            + " does not follow a try statement and is ignored");
                }
                continue;
            }
            result.add(transformStmt(stmt));
        }
        return result;
    }

    @Override
    protected Statement transformStmt(Statement stmt) {
        if (stmt instanceof TryStmt) {
            TryStmt t = (TryStmt) stmt;
            if (!t.getBody().isEmpty() && isRetryPolicyCall(t.getBody().get(0))) {
                RetryPolicy policy = parse((FunctionInvocationStmt) t.getBody().get(0));
                List<Statement> rest = t.getBody().subList(1, t.getBody().size());
                TryStmt stripped = t.withBodies(rest, t.getCatchBody(), t.getFinallyBody());
                return attach((TryStmt) super.transformStmt(stripped), policy);
            }
        }
        return super.transformStmt(stmt);
    }

    private TryStmt attach(TryStmt target, RetryPolicy policy) {
        if (target.hasRetryPolicy()) {
            throw new InternalTranspilerException("retry policy assigned twice to the try at "
                    + target.getLocation());
        }
        return target.withRetryPolicy(policy);
    }

    /**
     * 解析 retry_policy 的参数：限定名、{policy: 限定名}，或 {predicate, max_retries, backoff}。
     */
    public static RetryPolicy parse(FunctionInvocationStmt call) {
        SourceLocation loc = call.getLocation();
        if (call.getArguments().size() != 1) {
            throw new WorkflowSyntaxException("retry_policy expects exactly one argument", loc);
        }
        Expression arg = call.getArguments().values().iterator().next();
        if (Expressions.isFullyQualifiedName(arg)) {
            return new RetryPolicy.Named(arg);
        }
        if (!(arg instanceof MapExpr)) {
            throw new WorkflowSyntaxException(
                    "Unexpected retry_policy argument: expected a qualified function name or a map literal", loc);
        }
        MapExpr map = (MapExpr) arg;
        if (map.has("policy")) {
            Expression policy = map.get("policy");
            if (!Expressions.isFullyQualifiedName(policy)) {
                throw new WorkflowSyntaxException("retry_policy policy must be a qualified function name", loc);
            }
            return new RetryPolicy.Named(policy);
        }
        Expression predicate = map.get("predicate");
        if (predicate == null || !Expressions.isFullyQualifiedName(predicate)) {
            throw new WorkflowSyntaxException("retry_policy predicate must be a qualified function name", loc);
        }
        Expression maxRetries = map.get("max_retries");
        if (maxRetries != null) {
            checkNumeric("max_retries", maxRetries, loc);
        }
        Expression backoff = map.get("backoff");
        if (!(backoff instanceof MapExpr)) {
            throw new WorkflowSyntaxException("retry_policy backoff must be a map literal", loc);
        }
        MapExpr backoffMap = (MapExpr) backoff;
        Expression initialDelay = checkNumeric("initial_delay", backoffMap.get("initial_delay"), loc);
        Expression maxDelay = checkNumeric("max_delay", backoffMap.get("max_delay"), loc);
        Expression multiplier = checkNumeric("multiplier", backoffMap.get("multiplier"), loc);
        return new RetryPolicy.Custom(predicate, maxRetries, initialDelay, maxDelay, multiplier);
    }

    // 数字字面量或运行时表达式；其他字面量一律不接受
    private static Expression checkNumeric(String field, Expression value, SourceLocation loc) {
        if (value == null) {
            return null;
        }
        boolean bad = value instanceof ListExpr || value instanceof MapExpr
                || (value instanceof PrimitiveLiteral && !((PrimitiveLiteral) value).isNumber());
        if (bad) {
            throw new WorkflowSyntaxException("Unexpected type for retry_policy field " + field, loc);
        }
        return value;
    }
}
