package com.stepflow.ir.pass.step;

import com.stepflow.compiler.ast.expr.BinaryExpr;
import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.FunctionInvocationExpr;
import com.stepflow.compiler.ast.expr.PrimitiveLiteral;
import com.stepflow.compiler.error.WorkflowSyntaxException;
import com.stepflow.ir.pass.ExpressionTransformer;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.pass.StepExpressions;
import com.stepflow.ir.pass.StepPass;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译器内建伪函数替换为等价的运行时表达式。
 * Array.isArray(x) → get_type(x) == "list"
 */
public class IntrinsicSubstitution implements StepPass {

    public static final String IS_ARRAY = "Array.isArray";

    private final ExpressionTransformer transformer = new ExpressionTransformer() {
        @Override
        public Expression visitInvocation(FunctionInvocationExpr expr) {
            FunctionInvocationExpr call = (FunctionInvocationExpr) super.visitInvocation(expr);
            if (IS_ARRAY.equals(call.getFunctionName())) {
                if (call.getArguments().size() != 1) {
                    throw new WorkflowSyntaxException(IS_ARRAY + " expects exactly one argument",
                            call.getLocation());
                }
                FunctionInvocationExpr getType = new FunctionInvocationExpr(call.getLocation(), "get_type",
                        Collections.singletonList(call.getArguments().get(0)));
                return new BinaryExpr(call.getLocation(), getType, BinaryExpr.BinaryOp.EQ,
                        PrimitiveLiteral.of("list"));
            }
            return call;
        }
    };

    @Override
    public String getName() {
        return "IntrinsicSubstitution";
    }

    @Override
    public List<WorkflowStep> run(List<WorkflowStep> steps, PassContext context) {
        List<WorkflowStep> result = new ArrayList<>(steps.size());
        for (WorkflowStep step : steps) {
            result.add(StepExpressions.transform(step, transformer::transform));
        }
        return result;
    }
}
