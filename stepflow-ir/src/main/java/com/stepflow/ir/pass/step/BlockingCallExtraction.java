package com.stepflow.ir.pass.step;

import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.FunctionInvocationExpr;
import com.stepflow.compiler.ast.expr.VariableRef;
import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.ir.metadata.BlockingFunctions;
import com.stepflow.ir.pass.ExpressionTransformer;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.pass.StepExpressions;
import com.stepflow.ir.pass.StepPass;
import com.stepflow.ir.pass.TempNameGenerator;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.CallStep;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 阻塞调用外提。
 * 表达式中的阻塞函数调用替换为临时变量，并在使用它的步骤前插入对应的 call 步骤。
 * 参数先于外层调用处理，临时变量编号与求值顺序一致。
 */
public class BlockingCallExtraction implements StepPass {

    private static final Logger LOG = Logger.getLogger(BlockingCallExtraction.class.getName());

    @Override
    public String getName() {
        return "BlockingCallExtraction";
    }

    @Override
    public List<WorkflowStep> run(List<WorkflowStep> steps, PassContext context) {
        List<WorkflowStep> result = new ArrayList<>();
        for (WorkflowStep step : steps) {
            TempNameGenerator temps = new TempNameGenerator(
                    context.getTempPrefix(), StepExpressions.referencedNames(step));
            if (step instanceof AssignStep) {
                result.addAll(extractFromAssign((AssignStep) step, context.getBlockingFunctions(), temps));
            } else {
                Extractor extractor = new Extractor(context.getBlockingFunctions(), temps);
                WorkflowStep rewritten = StepExpressions.transform(step, extractor::transform);
                result.addAll(extractor.callSteps);
                result.add(rewritten);
            }
        }
        return result;
    }

    /**
     * Assign 步骤在第一个含阻塞调用的条目前拆开，保持条目间的先后顺序。
     * target = blocking(...) 直接变成带 result 的 call 步骤。
     */
    private List<WorkflowStep> extractFromAssign(AssignStep step, BlockingFunctions table,
                                                 TempNameGenerator temps) {
        List<WorkflowStep> out = new ArrayList<>();
        List<Assignment> pending = new ArrayList<>();
        String name = step.getName();
        for (Assignment a : step.getAssignments()) {
            Extractor extractor = new Extractor(table, temps);
            Expression value = a.getValue();
            if (value instanceof FunctionInvocationExpr
                    && table.isBlocking(((FunctionInvocationExpr) value).getFunctionName())
                    && a.getTarget() instanceof VariableRef) {
                FunctionInvocationExpr call = (FunctionInvocationExpr) value;
                List<Expression> args = extractor.arguments(call);
                name = flush(out, pending, name);
                name = addCallSteps(out, extractor.callSteps, name);
                out.add(new CallStep(name, call.getFunctionName(), namedArguments(table, call.getFunctionName(), args),
                        ((VariableRef) a.getTarget()).getName()));
                name = null;
                continue;
            }
            Expression rewritten = extractor.transform(value);
            if (!extractor.callSteps.isEmpty()) {
                name = flush(out, pending, name);
                name = addCallSteps(out, extractor.callSteps, name);
            }
            pending.add(new Assignment(a.getTarget(), rewritten));
        }
        if (!pending.isEmpty() || out.isEmpty()) {
            out.add(new AssignStep(name, pending, step.getNext()));
        } else if (step.hasNext()) {
            // 最后一个条目被改写成 call 步骤，next 不能丢
            out.add(new NextStep(step.getNext()));
        }
        return out;
    }

    /** 步骤名落在第一个外提的 call 上，返回尚未使用的步骤名 */
    private static String addCallSteps(List<WorkflowStep> out, List<CallStep> callSteps, String name) {
        if (callSteps.isEmpty()) return name;
        if (name == null) {
            out.addAll(callSteps);
            return null;
        }
        out.add(callSteps.get(0).withName(name));
        out.addAll(callSteps.subList(1, callSteps.size()));
        return null;
    }

    /** 输出已积累的条目，返回尚未使用的步骤名 */
    private static String flush(List<WorkflowStep> out, List<Assignment> pending, String name) {
        if (pending.isEmpty()) return name;
        out.add(new AssignStep(name, new ArrayList<>(pending), null));
        pending.clear();
        return null;
    }

    static Map<String, Expression> namedArguments(BlockingFunctions table, String function,
                                                  List<Expression> args) {
        List<String> names = table.getArgumentNames(function);
        Map<String, Expression> named = new LinkedHashMap<>();
        int count = Math.min(names.size(), args.size());
        if (args.size() > names.size()) {
            LOG.fine("Dropping " + (args.size() - names.size()) + " extra argument(s) of " + function);
        }
        for (int i = 0; i < count; i++) {
            Expression arg = args.get(i);
            if (arg instanceof VariableRef && ((VariableRef) arg).isUndefined()) {
                continue;
            }
            named.put(names.get(i), arg);
        }
        return named;
    }

    private static final class Extractor extends ExpressionTransformer {
        private final BlockingFunctions table;
        private final TempNameGenerator temps;
        private final List<CallStep> callSteps = new ArrayList<>();

        Extractor(BlockingFunctions table, TempNameGenerator temps) {
            this.table = table;
            this.temps = temps;
        }

        /** 只改写参数内部，调用本身保留给外层 */
        List<Expression> arguments(FunctionInvocationExpr call) {
            return transformArguments(call);
        }

        @Override
        public Expression visitInvocation(FunctionInvocationExpr expr) {
            List<Expression> args = transformArguments(expr);
            if (!table.isBlocking(expr.getFunctionName())) {
                if (args == expr.getArguments()) return expr;
                return new FunctionInvocationExpr(expr.getLocation(), expr.getFunctionName(), args);
            }
            String temp = temps.next();
            callSteps.add(new CallStep(null, expr.getFunctionName(),
                    namedArguments(table, expr.getFunctionName(), args), temp));
            return new VariableRef(expr.getLocation(), temp);
        }
    }
}
