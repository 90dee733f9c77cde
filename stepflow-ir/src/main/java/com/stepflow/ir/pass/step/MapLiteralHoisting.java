package com.stepflow.ir.pass.step;

import com.stepflow.compiler.ast.expr.BinaryExpr;
import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.FunctionInvocationExpr;
import com.stepflow.compiler.ast.expr.ListExpr;
import com.stepflow.compiler.ast.expr.MapExpr;
import com.stepflow.compiler.ast.expr.MemberExpr;
import com.stepflow.compiler.ast.expr.UnaryExpr;
import com.stepflow.compiler.ast.expr.VariableRef;
import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.pass.StepExpressions;
import com.stepflow.ir.pass.StepPass;
import com.stepflow.ir.pass.TempNameGenerator;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 嵌套 Map 字面量外提。
 * 输出格式只允许 Map 字面量作为赋值/参数的顶层值（或另一个 Map 的值），
 * 更深处的 Map 被提到前置 assign 步骤中的临时变量。
 */
public class MapLiteralHoisting implements StepPass {

    @Override
    public String getName() {
        return "MapLiteralHoisting";
    }

    @Override
    public List<WorkflowStep> run(List<WorkflowStep> steps, PassContext context) {
        List<WorkflowStep> result = new ArrayList<>();
        for (WorkflowStep step : steps) {
            TempNameGenerator temps = new TempNameGenerator(
                    context.getTempPrefix(), StepExpressions.referencedNames(step));
            Map<String, Expression> hoisted = new LinkedHashMap<>();
            WorkflowStep rewritten = StepExpressions.transform(step, e -> extract(e, 0, hoisted, temps));
            if (!hoisted.isEmpty()) {
                List<Assignment> assignments = new ArrayList<>();
                for (Map.Entry<String, Expression> entry : hoisted.entrySet()) {
                    assignments.add(new Assignment(new VariableRef(entry.getKey()), entry.getValue()));
                }
                result.add(new AssignStep(assignments));
            }
            result.add(rewritten);
        }
        return result;
    }

    private Expression extract(Expression expr, int level, Map<String, Expression> hoisted,
                               TempNameGenerator temps) {
        if (expr instanceof MapExpr) {
            MapExpr map = (MapExpr) expr;
            Map<String, Expression> entries = new LinkedHashMap<>();
            boolean changed = false;
            for (Map.Entry<String, Expression> entry : map.getEntries().entrySet()) {
                Expression value = extract(entry.getValue(), 0, hoisted, temps);
                changed |= value != entry.getValue();
                entries.put(entry.getKey(), value);
            }
            MapExpr inner = changed ? new MapExpr(map.getLocation(), entries) : map;
            if (level == 0) {
                return inner;
            }
            String temp = temps.next();
            hoisted.put(temp, inner);
            return new VariableRef(map.getLocation(), temp);
        }
        if (expr instanceof ListExpr) {
            ListExpr list = (ListExpr) expr;
            List<Expression> elements = new ArrayList<>();
            boolean changed = false;
            for (Expression e : list.getElements()) {
                Expression t = extract(e, level, hoisted, temps);
                changed |= t != e;
                elements.add(t);
            }
            return changed ? new ListExpr(list.getLocation(), elements) : list;
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            Expression operand = extract(unary.getOperand(), level, hoisted, temps);
            return operand == unary.getOperand() ? unary
                    : new UnaryExpr(unary.getLocation(), unary.getOperator(), operand);
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expr;
            Expression left = extract(binary.getLeft(), level + 1, hoisted, temps);
            Expression right = extract(binary.getRight(), level + 1, hoisted, temps);
            if (left == binary.getLeft() && right == binary.getRight()) return binary;
            return new BinaryExpr(binary.getLocation(), left, binary.getOperator(), right);
        }
        if (expr instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) expr;
            Expression object = extract(member.getObject(), level + 1, hoisted, temps);
            Expression property = extract(member.getProperty(), level + 1, hoisted, temps);
            if (object == member.getObject() && property == member.getProperty()) return member;
            return new MemberExpr(member.getLocation(), object, property, member.isComputed());
        }
        if (expr instanceof FunctionInvocationExpr) {
            FunctionInvocationExpr call = (FunctionInvocationExpr) expr;
            List<Expression> args = new ArrayList<>();
            boolean changed = false;
            for (Expression a : call.getArguments()) {
                Expression t = extract(a, level + 1, hoisted, temps);
                changed |= t != a;
                args.add(t);
            }
            return changed ? new FunctionInvocationExpr(call.getLocation(), call.getFunctionName(), args) : call;
        }
        return expr;
    }
}
