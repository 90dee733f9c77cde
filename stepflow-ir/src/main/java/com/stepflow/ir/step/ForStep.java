package com.stepflow.ir.step;

import com.stepflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * For 步骤：遍历列表（in）或数值区间（range）
 */
public class ForStep extends WorkflowStep {
    private final String loopVariable;
    private final String indexVariable;  // 可选
    private final Expression iterable;   // 与 range 互斥
    private final Expression rangeStart;
    private final Expression rangeEnd;
    private final List<WorkflowStep> steps;

    private ForStep(String name, String loopVariable, String indexVariable, Expression iterable,
                    Expression rangeStart, Expression rangeEnd, List<WorkflowStep> steps) {
        super(name);
        this.loopVariable = loopVariable;
        this.indexVariable = indexVariable;
        this.iterable = iterable;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static ForStep overList(String loopVariable, String indexVariable,
                                   Expression iterable, List<WorkflowStep> steps) {
        return new ForStep(null, loopVariable, indexVariable, iterable, null, null, steps);
    }

    public static ForStep overRange(String loopVariable, Expression rangeStart,
                                    Expression rangeEnd, List<WorkflowStep> steps) {
        return new ForStep(null, loopVariable, null, null, rangeStart, rangeEnd, steps);
    }

    public String getLoopVariable() {
        return loopVariable;
    }

    public String getIndexVariable() {
        return indexVariable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public boolean isRange() {
        return iterable == null;
    }

    public Expression getRangeStart() {
        return rangeStart;
    }

    public Expression getRangeEnd() {
        return rangeEnd;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public ForStep withSteps(List<WorkflowStep> newSteps) {
        return new ForStep(name, loopVariable, indexVariable, iterable, rangeStart, rangeEnd, newSteps);
    }

    public ForStep withIterable(Expression newIterable) {
        return new ForStep(name, loopVariable, indexVariable, newIterable, rangeStart, rangeEnd, steps);
    }

    public ForStep withRange(Expression newStart, Expression newEnd) {
        return new ForStep(name, loopVariable, indexVariable, iterable, newStart, newEnd, steps);
    }

    @Override
    public ForStep withName(String newName) {
        return new ForStep(newName, loopVariable, indexVariable, iterable, rangeStart, rangeEnd, steps);
    }

    @Override
    public String getNamePrefix() {
        return "for";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
