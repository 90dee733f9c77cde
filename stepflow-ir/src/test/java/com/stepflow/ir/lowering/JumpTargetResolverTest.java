package com.stepflow.ir.lowering;

import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.compiler.error.InternalTranspilerException;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.ForStep;
import com.stepflow.ir.step.JumpTarget;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.ReturnStep;
import com.stepflow.ir.step.SwitchBranch;
import com.stepflow.ir.step.SwitchStep;
import com.stepflow.ir.step.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.stepflow.ir.AstBuilders.lit;
import static com.stepflow.ir.AstBuilders.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JumpTargetResolverTest {

    private final JumpTargetResolver resolver = new JumpTargetResolver();

    private static AssignStep assign(String name, String next) {
        return new AssignStep(name, Collections.singletonList(new Assignment(var("x"), lit(1))), next);
    }

    @Test
    @DisplayName("占位标签解析为其后第一个步骤")
    void testResolveToFollower() {
        List<WorkflowStep> out = resolver.resolve(Arrays.asList(
                new NextStep("next1", "jumptarget#1"),
                assign("assign1", null),
                new JumpTarget("jumptarget#1"),
                new JumpTarget("jumptarget#2"),
                new ReturnStep("return1", var("x"))));

        assertThat(out).hasSize(3);
        assertThat(((NextStep) out.get(0)).getTarget()).isEqualTo("return1");
    }

    @Test
    @DisplayName("列表末尾的占位解析为隐式后继")
    void testImplicitSuccessors() {
        ForStep loop = ForStep.overList("v", null, var("items"), Arrays.asList(
                assign("assign1", "jumptarget#1"),
                new JumpTarget("jumptarget#1"))).withName("for1");
        SwitchStep sw = new SwitchStep("switch1", Collections.singletonList(
                new SwitchBranch(var("c"), Arrays.asList(
                        assign("assign2", "jumptarget#2"),
                        new JumpTarget("jumptarget#2")), null)), null);
        List<WorkflowStep> out = resolver.resolve(Arrays.<WorkflowStep>asList(
                loop, sw, assign("assign3", "jumptarget#3"), new JumpTarget("jumptarget#3")));

        ForStep resolvedLoop = (ForStep) out.get(0);
        assertThat(((AssignStep) resolvedLoop.getSteps().get(0)).getNext()).isEqualTo(NextStep.CONTINUE);
        SwitchStep resolvedSwitch = (SwitchStep) out.get(1);
        assertThat(((AssignStep) resolvedSwitch.getBranches().get(0).getSteps().get(0)).getNext())
                .isEqualTo("assign3");
        assertThat(((AssignStep) out.get(2)).getNext()).isEqualTo(NextStep.END);
    }

    @Test
    @DisplayName("引用不存在的占位标签")
    void testDanglingPlaceholder() {
        assertThatThrownBy(() -> resolver.resolve(Collections.<WorkflowStep>singletonList(
                new NextStep("next1", "jumptarget#9"))))
                .isInstanceOf(InternalTranspilerException.class)
                .hasMessageContaining("jumptarget#9");
    }

    @Test
    @DisplayName("命名之前解析属于内部错误")
    void testUnnamed() {
        assertThatThrownBy(() -> resolver.resolve(Arrays.<WorkflowStep>asList(
                new JumpTarget("jumptarget#1"), assign(null, null))))
                .isInstanceOf(InternalTranspilerException.class);
    }
}
