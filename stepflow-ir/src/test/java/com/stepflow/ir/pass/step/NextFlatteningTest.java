package com.stepflow.ir.pass.step;

import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.ir.metadata.BlockingFunctions;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.NextStep;
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

class NextFlatteningTest {

    private final NextFlattening pass = new NextFlattening();
    private final PassContext context = new PassContext("__temp", 50, BlockingFunctions.getDefault());

    private static AssignStep assign(String next) {
        return new AssignStep(null, Collections.singletonList(new Assignment(var("x"), lit(1))), next);
    }

    @Test
    @DisplayName("assign 之后的 next 并入 assign")
    void testMergeIntoAssign() {
        List<WorkflowStep> out = pass.run(Arrays.<WorkflowStep>asList(assign(null), new NextStep("target")), context);
        assertThat(out).hasSize(1);
        assertThat(((AssignStep) out.get(0)).getNext()).isEqualTo("target");
    }

    @Test
    @DisplayName("已有 next 或带名字的 next 步骤保持不变")
    void testKeep() {
        List<WorkflowStep> out = pass.run(Arrays.<WorkflowStep>asList(
                assign("first"), new NextStep("second"),
                assign(null), new NextStep("user_label", "third")), context);
        assertThat(out).hasSize(4);
    }

    @Test
    @DisplayName("只含 next 的 switch 分支改写为分支 next")
    void testSwitchBranch() {
        SwitchStep sw = new SwitchStep(Arrays.asList(
                new SwitchBranch(var("a"), Collections.<WorkflowStep>singletonList(new NextStep("break")), null),
                new SwitchBranch(var("b"), Collections.<WorkflowStep>singletonList(assign(null)), null)));
        SwitchStep out = (SwitchStep) pass.run(Collections.<WorkflowStep>singletonList(sw), context).get(0);

        assertThat(out.getBranches().get(0).getSteps()).isEmpty();
        assertThat(out.getBranches().get(0).getNext()).isEqualTo("break");
        assertThat(out.getBranches().get(1).hasNext()).isFalse();
        assertThat(out.getBranches().get(1).getSteps()).hasSize(1);
    }
}
