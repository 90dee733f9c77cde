package com.stepflow.ir.pass.step;

import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.ir.metadata.BlockingFunctions;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.CallStep;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.ReturnStep;
import com.stepflow.ir.step.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.stepflow.ir.AstBuilders.*;
import static org.assertj.core.api.Assertions.assertThat;

class BlockingCallExtractionTest {

    private final BlockingCallExtraction pass = new BlockingCallExtraction();
    private final PassContext context = new PassContext("__temp", 50, BlockingFunctions.getDefault());

    private List<WorkflowStep> run(WorkflowStep step) {
        return pass.run(Collections.singletonList(step), context);
    }

    @Test
    @DisplayName("嵌套阻塞调用按求值顺序外提")
    void testNestedCalls() {
        List<WorkflowStep> out = run(new ReturnStep(call("http.get", call("http.get", lit("a")))));

        assertThat(out).hasSize(3);
        CallStep inner = (CallStep) out.get(0);
        CallStep outer = (CallStep) out.get(1);
        assertThat(inner.getResult()).isEqualTo("__temp0");
        assertThat(inner.getArgs().get("url").toString()).isEqualTo("\"a\"");
        assertThat(outer.getResult()).isEqualTo("__temp1");
        assertThat(outer.getArgs().get("url").toString()).isEqualTo("__temp0");
        assertThat(((ReturnStep) out.get(2)).getValue().toString()).isEqualTo("__temp1");
    }

    @Test
    @DisplayName("非阻塞调用保持不变")
    void testNonBlocking() {
        ReturnStep step = new ReturnStep(call("len", var("x")));
        List<WorkflowStep> out = run(step);
        assertThat(out).hasSize(1);
        assertThat(((ReturnStep) out.get(0)).getValue().toString()).isEqualTo("len(x)");
    }

    @Test
    @DisplayName("多余参数丢弃，undefined 参数省略")
    void testArgumentMapping() {
        List<WorkflowStep> out = run(new ReturnStep(bin(
                call("sys.sleep", lit(1), lit(2)), "+",
                call("http.get", lit("u"), var("undefined"), var("h")))));

        CallStep sleep = (CallStep) out.get(0);
        assertThat(sleep.getArgs()).containsOnlyKeys("seconds");
        CallStep get = (CallStep) out.get(1);
        assertThat(get.getArgs()).containsOnlyKeys("url", "headers");
        assertThat(get.getNamePrefix()).isEqualTo("call_http_get_");
    }

    @Test
    @DisplayName("assign 在阻塞调用处拆开以保持顺序")
    void testAssignSplit() {
        AssignStep step = new AssignStep("first", Arrays.asList(
                new Assignment(var("a"), lit(1)),
                new Assignment(var("b"), call("http.get", var("a"))),
                new Assignment(var("c"), var("b"))), "loop");
        List<WorkflowStep> out = run(step);

        assertThat(out).hasSize(3);
        AssignStep head = (AssignStep) out.get(0);
        assertThat(head.getName()).isEqualTo("first");
        assertThat(head.getAssignments()).hasSize(1);
        CallStep get = (CallStep) out.get(1);
        assertThat(get.hasName()).isFalse();
        assertThat(get.getResult()).isEqualTo("b");
        AssignStep tail = (AssignStep) out.get(2);
        assertThat(tail.getAssignments().get(0).getTarget().toString()).isEqualTo("c");
        assertThat(tail.getNext()).isEqualTo("loop");
    }

    @Test
    @DisplayName("直接赋值的阻塞调用，参数中的阻塞调用先外提并承接步骤名")
    void testDirectAssignWithBlockingArgument() {
        AssignStep step = new AssignStep("fetch", Collections.singletonList(
                new Assignment(var("r"), call("http.post", call("http.get", var("u"))))), null);
        List<WorkflowStep> out = run(step);

        assertThat(out).hasSize(2);
        CallStep inner = (CallStep) out.get(0);
        assertThat(inner.getCall()).isEqualTo("http.get");
        assertThat(inner.getName()).isEqualTo("fetch");
        assertThat(inner.getResult()).isEqualTo("__temp0");
        CallStep post = (CallStep) out.get(1);
        assertThat(post.hasName()).isFalse();
        assertThat(post.getCall()).isEqualTo("http.post");
        assertThat(post.getArgs().get("url").toString()).isEqualTo("__temp0");
        assertThat(post.getResult()).isEqualTo("r");
    }

    @Test
    @DisplayName("最后一个条目变成 call 时保留 next")
    void testTrailingNextKept() {
        AssignStep step = new AssignStep(null, Collections.singletonList(
                new Assignment(var("r"), call("sys.sleep", lit(5)))), "loop");
        List<WorkflowStep> out = run(step);

        assertThat(out).hasSize(2);
        assertThat(out.get(0)).isInstanceOf(CallStep.class);
        assertThat(((NextStep) out.get(1)).getTarget()).isEqualTo("loop");
    }

    @Test
    @DisplayName("表达式中的调用使用临时变量，步骤名落在第一个 call 上")
    void testExpressionInAssign() {
        AssignStep step = new AssignStep("named", Collections.singletonList(
                new Assignment(var("x"), bin(call("http.get", lit("u")), "+", lit(1)))), null);
        List<WorkflowStep> out = run(step);

        assertThat(out).hasSize(2);
        assertThat(out.get(0).getName()).isEqualTo("named");
        assertThat(((CallStep) out.get(0)).getResult()).isEqualTo("__temp0");
        assertThat(out.get(1).hasName()).isFalse();
        assertThat(((AssignStep) out.get(1)).getAssignments().get(0).getValue().toString())
                .isEqualTo("__temp0 + 1");
    }
}
