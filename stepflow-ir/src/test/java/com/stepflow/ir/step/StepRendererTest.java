package com.stepflow.ir.step;

import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.error.InternalTranspilerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.stepflow.ir.AstBuilders.GSON;
import static com.stepflow.ir.AstBuilders.json;
import static com.stepflow.ir.AstBuilders.lit;
import static com.stepflow.ir.AstBuilders.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepRendererTest {

    private static String render(WorkflowStep... steps) {
        return GSON.toJson(StepRenderer.INSTANCE.renderSteps(Arrays.asList(steps)));
    }

    @Test
    @DisplayName("call 步骤省略空参数")
    void testCall() {
        Map<String, Expression> args = new LinkedHashMap<>();
        args.put("url", var("u"));
        assertThat(render(
                new CallStep("call1", "http.get", args, "r"),
                new CallStep("call2", "sys.log", Collections.<String, Expression>emptyMap(), null)))
                .isEqualTo(json("[{'call1':{'call':'http.get','args':{'url':'${u}'},'result':'r'}},"
                        + "{'call2':{'call':'sys.log'}}]"));
    }

    @Test
    @DisplayName("无返回值的 return 渲染为跳到 end")
    void testReturnWithoutValue() {
        assertThat(render(new ReturnStep("return1", null), new RaiseStep("raise1", lit("boom"))))
                .isEqualTo(json("[{'return1':{'next':'end'}},{'raise1':{'raise':'boom'}}]"));
    }

    @Test
    @DisplayName("switch 分支只有跳转时不渲染 steps")
    void testSwitch() {
        List<SwitchBranch> branches = Arrays.asList(
                new SwitchBranch(var("a"), null, "next1"),
                new SwitchBranch(lit(true), Collections.<WorkflowStep>emptyList(), null));
        assertThat(render(new SwitchStep("switch1", branches, "return1")))
                .isEqualTo(json("[{'switch1':{'switch':["
                        + "{'condition':'${a}','next':'next1'},"
                        + "{'condition':true,'steps':[]}],'next':'return1'}}]"));
    }

    @Test
    @DisplayName("未命名的步骤")
    void testUnnamedStep() {
        assertThatThrownBy(() -> render(new NextStep("end")))
                .isInstanceOf(InternalTranspilerException.class)
                .hasMessageContaining("next");
    }

    @Test
    @DisplayName("残留的跳转占位")
    void testJumpTarget() {
        assertThatThrownBy(() -> render(new JumpTarget("jumptarget#1")))
                .isInstanceOf(InternalTranspilerException.class);
    }
}
