package com.stepflow.ir.pass.stmt;

import com.stepflow.compiler.ast.stmt.FunctionInvocationStmt;
import com.stepflow.compiler.ast.stmt.IfStmt;
import com.stepflow.compiler.ast.stmt.RetryPolicy;
import com.stepflow.compiler.ast.stmt.Statement;
import com.stepflow.compiler.ast.stmt.TryStmt;
import com.stepflow.compiler.error.InternalTranspilerException;
import com.stepflow.compiler.error.WorkflowSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stepflow.ir.AstBuilders.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyFoldingTest {

    private final RetryPolicyFolding folding = new RetryPolicyFolding();

    private static TryStmt tryOf(Statement... body) {
        return new TryStmt(null, block(body), null, null, null, null);
    }

    private static FunctionInvocationStmt retry(Object... keyValues) {
        return callStmt("retry_policy", keyValues);
    }

    @Nested
    @DisplayName("折叠位置")
    class PlacementTests {

        @Test
        @DisplayName("try 体第一条语句")
        void testFirstInBody() {
            List<Statement> out = folding.transformBlock(block(
                    tryOf(retry("policy", var("my_policy")), assign("x", lit(1)))));

            TryStmt t = (TryStmt) out.get(0);
            assertThat(t.hasRetryPolicy()).isTrue();
            assertThat(t.getBody()).hasSize(1);
            assertThat(((RetryPolicy.Named) t.getRetryPolicy()).getPolicy().toString()).isEqualTo("my_policy");
        }

        @Test
        @DisplayName("紧跟在 try 之后")
        void testAfterTry() {
            List<Statement> out = folding.transformBlock(block(
                    tryOf(assign("x", lit(1))), retry("policy", var("p"))));
            assertThat(out).hasSize(1);
            assertThat(((TryStmt) out.get(0)).hasRetryPolicy()).isTrue();
        }

        @Test
        @DisplayName("嵌套语句块中同样折叠")
        void testNested() {
            List<Statement> out = folding.transformBlock(block(
                    ifThen(var("c"), tryOf(retry("policy", var("p")), assign("x", lit(1))))));
            IfStmt s = (IfStmt) out.get(0);
            assertThat(((TryStmt) s.getBranches().get(0).getBody().get(0)).hasRetryPolicy()).isTrue();
        }

        @Test
        @DisplayName("其它位置的调用被丢弃")
        void testDropped() {
            List<Statement> out = folding.transformBlock(block(
                    assign("x", lit(1)), retry("policy", var("p"))));
            assertThat(out).hasSize(1);
        }

        @Test
        @DisplayName("同一个 try 两次指定重试策略")
        void testTwice() {
            assertThatThrownBy(() -> folding.transformBlock(block(
                    tryOf(retry("policy", var("p")), assign("x", lit(1))),
                    retry("policy", var("q")))))
                    .isInstanceOf(InternalTranspilerException.class);
        }
    }

    @Nested
    @DisplayName("参数解析")
    class ParseTests {

        @Test
        @DisplayName("{policy: 限定名}")
        void testPolicyMap() {
            RetryPolicy policy = RetryPolicyFolding.parse(
                    retry("arg", map("policy", dot(var("http"), "default_retry"))));
            assertThat(policy).isInstanceOf(RetryPolicy.Named.class);
        }

        @Test
        @DisplayName("自定义策略")
        void testCustom() {
            RetryPolicy.Custom policy = (RetryPolicy.Custom) RetryPolicyFolding.parse(retry("arg", map(
                    "predicate", var("pred"),
                    "max_retries", lit(5),
                    "backoff", map("initial_delay", lit(1), "multiplier", var("m")))));
            assertThat(policy.getPredicate().toString()).isEqualTo("pred");
            assertThat(policy.getMaxRetries().toString()).isEqualTo("5");
            assertThat(policy.getMaxDelay()).isNull();
            assertThat(policy.getMultiplier().toString()).isEqualTo("m");
        }

        @Test
        @DisplayName("非法参数")
        void testInvalid() {
            assertThatThrownBy(() -> RetryPolicyFolding.parse(retry()))
                    .isInstanceOf(WorkflowSyntaxException.class);
            assertThatThrownBy(() -> RetryPolicyFolding.parse(retry("arg", lit(3))))
                    .isInstanceOf(WorkflowSyntaxException.class);
            assertThatThrownBy(() -> RetryPolicyFolding.parse(retry("arg", map("predicate", var("p")))))
                    .isInstanceOf(WorkflowSyntaxException.class)
                    .hasMessageContaining("backoff");
            assertThatThrownBy(() -> RetryPolicyFolding.parse(retry("arg", map(
                    "predicate", var("p"), "backoff", map("max_delay", lit(true))))))
                    .isInstanceOf(WorkflowSyntaxException.class)
                    .hasMessageContaining("max_delay");
            assertThatThrownBy(() -> RetryPolicyFolding.parse(retry("arg", map(
                    "predicate", call("f"), "backoff", map()))))
                    .isInstanceOf(WorkflowSyntaxException.class)
                    .hasMessageContaining("predicate");
        }

        @Test
        @DisplayName("数值字段不接受字符串")
        void testStringNumericField() {
            assertThatThrownBy(() -> RetryPolicyFolding.parse(retry("arg", map(
                    "predicate", var("p"),
                    "backoff", map("initial_delay", lit("abc"), "max_delay", lit(60), "multiplier", lit(2))))))
                    .isInstanceOf(WorkflowSyntaxException.class)
                    .hasMessageContaining("initial_delay");
            assertThatThrownBy(() -> RetryPolicyFolding.parse(retry("arg", map(
                    "predicate", var("p"), "max_retries", lit("3"), "backoff", map()))))
                    .isInstanceOf(WorkflowSyntaxException.class)
                    .hasMessageContaining("max_retries");
        }
    }
}
