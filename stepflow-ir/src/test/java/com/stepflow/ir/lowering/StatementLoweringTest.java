package com.stepflow.ir.lowering;

import com.stepflow.compiler.ast.decl.FunctionDecl;
import com.stepflow.compiler.ast.stmt.ConditionalBranch;
import com.stepflow.compiler.ast.stmt.DoWhileStmt;
import com.stepflow.compiler.ast.stmt.ForInStmt;
import com.stepflow.compiler.ast.stmt.ForRangeStmt;
import com.stepflow.compiler.ast.stmt.ForStmt;
import com.stepflow.compiler.ast.stmt.FunctionInvocationStmt;
import com.stepflow.compiler.ast.stmt.LabelledStmt;
import com.stepflow.compiler.ast.stmt.ParallelStmt;
import com.stepflow.compiler.ast.stmt.RaiseStmt;
import com.stepflow.compiler.ast.stmt.Statement;
import com.stepflow.compiler.ast.stmt.SwitchStmt;
import com.stepflow.compiler.ast.stmt.TryStmt;
import com.stepflow.compiler.error.InternalTranspilerException;
import com.stepflow.compiler.error.WorkflowSyntaxException;
import com.stepflow.ir.TranspilerOptions;
import com.stepflow.ir.WorkflowTranspiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.stepflow.ir.AstBuilders.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 各语句构造的降级结果
 */
class StatementLoweringTest {

    private final WorkflowTranspiler transpiler = new WorkflowTranspiler(TranspilerOptions.defaults());

    private String render(Statement... body) {
        return GSON.toJson(transpiler.transpile(fn(body)).render());
    }

    private void assertSyntaxError(String message, Statement... body) {
        FunctionDecl f = fn(body);
        assertThatThrownBy(() -> transpiler.transpile(f))
                .isInstanceOf(WorkflowSyntaxException.class)
                .hasMessageContaining(message);
    }

    @Nested
    @DisplayName("基本语句")
    class BasicTests {

        @Test
        @DisplayName("if/else 降级为 switch，空分支保留 steps: []")
        void testIfElse() {
            String out = render(ifElse(var("c"), block(assign("a", lit(1))), Collections.<Statement>emptyList()));
            assertThat(out).isEqualTo(json("{'steps':[{'switch1':{'switch':["
                    + "{'condition':'${c}','steps':[{'assign1':{'assign':[{'a':1}]}}]},"
                    + "{'condition':true,'steps':[]}]}}]}"));
        }

        @Test
        @DisplayName("raise 与成员赋值")
        void testRaiseAndMemberAssign() {
            String out = render(
                    assign(dot(var("obj"), "field"), lit("v")),
                    new RaiseStmt(null, map("code", lit(404))));
            assertThat(out).isEqualTo(json("{'steps':[{'assign1':{'assign':[{'obj.field':'v'}]}},"
                    + "{'raise1':{'raise':{'code':404}}}]}"));
        }

        @Test
        @DisplayName("带结果变量的调用语句")
        void testCallStatement() {
            FunctionInvocationStmt stmt = new FunctionInvocationStmt(null, "googleapis.storage.get",
                    map("bucket", lit("b"), "object", var("name")).getEntries(), "blob");
            assertThat(render(stmt)).isEqualTo(json("{'steps':[{'call_googleapis_storage_get_1':"
                    + "{'call':'googleapis.storage.get','args':{'bucket':'b','object':'${name}'},'result':'blob'}}]}"));
        }

        @Test
        @DisplayName("Array.isArray 替换为 get_type 比较")
        void testIntrinsic() {
            String out = render(ifThen(call("Array.isArray", var("x")), ret(lit(true))));
            assertThat(out).contains(json("'condition':'${get_type(x) == \\'list\\'}'"));
        }

        @Test
        @DisplayName("for 循环：列表与区间")
        void testForLoops() {
            String out = render(
                    new ForStmt(null, "v", "i", var("items"), block(assign("s", bin(var("s"), "+", var("v"))))),
                    new ForRangeStmt(null, "n", lit(1), var("k"), block(assign("t", var("n")))));
            assertThat(out).isEqualTo(json("{'steps':["
                    + "{'for1':{'for':{'value':'v','index':'i','in':'${items}','steps':"
                    + "[{'assign1':{'assign':[{'s':'${s + v}'}]}}]}}},"
                    + "{'for2':{'for':{'value':'n','range':[1,'${k}'],'steps':"
                    + "[{'assign2':{'assign':[{'t':'${n}'}]}}]}}}]}"));
        }
    }

    @Nested
    @DisplayName("循环与跳转")
    class LoopTests {

        @Test
        @DisplayName("while 中的 break 跳到循环之后")
        void testWhileBreak() {
            String out = render(whileLoop(lit(true),
                    ifThen(var("done"), brk(null)),
                    assign("x", lit(1))));
            assertThat(out).isEqualTo(json("{'steps':[{'switch1':{'switch':[{'condition':true,'steps':["
                    + "{'switch2':{'switch':[{'condition':'${done}','next':'end'}]}},"
                    + "{'assign1':{'assign':[{'x':1}],'next':'switch1'}}]}]}}]}"));
        }

        @Test
        @DisplayName("do-while 中的 continue 跳到条件复查")
        void testDoWhileContinue() {
            String out = render(new DoWhileStmt(null, block(
                    ifThen(var("c"), cont(null)),
                    assign("x", bin(var("x"), "+", lit(1)))),
                    bin(var("x"), "<", lit(3))));
            assertThat(out).isEqualTo(json("{'steps':["
                    + "{'switch1':{'switch':[{'condition':'${c}','next':'switch2'}]}},"
                    + "{'assign1':{'assign':[{'x':'${x + 1}'}]}},"
                    + "{'switch2':{'switch':[{'condition':'${x < 3}','next':'switch1'}]}}]}"));
        }

        @Test
        @DisplayName("原生 for 中的 continue 使用 continue 保留字")
        void testLabelledForContinue() {
            String out = render(new LabelledStmt(null, "outer", block(
                    new ForStmt(null, "v", null, var("items"), block(ifThen(var("c"), cont("outer")))))));
            assertThat(out).isEqualTo(json("{'steps':[{'outer':{'for':{'value':'v','in':'${items}','steps':"
                    + "[{'switch1':{'switch':[{'condition':'${c}','next':'continue'}]}}]}}}]}"));
        }

        @Test
        @DisplayName("带标签的 while：标签成为循环步骤名")
        void testLabelledWhile() {
            String out = render(new LabelledStmt(null, "loop", block(
                    whileLoop(var("c"), assign("x", lit(1))))));
            assertThat(out).isEqualTo(json("{'steps':[{'loop':{'switch':[{'condition':'${c}','steps':"
                    + "[{'assign1':{'assign':[{'x':1}],'next':'loop'}}]}]}}]}"));
        }

        @Test
        @DisplayName("带标签的语句块：break 跳过块的剩余部分")
        void testLabelledBlock() {
            String out = render(
                    new LabelledStmt(null, "blk", block(
                            assign("a", lit(1)),
                            ifThen(var("c"), brk("blk")),
                            assign("a", lit(2)))),
                    ret(var("a")));
            assertThat(out).isEqualTo(json("{'steps':[{'blk':{'assign':[{'a':1}]}},"
                    + "{'switch1':{'switch':[{'condition':'${c}','next':'return1'}]}},"
                    + "{'assign1':{'assign':[{'a':2}]}},"
                    + "{'return1':{'return':'${a}'}}]}"));
        }

        @Test
        @DisplayName("生成的名字避开用户标签")
        void testGeneratedNamesSkipLabels() {
            String out = render(
                    assign("x", lit(0)),
                    new LabelledStmt(null, "assign1", block(whileLoop(var("c"), assign("y", lit(1))))));
            assertThat(out).isEqualTo(json("{'steps':[{'assign2':{'assign':[{'x':0}]}},"
                    + "{'assign1':{'switch':[{'condition':'${c}','steps':"
                    + "[{'assign3':{'assign':[{'y':1}],'next':'assign1'}}]}]}}]}"));
        }

        @Test
        @DisplayName("switch 语句保留贯穿语义，缺省时跳过所有 case")
        void testSwitchFallThrough() {
            SwitchStmt sw = new SwitchStmt(null, Arrays.asList(
                    new ConditionalBranch(bin(var("x"), "==", lit(1)), block(assign("a", lit(1)))),
                    new ConditionalBranch(bin(var("x"), "==", lit(2)), block(assign("a", lit(2)), brk(null)))));
            String out = render(sw, ret(var("a")));
            assertThat(out).isEqualTo(json("{'steps':[{'switch1':{'switch':["
                    + "{'condition':'${x == 1}','next':'assign1'},"
                    + "{'condition':'${x == 2}','next':'assign2'}],'next':'return1'}},"
                    + "{'assign1':{'assign':[{'a':1}]}},"
                    + "{'assign2':{'assign':[{'a':2}],'next':'return1'}},"
                    + "{'return1':{'return':'${a}'}}]}"));
        }

        @Test
        @DisplayName("有 default 的 switch 不追加 next")
        void testSwitchWithDefault() {
            SwitchStmt sw = new SwitchStmt(null, Arrays.asList(
                    new ConditionalBranch(bin(var("x"), "==", lit(1)), block(assign("a", lit(1)))),
                    new ConditionalBranch(lit(true), block(assign("a", lit(0))))));
            assertThat(render(sw)).startsWith(json("{'steps':[{'switch1':{'switch':["
                    + "{'condition':'${x == 1}','next':'assign1'},{'condition':true,'next':'assign2'}]}}"));
        }
    }

    @Nested
    @DisplayName("finally 模拟")
    class FinallyTests {

        @Test
        @DisplayName("catch 中的 return 也先经过 finally 体")
        void testReturnInCatch() {
            TryStmt t = tryCatchFinally(
                    block(new RaiseStmt(null, lit("boom"))),
                    "e",
                    block(ret(var("e"))),
                    block(callStmt("cleanup")));
            String out = render(t);
            assertThat(out)
                    .contains(json("'except':{'as':'e','steps':[{'assign2':{'assign':"
                            + "[{'__finally_condition1':'return'},{'__finally_value1':'${e}'}],"
                            + "'next':'call_cleanup_1'}}]}"))
                    .contains(json("{'call_cleanup_1':{'call':'cleanup'}}"));
        }

        @Test
        @DisplayName("嵌套 finally：内层的 return 交给外层 finalizer")
        void testNestedFinally() {
            TryStmt inner = tryFinally(block(ret(lit(1))), block(callStmt("a")));
            TryStmt outer = tryFinally(block(inner), block(callStmt("b")));
            String out = render(outer);
            assertThat(out)
                    .contains(json("[{'__finally_condition2':'return'},{'__finally_value2':1}],"
                            + "'next':'call_a_1'"))
                    .contains(json("[{'__finally_condition1':'return'},{'__finally_value1':'${__finally_value2}'}],"
                            + "'next':'call_b_1'"))
                    .contains(json("{'return1':{'return':'${__finally_value1}'}}"));
        }

        @Test
        @DisplayName("finally 体中的 return 沿用外层去向")
        void testReturnInsideFinallyBody() {
            TryStmt inner = tryFinally(block(assign("x", lit(1))), block(ret(var("x"))));
            TryStmt outer = tryFinally(block(inner), block(callStmt("b")));
            String out = render(outer);
            assertThat(out).contains(json("[{'__finally_condition1':'return'},{'__finally_value1':'${x}'}],"
                    + "'next':'call_b_1'"));
        }

        @Test
        @DisplayName("没有 finally 的 try 直接降级")
        void testPlainTry() {
            TryStmt t = new TryStmt(null, block(assign("a", call("http.get", lit("u")))), block(ret(var("err"))),
                    "err", null, null);
            assertThat(render(t)).isEqualTo(json("{'steps':[{'try1':{'try':{'steps':["
                    + "{'call_http_get_1':{'call':'http.get','args':{'url':'u'},'result':'a'}}]},"
                    + "'except':{'as':'err','steps':[{'return1':{'return':'${err}'}}]}}}]}"));
        }

        @Test
        @DisplayName("break 跳出 try/finally 属于内部错误")
        void testBreakOutOfFinally() {
            FunctionDecl f = fn(whileLoop(var("c"), tryFinally(block(brk(null)), block(callStmt("cleanup")))));
            assertThatThrownBy(() -> transpiler.transpile(f))
                    .isInstanceOf(InternalTranspilerException.class)
                    .hasMessageStartingWith("Internal error: ");
        }
    }

    @Nested
    @DisplayName("retry 与 parallel")
    class RetryAndParallelTests {

        @Test
        @DisplayName("try 体首条 retry_policy 折叠为 retry")
        void testRetryFolding() {
            TryStmt t = new TryStmt(null, block(
                    callStmt("retry_policy", "policy", dot(var("http"), "default_retry")),
                    assign("r", call("http.get", lit("u")))),
                    null, null, null, null);
            assertThat(render(t)).isEqualTo(json("{'steps':[{'try1':{'try':{'steps':["
                    + "{'call_http_get_1':{'call':'http.get','args':{'url':'u'},'result':'r'}}]},"
                    + "'retry':'${http.default_retry}'}}]}"));
        }

        @Test
        @DisplayName("紧跟 try 的自定义 retry_policy")
        void testCustomRetryAfterTry() {
            TryStmt t = new TryStmt(null, block(assign("x", lit(1))), null, null, null, null);
            Statement policy = callStmt("retry_policy", "params", map(
                    "predicate", var("should_retry"),
                    "max_retries", lit(3),
                    "backoff", map("initial_delay", lit(1), "max_delay", lit(60), "multiplier", lit(2))));
            assertThat(render(t, policy)).contains(json("'retry':{'predicate':'${should_retry}','max_retries':3,"
                    + "'backoff':{'initial_delay':1,'max_delay':60,'multiplier':2}}"));
        }

        @Test
        @DisplayName("位置不对的 retry_policy 被丢弃")
        void testMisplacedRetryDropped() {
            String out = render(assign("x", lit(1)),
                    callStmt("retry_policy", "policy", var("p")),
                    assign("y", lit(2)));
            assertThat(out).isEqualTo(json("{'steps':[{'assign1':{'assign':[{'x':1},{'y':2}]}}]}"));
        }

        @Test
        @DisplayName("并行分支使用独立的临时变量前缀")
        void testParallelBranches() {
            List<List<Statement>> branches = Arrays.asList(
                    block(assign("x", bin(call("http.get", lit("u")), "+", lit(1)))),
                    block(callStmt("sys.log", "text", lit("hi"))));
            ParallelStmt p = new ParallelStmt(null, branches, null, Collections.singletonList("x"), null, null);
            assertThat(render(p)).isEqualTo(json("{'steps':[{'parallel1':{'parallel':{'shared':['x'],'branches':["
                    + "{'branch1':{'steps':["
                    + "{'call_http_get_1':{'call':'http.get','args':{'url':'u'},'result':'__temp_parallel1_0'}},"
                    + "{'assign1':{'assign':[{'x':'${__temp_parallel1_0 + 1}'}]}}]}},"
                    + "{'branch2':{'steps':[{'call_sys_log_1':{'call':'sys.log','args':{'text':'hi'}}}]}}]}}}]}"));
        }

        @Test
        @DisplayName("并行 for 循环")
        void testParallelFor() {
            ParallelStmt p = new ParallelStmt(null, null,
                    new ForStmt(null, "v", null, var("items"), block(callStmt("process", "item", var("v")))),
                    null, 4, "continueAll");
            assertThat(render(p)).isEqualTo(json("{'steps':[{'parallel1':{'parallel':{'concurrency_limit':4,"
                    + "'exception_policy':'continueAll','for':{'value':'v','in':'${items}','steps':"
                    + "[{'call_process_1':{'call':'process','args':{'item':'${v}'}}}]}}}}]}"));
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("for 不能遍历非列表字面量")
        void testForOverLiteral() {
            assertSyntaxError("list", new ForStmt(null, "v", null, lit(3), block()));
            assertSyntaxError("list", new ForStmt(null, "v", null, map("a", lit(1)), block()));
        }

        @Test
        @DisplayName("区间边界必须是数字")
        void testRangeBounds() {
            assertSyntaxError("Range bounds", new ForRangeStmt(null, "n", lit("a"), lit(3), block()));
        }

        @Test
        @DisplayName("不支持 for...in")
        void testForIn() {
            assertSyntaxError("for...in", new ForInStmt(null, "k", var("obj"), block()));
        }

        @Test
        @DisplayName("赋值左侧必须是限定名")
        void testAssignTarget() {
            assertSyntaxError("left-hand side", assign(call("f"), lit(1)));
        }

        @Test
        @DisplayName("内建语句函数不能出现在表达式中")
        void testStatementOnlyInExpression() {
            assertSyntaxError("\"parallel\"", assign("x", bin(call("parallel"), "+", lit(1))));
            assertSyntaxError("\"call_step\"", ret(call("call_step", var("f"))));
        }

        @Test
        @DisplayName("循环外的 break / continue")
        void testJumpOutsideLoop() {
            assertSyntaxError("break must be inside", brk(null));
            assertSyntaxError("continue must be inside", cont(null));
            assertSyntaxError("Unknown label", whileLoop(var("c"), brk("nowhere")));
        }

        @Test
        @DisplayName("continue 到非循环标签")
        void testContinueToBlock() {
            assertSyntaxError("is not a loop", new LabelledStmt(null, "blk", block(
                    assign("a", lit(1)), whileLoop(var("c"), cont("blk")))));
        }

        @Test
        @DisplayName("带标签跳转不能跨越 for 循环体")
        void testLabelledJumpAcrossFor() {
            assertSyntaxError("for loop body", new LabelledStmt(null, "outer", block(
                    whileLoop(var("c"),
                            new ForStmt(null, "v", null, var("items"), block(brk("outer")))))));
        }

        @Test
        @DisplayName("重复标签与保留字标签")
        void testBadLabels() {
            assertSyntaxError("Duplicate label",
                    new LabelledStmt(null, "a", block(assign("x", lit(1)))),
                    new LabelledStmt(null, "a", block(assign("y", lit(1)))));
            assertSyntaxError("reserved word", new LabelledStmt(null, "end", block(assign("x", lit(1)))));
        }

        @Test
        @DisplayName("并发上限必须为正数")
        void testConcurrencyLimit() {
            ParallelStmt p = new ParallelStmt(null, null,
                    new ForStmt(null, "v", null, var("items"), block()), null, 0, null);
            assertSyntaxError("concurrency_limit", p);
        }

        @Test
        @DisplayName("非法的被调函数名")
        void testBadCallee() {
            assertSyntaxError("qualified function name", callStmt("not a name"));
        }
    }
}
