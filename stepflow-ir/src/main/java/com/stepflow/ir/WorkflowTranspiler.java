package com.stepflow.ir;

import com.stepflow.compiler.ast.decl.FunctionDecl;
import com.stepflow.compiler.ast.decl.Parameter;
import com.stepflow.compiler.ast.decl.Program;
import com.stepflow.compiler.ast.expr.Expressions;
import com.stepflow.compiler.ast.stmt.Statement;
import com.stepflow.compiler.error.WorkflowSyntaxException;
import com.stepflow.ir.lowering.JumpTargetResolver;
import com.stepflow.ir.lowering.LoweringContext;
import com.stepflow.ir.lowering.StatementLowering;
import com.stepflow.ir.lowering.StepNameGenerator;
import com.stepflow.ir.lowering.StepNaming;
import com.stepflow.ir.metadata.BlockingFunctions;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.pass.StepPassPipeline;
import com.stepflow.ir.pass.stmt.RetryPolicyFolding;
import com.stepflow.ir.step.Subworkflow;
import com.stepflow.ir.step.WorkflowApp;
import com.stepflow.ir.step.WorkflowStep;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 工作流转译器门面。
 * 管线：语句树 → retry_policy 折叠 → 逐层降级并改写 → 步骤命名 → 跳转占位解析 → 子工作流。
 */
public class WorkflowTranspiler {

    private static final Logger LOG = Logger.getLogger(WorkflowTranspiler.class.getName());

    private static final Gson DUMP_GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private final TranspilerOptions options;
    private final StepPassPipeline pipeline;
    private final BlockingFunctions blockingFunctions;
    private PrintStream dumpOut = System.err;

    public WorkflowTranspiler() {
        this(TranspilerOptions.fromEnvironment());
    }

    public WorkflowTranspiler(TranspilerOptions options) {
        this(options, StepPassPipeline.createDefault(), BlockingFunctions.getDefault());
    }

    public WorkflowTranspiler(TranspilerOptions options, StepPassPipeline pipeline,
                              BlockingFunctions blockingFunctions) {
        this.options = options;
        this.pipeline = pipeline;
        this.blockingFunctions = blockingFunctions;
    }

    public void setDumpOut(PrintStream dumpOut) {
        this.dumpOut = dumpOut;
    }

    public TranspilerOptions getOptions() {
        return options;
    }

    public StepPassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 转译整个程序，每个函数一个子工作流。
     */
    public WorkflowApp transpile(Program program) {
        List<Subworkflow> subworkflows = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (FunctionDecl fn : program.getFunctions()) {
            if (!names.add(fn.getName())) {
                throw new WorkflowSyntaxException("Duplicate function \"" + fn.getName() + "\"", fn.getLocation());
            }
            subworkflows.add(transpile(fn));
        }
        return new WorkflowApp(subworkflows);
    }

    /**
     * 转译单个函数。
     */
    public Subworkflow transpile(FunctionDecl fn) {
        LOG.fine("Transpiling function " + fn.getName());
        for (Parameter p : fn.getParams()) {
            if (p.hasDefaultValue() && !Expressions.isLiteral(p.getDefaultValue())) {
                throw new WorkflowSyntaxException("Default value of parameter \"" + p.getName()
                        + "\" must be a literal", p.getLocation());
            }
        }

        // 1. retry_policy 折叠
        List<Statement> body = new RetryPolicyFolding().transformBlock(fn.getBody());

        // 2. 降级（每层执行单层改写管线）
        PassContext passContext = new PassContext(options.getTempVariablePrefix(),
                options.getMaxAssignmentsPerStep(), blockingFunctions);
        LoweringContext ctx = LoweringContext.root(passContext);
        StatementLowering lowering = new StatementLowering(pipeline,
                options.getTempVariablePrefix(), options.getFinallyVariablePrefix());
        List<WorkflowStep> steps = lowering.lowerBlock(body, ctx);

        // 3. 命名
        steps = new StepNaming(new StepNameGenerator(ctx.getUserLabels())).transformSteps(steps);

        // 4. 跳转占位解析
        steps = new JumpTargetResolver().resolve(steps);

        Subworkflow result = new Subworkflow(fn.getName(), fn.getParams(), steps);

        // 降级结果 dump（设置 STEPFLOW_DUMP_STEPS=1 环境变量启用）
        if (options.isDumpSteps()) {
            dumpOut.println("===== STEPS DUMP: " + fn.getName() + " =====");
            dumpOut.println(DUMP_GSON.toJson(result.render()));
            dumpOut.println("===== END STEPS DUMP =====");
        }
        return result;
    }
}
