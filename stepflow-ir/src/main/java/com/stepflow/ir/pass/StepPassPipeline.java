package com.stepflow.ir.pass;

import com.stepflow.ir.pass.step.AssignMerging;
import com.stepflow.ir.pass.step.BlockingCallExtraction;
import com.stepflow.ir.pass.step.IntrinsicSubstitution;
import com.stepflow.ir.pass.step.MapLiteralHoisting;
import com.stepflow.ir.pass.step.NextFlattening;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 单层步骤改写管线，降级引擎每完成一层步骤列表就执行一次。
 */
public class StepPassPipeline {

    private static final Logger LOG = Logger.getLogger(StepPassPipeline.class.getName());

    private final List<StepPass> passes = new ArrayList<>();

    public StepPassPipeline() {
    }

    /**
     * 创建默认管线。顺序固定：Map 外提 → assign 合并 → next 折叠 → 内建函数替换 → 阻塞调用外提。
     */
    public static StepPassPipeline createDefault() {
        StepPassPipeline pipeline = new StepPassPipeline();
        pipeline.addPass(new MapLiteralHoisting());
        pipeline.addPass(new AssignMerging());
        pipeline.addPass(new NextFlattening());
        pipeline.addPass(new IntrinsicSubstitution());
        pipeline.addPass(new BlockingCallExtraction());
        return pipeline;
    }

    public void addPass(StepPass pass) {
        passes.add(pass);
    }

    public List<StepPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public List<WorkflowStep> run(List<WorkflowStep> steps, PassContext context) {
        List<WorkflowStep> current = steps;
        for (StepPass pass : passes) {
            int before = current.size();
            current = pass.run(current, context);
            if (LOG.isLoggable(Level.FINEST)) {
                LOG.finest(pass.getName() + ": " + before + " -> " + current.size() + " steps");
            }
        }
        return current;
    }
}
