package com.stepflow.ir.lowering;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 步骤名生成器：每个前缀一个从 1 开始的计数器（assign1, assign2, switch1, ...）。
 * 每个子工作流一个实例；跳过用户标签已占用的名字。
 */
public final class StepNameGenerator {
    private final Map<String, Integer> counters = new HashMap<>();
    private final Set<String> taken;

    public StepNameGenerator(Set<String> reservedNames) {
        this.taken = new HashSet<>(reservedNames);
    }

    public StepNameGenerator() {
        this(new HashSet<String>());
    }

    public String next(String prefix) {
        String name;
        do {
            int n = counters.getOrDefault(prefix, 0) + 1;
            counters.put(prefix, n);
            name = prefix + n;
        } while (taken.contains(name));
        taken.add(name);
        return name;
    }
}
