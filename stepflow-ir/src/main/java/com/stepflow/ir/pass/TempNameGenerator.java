package com.stepflow.ir.pass;

import java.util.HashSet;
import java.util.Set;

/**
 * 临时变量名生成器：prefix0, prefix1, ...，跳过步骤中已出现的名字。
 */
public final class TempNameGenerator {
    private final String prefix;
    private final Set<String> reserved;
    private int counter = 0;

    public TempNameGenerator(String prefix, Set<String> reserved) {
        this.prefix = prefix;
        this.reserved = new HashSet<>(reserved);
    }

    public String next() {
        String name;
        do {
            name = prefix + (counter++);
        } while (reserved.contains(name));
        reserved.add(name);
        return name;
    }
}
