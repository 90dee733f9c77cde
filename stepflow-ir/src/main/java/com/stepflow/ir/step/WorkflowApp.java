package com.stepflow.ir.step;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 降级结果：按声明顺序排列的子工作流
 */
public class WorkflowApp {
    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private final List<Subworkflow> subworkflows;

    public WorkflowApp(List<Subworkflow> subworkflows) {
        this.subworkflows = Collections.unmodifiableList(new ArrayList<>(subworkflows));
    }

    public List<Subworkflow> getSubworkflows() {
        return subworkflows;
    }

    public Subworkflow getSubworkflow(String name) {
        for (Subworkflow s : subworkflows) {
            if (s.getName().equals(name)) return s;
        }
        return null;
    }

    public Map<String, Object> render() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Subworkflow s : subworkflows) {
            result.put(s.getName(), s.render());
        }
        return result;
    }

    public String toJson() {
        return GSON.toJson(render());
    }
}
