package com.stepflow.ir.metadata;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.stepflow.compiler.error.InternalTranspilerException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 阻塞函数表：限定名 → 位置参数对应的命名参数。
 * 这些调用在目标运行时中必须独占一个 call 步骤。
 */
public final class BlockingFunctions {

    private static final Logger LOG = Logger.getLogger(BlockingFunctions.class.getName());

    public static final String RESOURCE = "/blocking-functions.json";

    private static volatile BlockingFunctions defaultTable;

    private final Map<String, List<String>> argumentNames;

    public BlockingFunctions(Map<String, List<String>> argumentNames) {
        this.argumentNames = Collections.unmodifiableMap(new LinkedHashMap<>(argumentNames));
    }

    /**
     * 类路径上的内置表（首次使用时加载）。
     */
    public static BlockingFunctions getDefault() {
        BlockingFunctions table = defaultTable;
        if (table == null) {
            synchronized (BlockingFunctions.class) {
                table = defaultTable;
                if (table == null) {
                    table = load(RESOURCE);
                    defaultTable = table;
                }
            }
        }
        return table;
    }

    public static BlockingFunctions load(String resource) {
        InputStream in = BlockingFunctions.class.getResourceAsStream(resource);
        if (in == null) {
            throw new InternalTranspilerException("missing resource " + resource);
        }
        Type type = new TypeToken<LinkedHashMap<String, List<String>>>() {}.getType();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Map<String, List<String>> table = new Gson().fromJson(reader, type);
            LOG.fine("Loaded " + table.size() + " blocking functions from " + resource);
            return new BlockingFunctions(table);
        } catch (IOException e) {
            throw new InternalTranspilerException("cannot read " + resource + ": " + e.getMessage());
        }
    }

    public boolean isBlocking(String functionName) {
        return argumentNames.containsKey(functionName);
    }

    /** 未登记的函数返回 null */
    public List<String> getArgumentNames(String functionName) {
        return argumentNames.get(functionName);
    }
}
