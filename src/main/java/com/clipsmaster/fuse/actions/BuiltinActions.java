package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.core.ActionManager;
import com.clipsmaster.fuse.core.MemoryProbe;
import com.clipsmaster.fuse.model.MitigationAction;
import com.clipsmaster.fuse.model.ParameterDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内置缓解动作目录。
 *
 * 权重、期望释放量、最长执行时间、重试预算和升级目标共同决定调度顺序和效果验证的标准。
 */
public final class BuiltinActions {

    private static final Logger log = LoggerFactory.getLogger(BuiltinActions.class);

    public static final String CLEAR_TEMP_FILES = "clear_temp_files";
    public static final String REDUCE_LOG_VERBOSITY = "reduce_log_verbosity";
    public static final String REDUCE_CACHE_SIZE = "reduce_cache_size";
    public static final String CLEAR_CACHE = "clear_cache";
    public static final String FORCE_GC = "force_gc";
    public static final String RELEASE_RESOURCES = "release_resources";
    public static final String UNLOAD_NONCRITICAL_SHARDS = "unload_noncritical_shards";
    public static final String UNLOAD_MODEL = "unload_model";
    public static final String KILL_LARGEST_PROCESS = "kill_largest_process";

    private BuiltinActions() {}

    /** 内置动作的目录条目，按权重从轻到重 */
    public static List<MitigationAction> catalog() {
        List<MitigationAction> catalog = new ArrayList<>();

        catalog.add(MitigationAction.builder(CLEAR_TEMP_FILES)
                .description("Delete aged temp files and release temp buffers")
                .impactWeight(0.2).expectedReductionMb(20).maxExecutionSeconds(5.0).retryBudget(1)
                .parameter(new ParameterDefinition("directories", "LIST", null, "Directories to clean"))
                .parameter(new ParameterDefinition("file_patterns", "LIST", "*.tmp,*.temp,*.bak", "File name globs"))
                .parameter(new ParameterDefinition("max_file_age_hours", "NUMBER", 2, "Minimum file age in hours")
                        .range(0.0, null))
                .build());

        catalog.add(MitigationAction.builder(REDUCE_LOG_VERBOSITY)
                .description("Raise the root log level")
                .impactWeight(0.1).expectedReductionMb(5).maxExecutionSeconds(0.5).retryBudget(1)
                .parameter(new ParameterDefinition("target_level", "STRING", "WARN", "Target root log level")
                        .allowed(List.of("INFO", "WARN", "WARNING", "ERROR", "OFF")))
                .build());

        catalog.add(MitigationAction.builder(REDUCE_CACHE_SIZE)
                .description("Release the older half of render caches and trim subtitle indexes")
                .impactWeight(0.4).expectedReductionMb(80).maxExecutionSeconds(1.0).retryBudget(3)
                .escalateTo(CLEAR_CACHE)
                .build());

        catalog.add(MitigationAction.builder(CLEAR_CACHE)
                .description("Release all render and audio caches")
                .impactWeight(0.5).expectedReductionMb(100).maxExecutionSeconds(2.0).retryBudget(3)
                .escalateTo(FORCE_GC)
                .build());

        catalog.add(MitigationAction.builder(FORCE_GC)
                .description("Force garbage collection passes")
                .impactWeight(0.5).expectedReductionMb(150).maxExecutionSeconds(3.0).retryBudget(3)
                .escalateTo(RELEASE_RESOURCES)
                .parameter(new ParameterDefinition("aggressive", "BOOLEAN", false, "Pause between passes"))
                .parameter(new ParameterDefinition("run_times", "NUMBER", 3, "Number of passes").range(1.0, 10.0))
                .build());

        catalog.add(MitigationAction.builder(RELEASE_RESOURCES)
                .description("Release temp buffers, audio caches and subtitle indexes")
                .impactWeight(0.6).expectedReductionMb(200).maxExecutionSeconds(2.0).retryBudget(2)
                .escalateTo(UNLOAD_MODEL)
                .build());

        catalog.add(MitigationAction.builder(UNLOAD_NONCRITICAL_SHARDS)
                .description("Unload model shards not marked critical")
                .impactWeight(0.7).expectedReductionMb(300).maxExecutionSeconds(5.0).retryBudget(2)
                .escalateTo(UNLOAD_MODEL)
                .parameter(new ParameterDefinition("shards", "LIST", null, "Restrict to these shards"))
                .build());

        catalog.add(MitigationAction.builder(UNLOAD_MODEL)
                .description("Unload model weight caches")
                .impactWeight(0.8).expectedReductionMb(500).maxExecutionSeconds(5.0).retryBudget(2)
                .escalateTo(KILL_LARGEST_PROCESS)
                .build());

        catalog.add(MitigationAction.builder(KILL_LARGEST_PROCESS)
                .description("Terminate the largest child process")
                .impactWeight(1.0).expectedReductionMb(1500).maxExecutionSeconds(3.0).retryBudget(1)
                .emergencyOnly()
                .parameter(new ParameterDefinition("exclude_processes", "LIST", "clipsmaster_core,system",
                        "Process name keywords never killed"))
                .parameter(new ParameterDefinition("max_memory_percent", "NUMBER", 20, "Minimum memory share to kill")
                        .range(0.0, 100.0))
                .build());

        return catalog;
    }

    /** 动作名到实现的映射 */
    public static Map<String, ActionHandler> handlers(MemoryProbe probe) {
        Map<String, ActionHandler> handlers = new LinkedHashMap<>();
        handlers.put(CLEAR_TEMP_FILES, new ClearTempFilesAction());
        handlers.put(REDUCE_LOG_VERBOSITY, new ReduceLogVerbosityAction());
        handlers.put(REDUCE_CACHE_SIZE, new ReduceCacheSizeAction());
        handlers.put(CLEAR_CACHE, new ClearCacheAction());
        handlers.put(FORCE_GC, new ForceGcAction());
        handlers.put(RELEASE_RESOURCES, new ReleaseResourcesAction());
        handlers.put(UNLOAD_NONCRITICAL_SHARDS, new UnloadNoncriticalShardsAction());
        handlers.put(UNLOAD_MODEL, new UnloadModelAction());
        handlers.put(KILL_LARGEST_PROCESS, new KillLargestProcessAction(probe));
        return handlers;
    }

    /**
     * 将全部内置动作注册到动作管理器。
     */
    public static void registerAll(ActionManager actionManager, MemoryProbe probe) {
        Map<String, ActionHandler> handlers = handlers(probe);
        for (MitigationAction action : catalog()) {
            actionManager.registerAction(action, handlers.get(action.getName()));
        }
        log.info("Registered {} built-in mitigation actions", handlers.size());
    }
}
