package com.clipsmaster.fuse.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 单个熔断级别的触发配置：阈值与该级别要执行的动作序列。
 */
public class FuseLevelConfig {

    private final FuseLevel level;
    /** 触发阈值（压力百分比，0-100） */
    private final double threshold;
    private final List<String> actions;

    public FuseLevelConfig(FuseLevel level, double threshold, List<String> actions) {
        this.level = level;
        this.threshold = threshold;
        this.actions = actions != null ? List.copyOf(actions) : Collections.emptyList();
    }

    /**
     * 内置默认配置：WARNING 85 / CRITICAL 95 / EMERGENCY 98。
     */
    public static List<FuseLevelConfig> defaults() {
        List<FuseLevelConfig> levels = new ArrayList<>();
        levels.add(new FuseLevelConfig(FuseLevel.WARNING, 85.0,
                List.of("clear_temp_files", "reduce_log_verbosity")));
        levels.add(new FuseLevelConfig(FuseLevel.CRITICAL, 95.0,
                List.of("unload_noncritical_shards", "reduce_cache_size")));
        levels.add(new FuseLevelConfig(FuseLevel.EMERGENCY, 98.0,
                List.of("kill_largest_process", "force_gc")));
        return levels;
    }

    /**
     * 校验级别配置：非NORMAL、不重复、阈值在[0,100]且随级别严格递增。
     *
     * @throws IllegalArgumentException 配置不合法
     */
    public static void validate(List<FuseLevelConfig> levels) {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("At least one fuse level must be configured");
        }
        Set<FuseLevel> seen = EnumSet.noneOf(FuseLevel.class);
        List<FuseLevelConfig> sorted = new ArrayList<>(levels);
        sorted.sort((a, b) -> a.getLevel().compareTo(b.getLevel()));

        double previous = -1;
        for (FuseLevelConfig config : sorted) {
            if (config.getLevel() == null || config.getLevel() == FuseLevel.NORMAL) {
                throw new IllegalArgumentException("NORMAL cannot carry a trigger threshold");
            }
            if (!seen.add(config.getLevel())) {
                throw new IllegalArgumentException("Duplicate fuse level: " + config.getLevel());
            }
            if (Double.isNaN(config.getThreshold()) || config.getThreshold() < 0 || config.getThreshold() > 100) {
                throw new IllegalArgumentException("Threshold of " + config.getLevel()
                        + " must be within [0,100], got: " + config.getThreshold());
            }
            if (config.getThreshold() <= previous) {
                throw new IllegalArgumentException("Thresholds must increase with level, "
                        + config.getLevel() + " has " + config.getThreshold());
            }
            previous = config.getThreshold();
        }
    }

    public FuseLevel getLevel() { return level; }
    public double getThreshold() { return threshold; }
    public List<String> getActions() { return actions; }

    @Override
    public String toString() {
        return level + "@" + threshold + actions;
    }
}
