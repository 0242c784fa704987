package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.ActionManager;
import com.clipsmaster.fuse.core.ActionOrderingStrategy;
import com.clipsmaster.fuse.model.MitigationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 动作调度器：按影响权重与当前压力排序、挑选缓解动作。
 *
 * 压力低于90时先做代价小的动作，达到90后先做代价大的动作以尽快止血。
 */
public class ActionScheduler implements ActionOrderingStrategy {

    private static final Logger log = LoggerFactory.getLogger(ActionScheduler.class);

    public static final double DEFAULT_WEIGHT = 0.5;
    public static final double HEAVY_FIRST_PRESSURE = 90.0;

    /** 权重分类上界 */
    private static final double LIGHT_MAX = 0.4;
    private static final double MEDIUM_MAX = 0.7;

    private final ActionManager actionManager;
    private final ReentrantLock lock = new ReentrantLock();

    /** 运行时登记的权重，优先于目录中的影响权重 */
    private final Map<String, Double> weightOverrides = new HashMap<>();
    /** light / medium / heavy -> 动作名，仅用于报告 */
    private Map<String, List<String>> classification = new LinkedHashMap<>();

    public ActionScheduler(ActionManager actionManager) {
        this.actionManager = actionManager;
        rebuildClassification();
    }

    @Override
    public List<MitigationAction> order(List<MitigationAction> actions, double pressure) {
        return schedule(actions, pressure);
    }

    /**
     * 稳定排序：压力&lt;90按权重升序，≥90按权重降序。结果是输入的一个排列。
     */
    public List<MitigationAction> schedule(List<MitigationAction> actions, double pressure) {
        List<MitigationAction> ordered = new ArrayList<>(actions);
        Comparator<MitigationAction> byWeight = Comparator.comparingDouble(this::weightOf);
        ordered.sort(pressure >= HEAVY_FIRST_PRESSURE ? byWeight.reversed() : byWeight);
        return ordered;
    }

    /**
     * 排序后按压力段截取：&lt;70取一半，70-85取约2/3，85-95取约5/6，≥95取全部maxN；
     * 向上取整，至少1个，且不超过候选数量。
     */
    public List<MitigationAction> selectOptimal(List<MitigationAction> actions, double pressure, int maxN) {
        if (actions.isEmpty() || maxN <= 0) {
            return Collections.emptyList();
        }
        int count;
        if (pressure < 70) {
            count = (int) Math.ceil(maxN * 0.5);
        } else if (pressure < 85) {
            count = (int) Math.ceil(maxN * 2.0 / 3.0);
        } else if (pressure < 95) {
            count = (int) Math.ceil(maxN * 5.0 / 6.0);
        } else {
            count = maxN;
        }
        count = Math.max(1, Math.min(count, actions.size()));

        List<MitigationAction> scheduled = schedule(actions, pressure);
        log.debug("Selected {} of {} actions at pressure {}", count, actions.size(), pressure);
        return new ArrayList<>(scheduled.subList(0, count));
    }

    /**
     * 登记动作权重，截断到[0,1]并重建分类。
     */
    public void registerWeight(String actionName, double weight) {
        double clamped = Math.max(0.0, Math.min(1.0, weight));
        if (clamped != weight) {
            log.warn("Weight {} for action '{}' clamped to {}", weight, actionName, clamped);
        }
        lock.lock();
        try {
            weightOverrides.put(actionName, clamped);
        } finally {
            lock.unlock();
        }
        rebuildClassification();
    }

    public double getWeight(String actionName) {
        lock.lock();
        try {
            Double override = weightOverrides.get(actionName);
            if (override != null) {
                return override;
            }
        } finally {
            lock.unlock();
        }
        MitigationAction action = actionManager != null ? actionManager.getAction(actionName) : null;
        return action != null ? action.getImpactWeight() : DEFAULT_WEIGHT;
    }

    private double weightOf(MitigationAction action) {
        lock.lock();
        try {
            Double override = weightOverrides.get(action.getName());
            return override != null ? override : action.getImpactWeight();
        } finally {
            lock.unlock();
        }
    }

    /** 重新计算 light / medium / heavy 分类 */
    public void rebuildClassification() {
        Set<String> names = new TreeSet<>();
        if (actionManager != null) {
            for (MitigationAction action : actionManager.getCatalog()) {
                names.add(action.getName());
            }
        }
        lock.lock();
        try {
            names.addAll(weightOverrides.keySet());
        } finally {
            lock.unlock();
        }

        Map<String, List<String>> rebuilt = new LinkedHashMap<>();
        rebuilt.put("light", new ArrayList<>());
        rebuilt.put("medium", new ArrayList<>());
        rebuilt.put("heavy", new ArrayList<>());
        for (String name : names) {
            double weight = getWeight(name);
            String bucket = weight <= LIGHT_MAX ? "light" : weight <= MEDIUM_MAX ? "medium" : "heavy";
            rebuilt.get(bucket).add(name);
        }
        lock.lock();
        try {
            classification = rebuilt;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, List<String>> getClassification() {
        // 目录可能在构造之后才注册动作
        rebuildClassification();
        lock.lock();
        try {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            classification.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return copy;
        } finally {
            lock.unlock();
        }
    }
}
