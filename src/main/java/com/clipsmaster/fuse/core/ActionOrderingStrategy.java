package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.model.MitigationAction;

import java.util.List;

/**
 * 动作排序策略，由熔断控制器注入使用。
 */
@FunctionalInterface
public interface ActionOrderingStrategy {

    /** 保持配置顺序 */
    ActionOrderingStrategy IDENTITY = (actions, pressure) -> actions;

    /**
     * @return 输入动作的一个排列
     */
    List<MitigationAction> order(List<MitigationAction> actions, double pressure);
}
