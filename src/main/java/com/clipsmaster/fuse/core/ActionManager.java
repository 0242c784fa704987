package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.model.FuseLevel;
import com.clipsmaster.fuse.model.MitigationAction;
import com.clipsmaster.fuse.model.ParameterCheckResult;

import java.util.List;

/**
 * 动作管理器接口。维护动作目录与处理器注册表。
 */
public interface ActionManager {

    /**
     * 注册（或显式重新注册）一个动作。
     */
    void registerAction(MitigationAction action, ActionHandler handler);

    boolean unregisterAction(String actionName);

    /** 目录中不存在时返回null */
    MitigationAction getAction(String actionName);

    List<MitigationAction> getCatalog();

    /**
     * 执行动作。从不抛出异常：未知动作、级别不允许或处理器异常都返回false。
     */
    boolean executeAction(String actionName, FuseLevel level);

    /**
     * 按动作的参数定义校验配置中的参数。
     */
    ParameterCheckResult validateParameters(String actionName);
}
