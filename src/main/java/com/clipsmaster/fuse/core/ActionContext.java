package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.model.FuseLevel;

import java.util.List;

/**
 * 动作上下文接口：缓解动作与系统交互的唯一桥梁。
 *
 * 为动作提供：
 * 1. 当前熔断级别
 * 2. 配置参数读取
 * 3. 受管资源注册表
 * 4. 原始设置的保存（恢复阶段还原）
 */
public interface ActionContext {

    FuseLevel getLevel();

    /**
     * 获取指定名称的动作参数，按默认值类型转换。
     *
     * @param paramName    参数名称
     * @param defaultValue 参数不存在或无法转换时的默认值，同时用于推断返回类型
     */
    <T> T getParameter(String paramName, T defaultValue);

    /**
     * 读取逗号分隔的列表参数。
     */
    List<String> getListParameter(String paramName, List<String> defaultValue);

    ResourceRegistry getResourceRegistry();

    /**
     * 保存被动作修改前的设置。同一key只保留第一次保存的还原操作。
     *
     * @param key      设置名称，如 "log_level"
     * @param restorer 还原操作，在恢复阶段执行
     */
    void saveOriginalSetting(String key, Runnable restorer);
}
