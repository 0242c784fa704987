package com.clipsmaster.fuse.core;

/**
 * 缓解动作实现契约。
 *
 * 实现必须是线程安全的；异常由动作管理器捕获并记录，不会影响同级其它动作。
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * 执行动作。
     *
     * @return 动作本身是否执行成功（释放效果由效果验证器另行衡量）
     */
    boolean execute(ActionContext context) throws Exception;
}
