package com.clipsmaster.fuse.actions;

import ch.qos.logback.classic.Level;
import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 降低日志详细程度：提高Logback根日志级别，原始级别在恢复阶段还原。
 *
 * 参数：
 * - target_level: 目标级别 (STRING, 默认 WARN)
 */
public class ReduceLogVerbosityAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReduceLogVerbosityAction.class);

    @Override
    public boolean execute(ActionContext context) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger)) {
            log.warn("Root logger is not backed by Logback ({}), cannot change verbosity",
                    root.getClass().getName());
            return false;
        }
        ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;

        String targetName = context.getParameter("target_level", "WARN");
        // WARNING 与 WARN 等价
        if ("WARNING".equalsIgnoreCase(targetName)) {
            targetName = "WARN";
        }
        Level target = Level.toLevel(targetName, Level.WARN);

        Level original = logbackRoot.getLevel();
        context.saveOriginalSetting("log_level", () -> logbackRoot.setLevel(original));

        log.info("Reducing log verbosity: {} -> {}", original, target);
        logbackRoot.setLevel(target);
        return true;
    }
}
