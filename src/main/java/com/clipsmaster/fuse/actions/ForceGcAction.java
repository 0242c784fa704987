package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 强制垃圾回收。
 *
 * 参数：
 * - run_times: 回收次数 (NUMBER, 默认 3)
 * - aggressive: 两次回收之间短暂停顿，让引用队列有机会处理 (BOOLEAN, 默认 false)
 */
public class ForceGcAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ForceGcAction.class);

    static final long AGGRESSIVE_PAUSE_MS = 50L;

    private final Runnable gcPass;

    public ForceGcAction() {
        this(System::gc);
    }

    public ForceGcAction(Runnable gcPass) {
        this.gcPass = gcPass;
    }

    @Override
    public boolean execute(ActionContext context) throws InterruptedException {
        int runTimes = Math.max(1, context.getParameter("run_times", 3));
        boolean aggressive = context.getParameter("aggressive", false);

        for (int i = 0; i < runTimes; i++) {
            gcPass.run();
            if (aggressive && i < runTimes - 1) {
                Thread.sleep(AGGRESSIVE_PAUSE_MS);
            }
        }
        log.info("Forced {} GC passes (aggressive={})", runTimes, aggressive);
        return true;
    }
}
