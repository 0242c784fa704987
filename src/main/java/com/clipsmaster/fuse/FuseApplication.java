package com.clipsmaster.fuse;

import com.clipsmaster.fuse.core.impl.DefaultFuseContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 熔断器独立运行入口。
 * 一条命令完成全部初始化：加载配置、打开事件存储、注册内置动作、启动采样与评估。
 *
 * 用法：java -jar clipsmaster-memory-fuse.jar [配置文件路径]
 */
public class FuseApplication {

    private static final Logger log = LoggerFactory.getLogger(FuseApplication.class);

    private DefaultFuseContext context;

    public void start(FuseConfig config) {
        log.info("=== ClipsMaster Memory Fuse ===");

        context = DefaultFuseContext.create(config);

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        context.start();
        log.info("=== Memory fuse started, {} actions registered ===",
                context.getActionManager().getCatalog().size());
    }

    public void shutdown() {
        if (context != null && context.isRunning()) {
            context.shutdown();
            log.info("=== Memory fuse shut down ===");
        }
    }

    public DefaultFuseContext getContext() { return context; }

    /**
     * 应用入口
     */
    public static void main(String[] args) throws InterruptedException {
        String configPath = (args.length > 0) ? args[0] : "config/fuse.properties";

        FuseConfig config = FuseConfig.load(configPath);
        FuseApplication app = new FuseApplication();
        app.start(config);

        // 后台线程均为守护线程，主线程保持进程存活
        Thread.currentThread().join();
    }
}
