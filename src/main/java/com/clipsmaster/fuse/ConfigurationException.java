package com.clipsmaster.fuse;

/**
 * 启动配置不合法（熔断阈值缺失、越界、未知级别或非递增）。
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
