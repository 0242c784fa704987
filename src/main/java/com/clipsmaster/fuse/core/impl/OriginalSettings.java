package com.clipsmaster.fuse.core.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 被缓解动作修改过的设置及其还原操作。恢复阶段按修改的逆序还原。
 */
public class OriginalSettings {

    private static final Logger log = LoggerFactory.getLogger(OriginalSettings.class);

    private final LinkedHashMap<String, Runnable> restorers = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /** 同一key只保留第一次保存的还原操作 */
    public void save(String key, Runnable restorer) {
        lock.lock();
        try {
            if (restorers.putIfAbsent(key, restorer) == null) {
                log.debug("Original setting '{}' saved", key);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 还原全部设置并清空。
     *
     * @return 成功还原的数量
     */
    public int restoreAll() {
        List<Map.Entry<String, Runnable>> entries;
        lock.lock();
        try {
            entries = new ArrayList<>(restorers.entrySet());
            restorers.clear();
        } finally {
            lock.unlock();
        }

        int restored = 0;
        for (int i = entries.size() - 1; i >= 0; i--) {
            Map.Entry<String, Runnable> entry = entries.get(i);
            try {
                entry.getValue().run();
                restored++;
                log.info("Setting '{}' restored", entry.getKey());
            } catch (Exception e) {
                log.error("Failed to restore setting '{}': {}", entry.getKey(), e.getMessage(), e);
            }
        }
        return restored;
    }

    public boolean contains(String key) {
        lock.lock();
        try {
            return restorers.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return restorers.size();
        } finally {
            lock.unlock();
        }
    }
}
