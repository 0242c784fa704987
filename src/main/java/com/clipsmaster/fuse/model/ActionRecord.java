package com.clipsmaster.fuse.model;

/**
 * 动作执行历史记录。
 */
public class ActionRecord {

    private final String action;
    private final FuseLevel level;
    /** 恢复类记录的目标级别，普通动作为null */
    private final FuseLevel targetLevel;
    private final long timestamp;
    private final boolean success;
    private final String error;

    public ActionRecord(String action, FuseLevel level, FuseLevel targetLevel,
                        long timestamp, boolean success, String error) {
        this.action = action;
        this.level = level;
        this.targetLevel = targetLevel;
        this.timestamp = timestamp;
        this.success = success;
        this.error = error;
    }

    public String getAction() { return action; }
    public FuseLevel getLevel() { return level; }
    public FuseLevel getTargetLevel() { return targetLevel; }
    public long getTimestamp() { return timestamp; }
    public boolean isSuccess() { return success; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return "ActionRecord{" + action + "@" + level + (success ? ", ok" : ", failed: " + error) + "}";
    }
}
