package com.clipsmaster.fuse.model;

/**
 * 审计事件类型。trace事件使用动态类型 {kind}_started / {kind}_completed。
 */
public enum EventType {
    FUSE_TRIGGERED("fuse_triggered"),
    FUSE_COMPLETED("fuse_completed"),
    RESOURCE_RELEASED("resource_released"),
    RECOVERY_STARTED("recovery_started"),
    RECOVERY_COMPLETED("recovery_completed"),
    VALIDATION_RESULT("validation_result"),
    MEMORY_SNAPSHOT("memory_snapshot"),
    GC_PERFORMED("gc_performed"),
    ERROR_OCCURRED("error_occurred"),
    SYSTEM_STATE_CHANGE("system_state_change"),
    CUSTOM_EVENT("custom_event");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EventType fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
