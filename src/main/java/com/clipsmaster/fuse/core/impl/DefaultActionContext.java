package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ResourceRegistry;
import com.clipsmaster.fuse.model.FuseLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 动作上下文默认实现。
 * 封装单次动作执行所需的全部环境信息；参数来自配置文件，以字符串或原始对象保存。
 */
public class DefaultActionContext implements ActionContext {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionContext.class);

    private final String actionName;
    private final FuseLevel level;
    private final Map<String, Object> parameters;
    private final ResourceRegistry registry;
    private final OriginalSettings originalSettings;

    public DefaultActionContext(String actionName, FuseLevel level, Map<String, Object> parameters,
                                ResourceRegistry registry, OriginalSettings originalSettings) {
        this.actionName = actionName;
        this.level = level;
        this.parameters = parameters != null ? parameters : Map.of();
        this.registry = registry;
        this.originalSettings = originalSettings;
    }

    @Override
    public FuseLevel getLevel() {
        return level;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getParameter(String paramName, T defaultValue) {
        Object raw = parameters.get(paramName);
        if (raw == null || defaultValue == null) {
            return raw != null ? (T) raw : defaultValue;
        }
        if (defaultValue.getClass().isInstance(raw)) {
            return (T) raw;
        }
        try {
            Object converted = convert(raw, defaultValue.getClass());
            return converted != null ? (T) converted : defaultValue;
        } catch (NumberFormatException e) {
            log.warn("Parameter '{}' of action '{}' has invalid value '{}', using default {}",
                    paramName, actionName, raw, defaultValue);
            return defaultValue;
        }
    }

    private static Object convert(Object raw, Class<?> target) {
        String text = String.valueOf(raw).trim();
        if (target == Integer.class) {
            return raw instanceof Number ? ((Number) raw).intValue() : Integer.parseInt(text);
        }
        if (target == Long.class) {
            return raw instanceof Number ? ((Number) raw).longValue() : Long.parseLong(text);
        }
        if (target == Double.class) {
            return raw instanceof Number ? ((Number) raw).doubleValue() : Double.parseDouble(text);
        }
        if (target == Boolean.class) {
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
            throw new NumberFormatException("Not a boolean: " + text);
        }
        if (target == String.class) {
            return text;
        }
        return null;
    }

    @Override
    public List<String> getListParameter(String paramName, List<String> defaultValue) {
        Object raw = parameters.get(paramName);
        if (raw == null) {
            return defaultValue;
        }
        List<String> values = new ArrayList<>();
        if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                values.add(String.valueOf(item).trim());
            }
        } else {
            for (String item : String.valueOf(raw).split(",")) {
                if (!item.isBlank()) {
                    values.add(item.trim());
                }
            }
        }
        return values;
    }

    @Override
    public ResourceRegistry getResourceRegistry() {
        return registry;
    }

    @Override
    public void saveOriginalSetting(String key, Runnable restorer) {
        originalSettings.save(key, restorer);
    }

    public String getActionName() { return actionName; }
}
