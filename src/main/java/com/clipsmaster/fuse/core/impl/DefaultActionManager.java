package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.core.ActionManager;
import com.clipsmaster.fuse.core.ResourceRegistry;
import com.clipsmaster.fuse.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 动作管理器默认实现。
 * 使用ConcurrentHashMap保存动作目录与处理器，支持并发注册和查询。
 */
public class DefaultActionManager implements ActionManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionManager.class);

    /** 动作目录：actionName -> MitigationAction，保持注册顺序 */
    private final Map<String, MitigationAction> catalog = Collections.synchronizedMap(new LinkedHashMap<>());
    /** 处理器注册表：actionName -> ActionHandler */
    private final ConcurrentHashMap<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    private final ResourceRegistry registry;
    private final OriginalSettings originalSettings;
    /** 配置中的动作参数：actionName -> (param -> value) */
    private final Map<String, Map<String, Object>> actionParameters;

    public DefaultActionManager(ResourceRegistry registry, OriginalSettings originalSettings,
                                Map<String, Map<String, Object>> actionParameters) {
        this.registry = registry;
        this.originalSettings = originalSettings;
        this.actionParameters = actionParameters != null ? actionParameters : Map.of();
    }

    @Override
    public void registerAction(MitigationAction action, ActionHandler handler) {
        if (action == null || handler == null) {
            throw new IllegalArgumentException("Action and handler must not be null");
        }
        MitigationAction previous = catalog.put(action.getName(), action);
        handlers.put(action.getName(), handler);
        if (previous != null) {
            log.info("Action '{}' re-registered. Expected reduction {}MB -> {}MB",
                    action.getName(), previous.getExpectedReductionMb(), action.getExpectedReductionMb());
        } else {
            log.info("Action '{}' registered. Weight: {}, expected reduction: {}MB",
                    action.getName(), action.getImpactWeight(), action.getExpectedReductionMb());
        }
    }

    @Override
    public boolean unregisterAction(String actionName) {
        MitigationAction removed = catalog.remove(actionName);
        handlers.remove(actionName);
        if (removed == null) {
            log.warn("Action '{}' not found, nothing to unregister.", actionName);
            return false;
        }
        log.info("Action '{}' unregistered.", actionName);
        return true;
    }

    @Override
    public MitigationAction getAction(String actionName) {
        return actionName != null ? catalog.get(actionName) : null;
    }

    @Override
    public List<MitigationAction> getCatalog() {
        synchronized (catalog) {
            return new ArrayList<>(catalog.values());
        }
    }

    @Override
    public boolean executeAction(String actionName, FuseLevel level) {
        MitigationAction action = catalog.get(actionName);
        ActionHandler handler = handlers.get(actionName);
        if (action == null || handler == null) {
            log.warn("Action '{}' is not registered, skipped.", actionName);
            return false;
        }
        if (action.isEmergencyOnly() && level != FuseLevel.EMERGENCY) {
            log.warn("Action '{}' is only allowed at EMERGENCY level, current level {}", actionName, level);
            return false;
        }

        DefaultActionContext context = new DefaultActionContext(actionName, level,
                actionParameters.getOrDefault(actionName, Map.of()), registry, originalSettings);
        try {
            boolean success = handler.execute(context);
            log.info("Action '{}' executed at {}: {}", actionName, level, success ? "success" : "no effect");
            return success;
        } catch (Exception e) {
            log.error("Action '{}' failed at {}: {}", actionName, level, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public ParameterCheckResult validateParameters(String actionName) {
        ParameterCheckResult result = new ParameterCheckResult();

        MitigationAction action = catalog.get(actionName);
        if (action == null) {
            result.addError("Action '" + actionName + "' is not registered.");
            return result;
        }

        Map<String, Object> params = actionParameters.getOrDefault(actionName, Map.of());
        List<ParameterDefinition> definitions = action.getParameterDefinitions();

        for (ParameterDefinition def : definitions) {
            String paramName = def.getName();
            Object value = params.get(paramName);

            // 必选参数缺失检查
            if (def.isRequired() && value == null) {
                result.addError("Required parameter '" + paramName + "' is missing.");
                continue;
            }
            if (value == null) {
                continue; // 使用默认值
            }

            String text = String.valueOf(value).trim();
            switch (def.getType().toUpperCase()) {
                case "NUMBER":
                    try {
                        double numVal = value instanceof Number
                                ? ((Number) value).doubleValue() : Double.parseDouble(text);
                        if (def.getMinValue() != null && numVal < def.getMinValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " is below minimum " + def.getMinValue());
                        }
                        if (def.getMaxValue() != null && numVal > def.getMaxValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " exceeds maximum " + def.getMaxValue());
                        }
                    } catch (NumberFormatException e) {
                        result.addError("Parameter '" + paramName + "' expects NUMBER, got: " + text);
                    }
                    break;

                case "BOOLEAN":
                    if (!"true".equalsIgnoreCase(text) && !"false".equalsIgnoreCase(text)) {
                        result.addError("Parameter '" + paramName + "' expects BOOLEAN, got: " + text);
                    }
                    break;

                case "STRING":
                    if (def.getEnumValues() != null && !def.getEnumValues().contains(text.toUpperCase())) {
                        result.addError("Parameter '" + paramName + "' value '"
                                + text + "' is not in allowed values: " + def.getEnumValues());
                    }
                    break;

                case "LIST":
                    break;

                default:
                    result.addWarning("Unknown parameter type '" + def.getType()
                            + "' for parameter '" + paramName + "', skipping validation.");
            }
        }

        // 检查是否有多余的未定义参数
        Set<String> definedNames = definitions.stream()
                .map(ParameterDefinition::getName)
                .collect(Collectors.toSet());
        for (String key : params.keySet()) {
            if (!definedNames.contains(key)) {
                result.addWarning("Parameter '" + key + "' is not defined for action '"
                        + actionName + "', it will be ignored.");
            }
        }

        return result;
    }

    public OriginalSettings getOriginalSettings() { return originalSettings; }
    public ResourceRegistry getResourceRegistry() { return registry; }
}
