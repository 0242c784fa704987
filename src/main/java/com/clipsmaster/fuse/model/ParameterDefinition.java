package com.clipsmaster.fuse.model;

import java.util.List;

/**
 * 动作参数定义，用于校验配置文件中 action.&lt;name&gt;.&lt;param&gt; 的取值。
 */
public class ParameterDefinition {
    private final String name;
    private final String description;
    /** 参数类型：NUMBER, STRING, BOOLEAN, LIST */
    private final String type;
    private final boolean required;
    private final Object defaultValue;
    /** 数值型参数的取值范围下限 */
    private Double minValue;
    /** 数值型参数的取值范围上限 */
    private Double maxValue;
    /** 枚举型字符串参数的可选值 */
    private List<String> enumValues;

    public ParameterDefinition(String name, String type, Object defaultValue, String description) {
        this(name, type, false, defaultValue, description);
    }

    public ParameterDefinition(String name, String type, boolean required,
                               Object defaultValue, String description) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public ParameterDefinition range(Double min, Double max) {
        this.minValue = min;
        this.maxValue = max;
        return this;
    }

    public ParameterDefinition allowed(List<String> values) {
        this.enumValues = values;
        return this;
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getType() { return type; }
    public boolean isRequired() { return required; }
    public Object getDefaultValue() { return defaultValue; }
    public Double getMinValue() { return minValue; }
    public Double getMaxValue() { return maxValue; }
    public List<String> getEnumValues() { return enumValues; }
}
