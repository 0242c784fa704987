package com.clipsmaster.fuse.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 动作参数校验结果
 */
public class ParameterCheckResult {
    private boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    public ParameterCheckResult() {
        this.valid = true;
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public static ParameterCheckResult failure(String error) {
        ParameterCheckResult result = new ParameterCheckResult();
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        this.errors.add(error);
        this.valid = false;
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public boolean isValid() { return valid; }
    public List<String> getErrors() { return errors; }
    public List<String> getWarnings() { return warnings; }
}
