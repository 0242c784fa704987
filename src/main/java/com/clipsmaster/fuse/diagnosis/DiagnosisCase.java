package com.clipsmaster.fuse.diagnosis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 诊断案例：一种内存压力模式与其根因、解决方案的对应记录。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosisCase {

    private final String caseId;
    private final String pattern;
    private final String symptoms;
    private final String rootCause;
    private final String solution;
    private final String severity;
    private final List<String> impact;
    private final String detection;
    /** seed / learned / imported */
    private final String source;
    private final String addedTime;

    @JsonCreator
    public DiagnosisCase(@JsonProperty("case_id") String caseId,
                         @JsonProperty("pattern") String pattern,
                         @JsonProperty("symptoms") String symptoms,
                         @JsonProperty("root_cause") String rootCause,
                         @JsonProperty("solution") String solution,
                         @JsonProperty("severity") String severity,
                         @JsonProperty("impact") List<String> impact,
                         @JsonProperty("detection") String detection,
                         @JsonProperty("source") String source,
                         @JsonProperty("added_time") String addedTime) {
        this.caseId = caseId;
        this.pattern = pattern;
        this.symptoms = symptoms != null ? symptoms : "";
        this.rootCause = rootCause;
        this.solution = solution;
        this.severity = severity != null ? severity : "medium";
        this.impact = impact != null ? List.copyOf(impact) : Collections.emptyList();
        this.detection = detection != null ? detection : "";
        this.source = source;
        this.addedTime = addedTime;
    }

    static DiagnosisCase seed(String caseId, String pattern, String symptoms, String rootCause,
                              String solution, String severity, List<String> impact, String detection) {
        return new DiagnosisCase(caseId, pattern, symptoms, rootCause, solution, severity, impact,
                detection, "seed", null);
    }

    /** 类型前缀，如 OOM_001 的 OOM */
    public String typePrefix() {
        int underscore = caseId.indexOf('_');
        return underscore > 0 ? caseId.substring(0, underscore) : caseId;
    }

    @JsonProperty("case_id")
    public String getCaseId() { return caseId; }

    @JsonProperty("pattern")
    public String getPattern() { return pattern; }

    @JsonProperty("symptoms")
    public String getSymptoms() { return symptoms; }

    @JsonProperty("root_cause")
    public String getRootCause() { return rootCause; }

    @JsonProperty("solution")
    public String getSolution() { return solution; }

    @JsonProperty("severity")
    public String getSeverity() { return severity; }

    @JsonProperty("impact")
    public List<String> getImpact() { return impact; }

    @JsonProperty("detection")
    public String getDetection() { return detection; }

    @JsonProperty("source")
    public String getSource() { return source; }

    @JsonProperty("added_time")
    public String getAddedTime() { return addedTime; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagnosisCase)) return false;
        DiagnosisCase that = (DiagnosisCase) o;
        return Objects.equals(caseId, that.caseId)
                && Objects.equals(pattern, that.pattern)
                && Objects.equals(symptoms, that.symptoms)
                && Objects.equals(rootCause, that.rootCause)
                && Objects.equals(solution, that.solution)
                && Objects.equals(severity, that.severity)
                && Objects.equals(impact, that.impact)
                && Objects.equals(detection, that.detection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caseId, pattern, symptoms, rootCause, solution, severity, impact, detection);
    }

    @Override
    public String toString() {
        return "DiagnosisCase{" + caseId + ", pattern=" + pattern + ", rootCause=" + rootCause + "}";
    }
}
