package com.clipsmaster.fuse.diagnosis;

import java.util.Collections;
import java.util.List;

/**
 * 一次诊断的结论。matchedCase 为null表示没有案例达到置信度下限，结论为通用建议。
 */
public class DiagnosisResult {

    private final String diagnosisId;
    private final long timestamp;
    private final String matchedCase;
    private final double confidence;
    private final String rootCause;
    private final String solution;
    private final String severity;
    private final List<String> impact;
    private final List<String> similarCases;
    private final PatternFeatures features;

    public DiagnosisResult(String diagnosisId, long timestamp, String matchedCase, double confidence,
                           String rootCause, String solution, String severity, List<String> impact,
                           List<String> similarCases, PatternFeatures features) {
        this.diagnosisId = diagnosisId;
        this.timestamp = timestamp;
        this.matchedCase = matchedCase;
        this.confidence = confidence;
        this.rootCause = rootCause;
        this.solution = solution;
        this.severity = severity;
        this.impact = impact != null ? List.copyOf(impact) : Collections.emptyList();
        this.similarCases = similarCases != null ? List.copyOf(similarCases) : Collections.emptyList();
        this.features = features;
    }

    public boolean isGeneric() { return matchedCase == null; }

    public String getPattern() { return features.getPattern(); }

    public String getDiagnosisId() { return diagnosisId; }
    public long getTimestamp() { return timestamp; }
    public String getMatchedCase() { return matchedCase; }
    public double getConfidence() { return confidence; }
    public String getRootCause() { return rootCause; }
    public String getSolution() { return solution; }
    public String getSeverity() { return severity; }
    public List<String> getImpact() { return impact; }
    public List<String> getSimilarCases() { return similarCases; }
    public PatternFeatures getFeatures() { return features; }

    @Override
    public String toString() {
        return String.format("DiagnosisResult{%s, pattern=%s, case=%s, confidence=%.2f, rootCause=%s}",
                diagnosisId, getPattern(), matchedCase, confidence, rootCause);
    }
}
