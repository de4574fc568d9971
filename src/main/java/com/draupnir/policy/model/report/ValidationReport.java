package com.draupnir.policy.model.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating a single policy file.
 * Errors and warnings are findings, kept in the order the checks ran.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    @JsonProperty("path")
    private String path;

    /**
     * Raw kind value, also kept when the kind is not recognized or not a string
     */
    @JsonProperty("kind")
    private Object kind;

    @JsonProperty("errors")
    private List<String> errors = new ArrayList<>();

    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    /**
     * name / namespace / labels, whichever the document declares
     */
    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Absent when validation stopped before rules were inspected
     */
    @JsonProperty("summary")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private RuleSummary summary;

    public ValidationReport(String path) {
        this.path = path;
    }

    public void addError(String message) {
        errors.add(message);
    }

    public void addWarning(String message) {
        warnings.add(message);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Which rule directions a policy declares
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleSummary {

        @JsonProperty("has_ingress")
        private boolean hasIngress;

        @JsonProperty("has_egress")
        private boolean hasEgress;
    }
}
