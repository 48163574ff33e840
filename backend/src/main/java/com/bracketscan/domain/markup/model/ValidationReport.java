package com.bracketscan.domain.markup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of one structural validator.
 *
 * @param validator        which validator produced this report
 * @param totalItems       delimiters (or elements) the validator looked at
 * @param matchedPairs     pairs matched (adjacent element pairs for the sequence validator)
 * @param issues           all findings, ERROR first-class orphans and WARNING anomalies
 * @param consistencyScore score in [0, 1]
 * @param status           PASSED iff there are no orphans and the score is 1.0
 */
public record ValidationReport(
        ValidatorType validator,
        int totalItems,
        int matchedPairs,
        List<ValidationIssue> issues,
        double consistencyScore,
        ValidationStatus status
) {
    public static ValidationReport of(ValidatorType validator, int totalItems, int matchedPairs,
                                      List<ValidationIssue> issues, double consistencyScore) {
        boolean passed = issues.stream().noneMatch(ValidationIssue::isError) && consistencyScore == 1.0;
        return new ValidationReport(validator, totalItems, matchedPairs, List.copyOf(issues),
                consistencyScore, ValidationStatus.of(passed));
    }

    @JsonProperty("orphans")
    public List<ValidationIssue> orphans() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).toList();
    }

    @JsonIgnore
    public boolean passed() {
        return status == ValidationStatus.PASSED;
    }
}
