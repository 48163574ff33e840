package com.bracketscan.infrastructure.markup.validation;

import com.bracketscan.domain.markup.model.CrossValidationSummary;
import com.bracketscan.domain.markup.model.UnifiedReport;
import com.bracketscan.domain.markup.model.ValidationReport;
import com.bracketscan.domain.markup.model.ValidationStatus;
import com.bracketscan.domain.markup.model.ValidationSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Combines the delimiter, comment and element-sequence reports into one {@link UnifiedReport}.
 */
@Slf4j
@Component
public class CrossValidationAggregator {

    public UnifiedReport aggregate(String documentName,
                                   ValidationReport delimiterValidation,
                                   ValidationReport commentValidation,
                                   ValidationReport sequenceValidation) {
        List<ValidationReport> reports = List.of(delimiterValidation, commentValidation, sequenceValidation);

        double meanScore = reports.stream()
                .mapToDouble(ValidationReport::consistencyScore)
                .average()
                .orElse(0.0);

        int passed = (int) reports.stream().filter(ValidationReport::passed).count();
        ValidationSummary summary = new ValidationSummary(
                reports.size(), passed, reports.size() - passed, (double) passed / reports.size());

        CrossValidationSummary cross = new CrossValidationSummary(
                ratio(commentValidation.totalItems(), delimiterValidation.totalItems()),
                ratio(sequenceValidation.totalItems(), delimiterValidation.matchedPairs()),
                meanScore);

        ValidationStatus status = ValidationStatus.of(passed == reports.size());
        log.info("[Report] {}: status={}, score={}, passed {}/{}",
                documentName, status, String.format("%.3f", meanScore), passed, reports.size());

        return new UnifiedReport(documentName, Instant.now(), status, meanScore,
                delimiterValidation, commentValidation, sequenceValidation, cross, summary);
    }

    private static double ratio(int numerator, int denominator) {
        return denominator > 0 ? (double) numerator / denominator : 0.0;
    }
}
