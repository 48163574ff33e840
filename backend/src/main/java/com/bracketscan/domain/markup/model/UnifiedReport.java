package com.bracketscan.domain.markup.model;

import java.time.Instant;

/**
 * Per-document validation summary combining the three validators.
 */
public record UnifiedReport(
        String documentName,
        Instant generatedAt,
        ValidationStatus status,
        double score,
        ValidationReport delimiterValidation,
        ValidationReport commentValidation,
        ValidationReport sequenceValidation,
        CrossValidationSummary crossValidation,
        ValidationSummary summary
) {}
