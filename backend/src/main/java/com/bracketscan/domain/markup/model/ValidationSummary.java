package com.bracketscan.domain.markup.model;

public record ValidationSummary(
        int totalValidations,
        int passedValidations,
        int failedValidations,
        double coverage
) {}
