package com.bracketscan.domain.markup.model;

public enum ValidationStatus {
    PASSED,
    FAILED;

    public static ValidationStatus of(boolean passed) {
        return passed ? PASSED : FAILED;
    }
}
