package com.bracketscan.application.markup;

import com.bracketscan.domain.markup.model.DocumentAnalysis;

/**
 * Outcome of one document in a batch run. Exactly one of {@code analysis} and {@code error} is set.
 */
public record BatchEntry(
        String documentName,
        DocumentAnalysis analysis,
        long durationMs,
        String error
) {
    public boolean succeeded() {
        return analysis != null;
    }
}
