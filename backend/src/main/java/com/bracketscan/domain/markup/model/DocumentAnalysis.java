package com.bracketscan.domain.markup.model;

import java.util.List;

/**
 * Final output of one pipeline run over a single document.
 */
public record DocumentAnalysis(
        String documentName,
        List<DelimiterContext> delimiters,
        List<Element> elements,
        UnifiedReport report,
        ReconstructionResult reconstruction,
        ScanStats stats
) {}
