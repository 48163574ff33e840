package com.bracketscan.domain.markup.service;

import com.bracketscan.domain.markup.model.DocumentAnalysis;

/**
 * Domain service for delimiter-level markup analysis.
 */
public interface MarkupAnalysisService {

    /**
     * Scan, classify, validate, build elements and reconstruct a single document.
     * Structural problems are reported in the result, never thrown.
     *
     * @param documentName name used in the report (nullable)
     * @param document     the raw document text; null is treated as empty
     * @return the complete analysis of the document
     */
    DocumentAnalysis analyze(String documentName, String document);
}
