package com.bracketscan.interfaces.api.dto;

import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.DocumentAnalysis;
import com.bracketscan.domain.markup.model.Element;
import com.bracketscan.domain.markup.model.ReconstructionResult;
import com.bracketscan.domain.markup.model.ScanStats;
import com.bracketscan.domain.markup.model.UnifiedReport;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyzeResponse(
        String documentName,
        ScanStats stats,
        List<DelimiterContext> delimiters,
        List<Element> elements,
        UnifiedReport report,
        Views views
) {
    /**
     * Reconstructed views; {@code full} equals the submitted content.
     */
    public record Views(
            String full,
            String elementsOnly,
            String nonElementsOnly,
            int overlappingElements,
            boolean roundTripExact
    ) {
        static Views of(ReconstructionResult reconstruction) {
            return new Views(
                    reconstruction.full(),
                    reconstruction.elementsOnly(),
                    reconstruction.nonElementsOnly(),
                    reconstruction.overlappingElements(),
                    reconstruction.roundTripExact());
        }
    }

    public static AnalyzeResponse from(DocumentAnalysis analysis, boolean includeViews) {
        return new AnalyzeResponse(
                analysis.documentName(),
                analysis.stats(),
                analysis.delimiters(),
                analysis.elements(),
                analysis.report(),
                includeViews && analysis.reconstruction() != null
                        ? Views.of(analysis.reconstruction())
                        : null);
    }
}
