package com.bracketscan.infrastructure.markup.pipeline;

import com.bracketscan.domain.markup.model.*;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context object passed through pipeline stages.
 * Owned by a single run; accumulates each stage's output for the next.
 */
@Data
public class MarkupPipelineContext {

    // --- Input ---
    private String documentName;
    private String document;

    // --- Scanning ---
    private List<DelimiterOccurrence> occurrences = new ArrayList<>();
    private List<DelimiterContext> delimiters = new ArrayList<>();

    // --- Elements ---
    private List<Element> elements = new ArrayList<>();

    // --- Validation ---
    private ValidationReport delimiterValidation;
    private ValidationReport commentValidation;
    private ValidationReport sequenceValidation;
    private UnifiedReport report;

    // --- Reconstruction ---
    private ReconstructionResult reconstruction;

    /**
     * Build the final DocumentAnalysis from accumulated context.
     */
    public DocumentAnalysis toDocumentAnalysis() {
        return new DocumentAnalysis(
                documentName,
                List.copyOf(delimiters),
                List.copyOf(elements),
                report,
                reconstruction,
                computeStats()
        );
    }

    ScanStats computeStats() {
        int opening = 0;
        int comment = 0;
        int innerComment = 0;
        for (DelimiterContext d : delimiters) {
            if (d.isOpening()) {
                opening++;
            }
            if (d.kind().isCommentMarker()) {
                comment++;
            } else if (d.kind() == DelimiterKind.INNER_COMMENT_CONTENT) {
                innerComment++;
            }
        }

        int comments = 0;
        int standard = 0;
        int custom = 0;
        int unnamed = 0;
        for (Element e : elements) {
            if (e.isComment()) {
                comments++;
            }
            switch (e.kind()) {
                case STANDARD_NAMED -> standard++;
                case CUSTOM -> custom++;
                case UNNAMED -> unnamed++;
            }
        }

        return new ScanStats(
                delimiters.size(), opening, delimiters.size() - opening, comment, innerComment,
                elements.size(), comments, standard, custom, unnamed);
    }
}
