package com.bracketscan.infrastructure.markup.pipeline;

import com.bracketscan.domain.markup.model.DocumentAnalysis;
import com.bracketscan.domain.markup.service.MarkupAnalysisService;
import com.bracketscan.infrastructure.markup.element.ElementBuilder;
import com.bracketscan.infrastructure.markup.reconstruction.DocumentReconstructor;
import com.bracketscan.infrastructure.markup.scanning.DelimiterClassifier;
import com.bracketscan.infrastructure.markup.scanning.DelimiterScanner;
import com.bracketscan.infrastructure.markup.validation.CommentPairValidator;
import com.bracketscan.infrastructure.markup.validation.CrossValidationAggregator;
import com.bracketscan.infrastructure.markup.validation.DelimiterPairValidator;
import com.bracketscan.infrastructure.markup.validation.ElementSequenceValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;

/**
 * Orchestrates the analysis of one document:
 * <p>
 * scan → classify → validate delimiters/comments → build elements → validate sequence → aggregate → reconstruct
 * </p>
 * Validator failures never stop the run; element building and reconstruction always
 * execute so that malformed documents still get diagnostic output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarkupPipeline implements MarkupAnalysisService {

    private final DelimiterScanner scanner;
    private final DelimiterClassifier classifier;
    private final DelimiterPairValidator delimiterValidator;
    private final CommentPairValidator commentValidator;
    private final ElementBuilder elementBuilder;
    private final ElementSequenceValidator sequenceValidator;
    private final CrossValidationAggregator aggregator;
    private final DocumentReconstructor reconstructor;

    @Override
    public DocumentAnalysis analyze(String documentName, String document) {
        MarkupPipelineContext ctx = new MarkupPipelineContext();
        ctx.setDocumentName(documentName);
        ctx.setDocument(document == null ? "" : document);

        long start = System.currentTimeMillis();

        // 1. Scan + classify
        scan(ctx);
        checkpoint("scan");

        // 2. Delimiter and comment pairing
        validatePairs(ctx);
        checkpoint("pairing");

        // 3. Elements + sequence
        buildElements(ctx);
        checkpoint("elements");

        // 4. Unified report
        ctx.setReport(aggregator.aggregate(
                documentName,
                ctx.getDelimiterValidation(),
                ctx.getCommentValidation(),
                ctx.getSequenceValidation()));
        checkpoint("report");

        // 5. Round trip
        ctx.setReconstruction(reconstructor.reconstructVerified(ctx.getElements(), ctx.getDocument()));

        log.info("[Pipeline] {}: {} chars, {} delimiters, {} elements, status={} ({}ms)",
                documentName, ctx.getDocument().length(), ctx.getDelimiters().size(),
                ctx.getElements().size(), ctx.getReport().status(), System.currentTimeMillis() - start);

        return ctx.toDocumentAnalysis();
    }

    void scan(MarkupPipelineContext ctx) {
        ctx.setOccurrences(scanner.scan(ctx.getDocument()));
        ctx.setDelimiters(classifier.classify(ctx.getOccurrences(), ctx.getDocument()));
    }

    void validatePairs(MarkupPipelineContext ctx) {
        ctx.setDelimiterValidation(delimiterValidator.validate(ctx.getDelimiters()));
        ctx.setCommentValidation(commentValidator.validate(ctx.getDelimiters()));
    }

    void buildElements(MarkupPipelineContext ctx) {
        ctx.setElements(elementBuilder.build(ctx.getDelimiters(), ctx.getDocument()));
        ctx.setSequenceValidation(sequenceValidator.validate(ctx.getElements()));
    }

    /**
     * Stop between stages when the calling thread has been interrupted.
     */
    private static void checkpoint(String completedStage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Markup analysis cancelled after " + completedStage + " stage");
        }
    }
}
