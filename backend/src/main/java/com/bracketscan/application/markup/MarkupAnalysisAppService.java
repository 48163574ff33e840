package com.bracketscan.application.markup;

import com.bracketscan.application.markup.exception.DocumentReadException;
import com.bracketscan.application.markup.exception.DocumentTooLargeException;
import com.bracketscan.domain.markup.model.DocumentAnalysis;
import com.bracketscan.domain.markup.service.MarkupAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarkupAnalysisAppService {

    private final MarkupAnalysisService markupAnalysisService;

    @Value("${markup.max-document-length:5000000}")
    private int maxDocumentLength;

    /**
     * Analyze one in-memory document.
     */
    public DocumentAnalysis analyze(String documentName, String content) {
        validateDocumentLength(documentName, content);
        return markupAnalysisService.analyze(documentName, content);
    }

    /**
     * Read a UTF-8 file and analyze it under its file name.
     */
    public DocumentAnalysis analyzeFile(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentReadException("Cannot read document " + path, e);
        }
        Path fileName = path.getFileName();
        return analyze(fileName != null ? fileName.toString() : path.toString(), content);
    }

    /**
     * Analyze independent documents in parallel, one pipeline run per document.
     * A failing document is reported in its entry and does not affect the others.
     */
    public List<BatchEntry> analyzeBatch(List<DocumentInput> documents) {
        long totalStart = System.currentTimeMillis();

        List<CompletableFuture<BatchEntry>> futures = documents.stream()
                .map(doc -> CompletableFuture.supplyAsync(() -> runOne(doc)))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<BatchEntry> entries = futures.stream().map(CompletableFuture::join).toList();
        long failed = entries.stream().filter(e -> !e.succeeded()).count();
        log.info("[Batch] {} document(s) analyzed, {} failed ({}ms)",
                entries.size(), failed, System.currentTimeMillis() - totalStart);
        return entries;
    }

    public void validateDocumentLength(String documentName, String content) {
        if (content != null && content.length() > maxDocumentLength) {
            throw new DocumentTooLargeException(String.format(
                    "Document %s has %d characters; the maximum is %d",
                    documentName, content.length(), maxDocumentLength));
        }
    }

    public int getMaxDocumentLength() {
        return maxDocumentLength;
    }

    private BatchEntry runOne(DocumentInput doc) {
        long start = System.currentTimeMillis();
        try {
            DocumentAnalysis analysis = analyze(doc.documentName(), doc.content());
            return new BatchEntry(doc.documentName(), analysis, System.currentTimeMillis() - start, null);
        } catch (RuntimeException e) {
            log.error("[Batch] Document {} failed", doc.documentName(), e);
            return new BatchEntry(doc.documentName(), null, System.currentTimeMillis() - start, e.getMessage());
        }
    }
}
