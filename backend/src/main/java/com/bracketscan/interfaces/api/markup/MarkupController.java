package com.bracketscan.interfaces.api.markup;

import com.bracketscan.application.markup.BatchEntry;
import com.bracketscan.application.markup.DocumentInput;
import com.bracketscan.application.markup.MarkupAnalysisAppService;
import com.bracketscan.domain.markup.model.DocumentAnalysis;
import com.bracketscan.domain.markup.model.UnifiedReport;
import com.bracketscan.interfaces.api.dto.AnalyzeRequest;
import com.bracketscan.interfaces.api.dto.AnalyzeResponse;
import com.bracketscan.interfaces.api.dto.BatchAnalyzeRequest;
import com.bracketscan.interfaces.api.dto.BatchAnalyzeResponse;
import com.bracketscan.interfaces.api.dto.DocumentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/markup")
@RequiredArgsConstructor
public class MarkupController {

    private final MarkupAnalysisAppService markupAnalysisAppService;

    @PostMapping("/analyze")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        DocumentAnalysis analysis = markupAnalysisAppService.analyze(request.documentName(), request.content());
        return ResponseEntity.ok(AnalyzeResponse.from(analysis, request.viewsRequested()));
    }

    @PostMapping("/validate")
    public ResponseEntity<UnifiedReport> validate(@Valid @RequestBody DocumentRequest request) {
        DocumentAnalysis analysis = markupAnalysisAppService.analyze(request.documentName(), request.content());
        return ResponseEntity.ok(analysis.report());
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchAnalyzeResponse> batch(@Valid @RequestBody BatchAnalyzeRequest request) {
        List<DocumentInput> inputs = request.documents().stream()
                .map(doc -> new DocumentInput(doc.documentName(), doc.content()))
                .toList();

        List<BatchAnalyzeResponse.Entry> entries = markupAnalysisAppService.analyzeBatch(inputs).stream()
                .map(MarkupController::toEntry)
                .toList();

        int succeeded = (int) entries.stream().filter(e -> e.error() == null).count();
        return ResponseEntity.ok(new BatchAnalyzeResponse(entries, succeeded, entries.size() - succeeded));
    }

    private static BatchAnalyzeResponse.Entry toEntry(BatchEntry entry) {
        if (!entry.succeeded()) {
            return new BatchAnalyzeResponse.Entry(
                    entry.documentName(), null, null, null, entry.durationMs(), entry.error());
        }
        DocumentAnalysis analysis = entry.analysis();
        return new BatchAnalyzeResponse.Entry(
                entry.documentName(),
                analysis.report().status(),
                analysis.report().score(),
                analysis.elements().size(),
                entry.durationMs(),
                null);
    }
}
