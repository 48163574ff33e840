package com.bracketscan.interfaces.api.dto;

import com.bracketscan.domain.markup.model.ValidationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record BatchAnalyzeResponse(
        List<Entry> documents,
        int succeeded,
        int failed
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            String documentName,
            ValidationStatus status,
            Double score,
            Integer elementCount,
            long durationMs,
            String error
    ) {}
}
