package com.bracketscan.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BatchAnalyzeRequest(
        @NotEmpty(message = "At least one document is required")
        @Size(max = 100, message = "A batch must not exceed 100 documents")
        List<@Valid DocumentRequest> documents
) {}
