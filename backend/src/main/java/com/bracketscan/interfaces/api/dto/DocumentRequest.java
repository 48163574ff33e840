package com.bracketscan.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record DocumentRequest(
        @Size(max = 255, message = "Document name must not exceed 255 characters")
        String documentName,

        @NotNull(message = "Content is required")
        String content
) {}
