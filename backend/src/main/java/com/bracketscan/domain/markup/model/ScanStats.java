package com.bracketscan.domain.markup.model;

public record ScanStats(
        int totalDelimiters,
        int openingDelimiters,
        int closingDelimiters,
        int commentDelimiters,
        int innerCommentDelimiters,
        int totalElements,
        int commentElements,
        int standardNamedElements,
        int customElements,
        int unnamedElements
) {}
