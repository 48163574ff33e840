package com.bracketscan.domain.markup.model;

/**
 * A single {@code <} or {@code >} found in a document.
 *
 * @param ordinal  0-based index of this occurrence in scan order (dense, never reused)
 * @param position 0-based character index into the document
 * @param glyph    which delimiter was found
 */
public record DelimiterOccurrence(
        int ordinal,
        int position,
        DelimiterGlyph glyph
) {}
