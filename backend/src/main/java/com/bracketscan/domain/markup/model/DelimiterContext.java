package com.bracketscan.domain.markup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A delimiter occurrence enriched with its surrounding text and classification.
 *
 * @param ordinal  ordinal of the underlying occurrence
 * @param position position of the underlying occurrence
 * @param glyph    the delimiter
 * @param before   up to K characters preceding the delimiter, clipped at document start
 * @param after    up to K characters following the delimiter, clipped at document end
 * @param kind     classification of this delimiter
 */
public record DelimiterContext(
        int ordinal,
        int position,
        DelimiterGlyph glyph,
        String before,
        String after,
        DelimiterKind kind
) {
    public DelimiterContext withKind(DelimiterKind newKind) {
        return new DelimiterContext(ordinal, position, glyph, before, after, newKind);
    }

    public String fullContext() {
        return before + glyph.symbol() + after;
    }

    @JsonIgnore
    public boolean isOpening() {
        return glyph == DelimiterGlyph.OPEN;
    }

    @JsonIgnore
    public boolean isClosing() {
        return glyph == DelimiterGlyph.CLOSE;
    }
}
