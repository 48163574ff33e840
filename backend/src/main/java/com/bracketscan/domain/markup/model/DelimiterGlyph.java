package com.bracketscan.domain.markup.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DelimiterGlyph {
    OPEN('<'),
    CLOSE('>');

    private final char symbol;

    DelimiterGlyph(char symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public char symbol() {
        return symbol;
    }

    /**
     * @return the glyph for {@code c}, or {@code null} when {@code c} is not a delimiter
     */
    public static DelimiterGlyph of(char c) {
        return switch (c) {
            case '<' -> OPEN;
            case '>' -> CLOSE;
            default -> null;
        };
    }
}
