package com.bracketscan.domain.markup.model;

/**
 * A matched comment-open / comment-close pair.
 *
 * @param openOrdinal   ordinal of the {@code <} that starts {@code <!--}
 * @param closeOrdinal  ordinal of the {@code >} that ends {@code -->}
 * @param openPosition  document position of the opening {@code <}
 * @param closePosition document position of the closing {@code >}
 * @param bodyText      text strictly between the {@code <!--} and {@code -->} markers
 */
public record CommentSpan(
        int openOrdinal,
        int closeOrdinal,
        int openPosition,
        int closePosition,
        String bodyText
) {}
