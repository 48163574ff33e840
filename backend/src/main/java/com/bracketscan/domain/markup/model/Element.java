package com.bracketscan.domain.markup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A delimiter-bounded span: either a tag-like element or a comment.
 *
 * @param openOrdinal   ordinal of the opening {@code <}
 * @param closeOrdinal  ordinal of the closing {@code >}
 * @param openPosition  document position of the opening {@code <}
 * @param closePosition document position of the closing {@code >} (inclusive end of the span)
 * @param kind          standard_named, custom or unnamed
 * @param name          lower-cased tag name, {@code "comment"} for comments, null when none could be extracted
 * @param body          text strictly inside the two delimiters
 * @param innerText     trimmed comment text between {@code <!--} and {@code -->}; null for tag-like elements
 * @param closingTag    true for the {@code </name>} form
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Element(
        int openOrdinal,
        int closeOrdinal,
        int openPosition,
        int closePosition,
        ElementKind kind,
        String name,
        String body,
        String innerText,
        boolean closingTag
) {
    public static final String COMMENT_NAME = "comment";

    public static Element comment(CommentSpan span, String body) {
        return new Element(span.openOrdinal(), span.closeOrdinal(),
                span.openPosition(), span.closePosition(),
                ElementKind.UNNAMED, COMMENT_NAME, body, span.bodyText(), false);
    }

    @JsonIgnore
    public boolean isComment() {
        return innerText != null;
    }

    /**
     * @return length of the span including both delimiters
     */
    @JsonIgnore
    public int spanLength() {
        return closePosition - openPosition + 1;
    }
}
