package com.bracketscan.domain.markup.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DelimiterKind {
    REGULAR("regular"),
    COMMENT_OPEN("comment-open"),
    COMMENT_CLOSE("comment-close"),
    INNER_COMMENT_CONTENT("inner-comment-content");

    private final String wireName;

    DelimiterKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isCommentMarker() {
        return this == COMMENT_OPEN || this == COMMENT_CLOSE;
    }
}
