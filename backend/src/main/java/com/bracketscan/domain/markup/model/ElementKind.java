package com.bracketscan.domain.markup.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ElementKind {
    STANDARD_NAMED("standard_named"),
    CUSTOM("custom"),
    UNNAMED("unnamed");

    private final String wireName;

    ElementKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
