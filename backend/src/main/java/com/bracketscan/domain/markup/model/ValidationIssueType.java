package com.bracketscan.domain.markup.model;

public enum ValidationIssueType {
    ORPHANED_OPENER,
    ORPHANED_CLOSER,
    NESTED_COMMENT_OPENING,
    SEQUENCE_GAP,
    SEQUENCE_OVERLAP,
    TEXT_GAP
}
