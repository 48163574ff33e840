package com.bracketscan.domain.markup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Individual structural finding of a validator.
 *
 * @param type         the type of validation issue
 * @param severity     ERROR counts as an orphan/mismatch and fails the validator, WARNING is reported only
 * @param message      human-readable description of the issue
 * @param ordinal      ordinal of the offending delimiter (nullable)
 * @param position     document position of the offending delimiter or gap start (nullable)
 * @param pairIndex    index {@code i} of the element pair {@code (i, i+1)} (nullable)
 * @param gapOrOverlap {@code actualNextOpen - expectedNextOpen} for sequence issues, gap length for text gaps (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
        ValidationIssueType type,
        Severity severity,
        String message,
        Integer ordinal,
        Integer position,
        Integer pairIndex,
        Integer gapOrOverlap
) {
    public enum Severity {
        ERROR,
        WARNING
    }

    public static ValidationIssue orphanedOpener(int ordinal, int position) {
        return new ValidationIssue(ValidationIssueType.ORPHANED_OPENER, Severity.ERROR,
                "Opening delimiter #" + ordinal + " at position " + position + " is never closed",
                ordinal, position, null, null);
    }

    public static ValidationIssue orphanedCloser(int ordinal, int position) {
        return new ValidationIssue(ValidationIssueType.ORPHANED_CLOSER, Severity.ERROR,
                "Closing delimiter #" + ordinal + " at position " + position + " has no opener",
                ordinal, position, null, null);
    }

    public static ValidationIssue nestedCommentOpening(int ordinal, int position) {
        return new ValidationIssue(ValidationIssueType.NESTED_COMMENT_OPENING, Severity.WARNING,
                "Comment opened at position " + position + " while another comment is still open",
                ordinal, position, null, null);
    }

    public static ValidationIssue sequenceMismatch(int pairIndex, int expectedNextOpen, int actualNextOpen) {
        int delta = actualNextOpen - expectedNextOpen;
        ValidationIssueType type = delta > 0 ? ValidationIssueType.SEQUENCE_GAP : ValidationIssueType.SEQUENCE_OVERLAP;
        return new ValidationIssue(type, Severity.ERROR,
                "Element " + (pairIndex + 1) + " opens at delimiter #" + actualNextOpen
                        + ", expected #" + expectedNextOpen,
                actualNextOpen, null, pairIndex, delta);
    }

    public static ValidationIssue textGap(int pairIndex, int gapStart, int gapLength) {
        return new ValidationIssue(ValidationIssueType.TEXT_GAP, Severity.WARNING,
                gapLength + " character(s) of text between elements " + pairIndex + " and " + (pairIndex + 1),
                null, gapStart, pairIndex, gapLength);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
