package com.bracketscan.infrastructure.markup.validation;

import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.ValidationIssue;
import com.bracketscan.domain.markup.model.ValidationReport;
import com.bracketscan.domain.markup.model.ValidatorType;
import com.bracketscan.infrastructure.markup.pairing.LifoPairMatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a LIFO match over delimiters into a {@link ValidationReport}.
 */
final class PairingReports {

    private PairingReports() {
    }

    /**
     * Score is {@code 2 * pairs / items}, 0.0 when nothing was matched against.
     */
    static ValidationReport fromMatch(ValidatorType validator,
                                      LifoPairMatcher.Result<DelimiterContext> match,
                                      boolean reportNestedOpeners) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (DelimiterContext opener : match.unmatchedOpeners()) {
            issues.add(ValidationIssue.orphanedOpener(opener.ordinal(), opener.position()));
        }
        for (DelimiterContext closer : match.unmatchedClosers()) {
            issues.add(ValidationIssue.orphanedCloser(closer.ordinal(), closer.position()));
        }
        if (reportNestedOpeners) {
            for (DelimiterContext nested : match.nestedOpeners()) {
                issues.add(ValidationIssue.nestedCommentOpening(nested.ordinal(), nested.position()));
            }
        }

        int totalItems = match.openerCount() + match.closerCount();
        int matchedPairs = match.pairs().size();
        double score = totalItems > 0 ? (matchedPairs * 2.0) / totalItems : 0.0;

        return ValidationReport.of(validator, totalItems, matchedPairs, issues, score);
    }
}
