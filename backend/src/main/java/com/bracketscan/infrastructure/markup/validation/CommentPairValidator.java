package com.bracketscan.infrastructure.markup.validation;

import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.ValidationReport;
import com.bracketscan.domain.markup.model.ValidatorType;
import com.bracketscan.infrastructure.markup.pairing.LifoPairMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pairs comment-open with comment-close delimiters. A comment opened inside another
 * unclosed comment is reported as a warning.
 */
@Slf4j
@Component
public class CommentPairValidator {

    public ValidationReport validate(List<DelimiterContext> delimiters) {
        ValidationReport report = PairingReports.fromMatch(
                ValidatorType.COMMENT, LifoPairMatcher.byCommentKind().match(delimiters), true);

        if (!report.issues().isEmpty()) {
            log.info("Comment validation {}: {} pairs, {} orphans, {} warnings",
                    report.status(), report.matchedPairs(), report.orphans().size(), report.warnings().size());
        }
        return report;
    }
}
