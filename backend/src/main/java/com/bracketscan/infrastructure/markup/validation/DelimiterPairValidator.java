package com.bracketscan.infrastructure.markup.validation;

import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.ValidationReport;
import com.bracketscan.domain.markup.model.ValidatorType;
import com.bracketscan.infrastructure.markup.pairing.LifoPairMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pairs every {@code <} with a {@code >} in ordinal order, whatever their classification.
 */
@Slf4j
@Component
public class DelimiterPairValidator {

    public ValidationReport validate(List<DelimiterContext> delimiters) {
        ValidationReport report = PairingReports.fromMatch(
                ValidatorType.DELIMITER, LifoPairMatcher.byGlyph().match(delimiters), false);

        if (!report.passed()) {
            log.info("Delimiter validation FAILED: {} pairs, {} orphans, score={}",
                    report.matchedPairs(), report.orphans().size(), report.consistencyScore());
        }
        return report;
    }
}
