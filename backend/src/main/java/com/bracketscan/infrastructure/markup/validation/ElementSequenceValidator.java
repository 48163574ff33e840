package com.bracketscan.infrastructure.markup.validation;

import com.bracketscan.domain.markup.model.Element;
import com.bracketscan.domain.markup.model.ValidationIssue;
import com.bracketscan.domain.markup.model.ValidationReport;
import com.bracketscan.domain.markup.model.ValidatorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that each element's closing delimiter is immediately followed, in ordinal terms,
 * by the next element's opening delimiter. Only neighbours are compared.
 */
@Slf4j
@Component
public class ElementSequenceValidator {

    /**
     * @param elements chronological element sequence
     * @return report scored as matched adjacent pairs / (elements - 1), 1.0 below two elements
     */
    public ValidationReport validate(List<Element> elements) {
        List<ValidationIssue> issues = new ArrayList<>();
        int adjacentPairs = 0;

        for (int i = 0; i < elements.size() - 1; i++) {
            Element current = elements.get(i);
            Element next = elements.get(i + 1);

            int expectedNextOpen = current.closeOrdinal() + 1;
            int actualNextOpen = next.openOrdinal();

            if (expectedNextOpen != actualNextOpen) {
                issues.add(ValidationIssue.sequenceMismatch(i, expectedNextOpen, actualNextOpen));
                continue;
            }

            adjacentPairs++;
            int gapStart = current.closePosition() + 1;
            if (gapStart < next.openPosition()) {
                issues.add(ValidationIssue.textGap(i, gapStart, next.openPosition() - gapStart));
            }
        }

        int comparisons = elements.size() - 1;
        double score = comparisons > 0 ? (double) adjacentPairs / comparisons : 1.0;
        ValidationReport report = ValidationReport.of(
                ValidatorType.ELEMENT_SEQUENCE, elements.size(), adjacentPairs, issues, score);

        if (!report.passed()) {
            log.info("Element sequence validation FAILED: {}/{} adjacent pairs",
                    adjacentPairs, comparisons);
        }
        return report;
    }
}
