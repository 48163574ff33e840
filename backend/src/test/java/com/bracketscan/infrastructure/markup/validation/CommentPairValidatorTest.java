package com.bracketscan.infrastructure.markup.validation;

import com.bracketscan.domain.markup.model.ValidationIssueType;
import com.bracketscan.domain.markup.model.ValidationReport;
import com.bracketscan.domain.markup.model.ValidationStatus;
import com.bracketscan.infrastructure.markup.scanning.DelimiterClassifier;
import com.bracketscan.infrastructure.markup.scanning.DelimiterScanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommentPairValidatorTest {

    private final DelimiterScanner scanner = new DelimiterScanner();
    private final DelimiterClassifier classifier = new DelimiterClassifier(5);
    private final CommentPairValidator validator = new CommentPairValidator();

    private ValidationReport validate(String document) {
        return validator.validate(classifier.classify(scanner.scan(document), document));
    }

    @Test
    @DisplayName("well-formed comments → score 1.0, PASSED")
    void well_formed_comments() {
        ValidationReport report = validate("<!-- one --><p><!-- two --></p>");

        assertThat(report.matchedPairs()).isEqualTo(2);
        assertThat(report.totalItems()).isEqualTo(4);
        assertThat(report.consistencyScore()).isEqualTo(1.0);
        assertThat(report.status()).isEqualTo(ValidationStatus.PASSED);
    }

    @Test
    void regular_delimiters_are_ignored() {
        ValidationReport report = validate("<!-- a --><b><<>>");

        assertThat(report.totalItems()).isEqualTo(2);
        assertThat(report.passed()).isTrue();
    }

    @Test
    void unclosed_comment_is_an_orphan() {
        ValidationReport report = validate("<p><!-- never closed");

        assertThat(report.orphans()).extracting(i -> i.type())
                .containsExactly(ValidationIssueType.ORPHANED_OPENER);
        assertThat(report.status()).isEqualTo(ValidationStatus.FAILED);
    }

    @Test
    void stray_comment_close_is_an_orphan() {
        ValidationReport report = validate("text --> more");

        assertThat(report.orphans()).extracting(i -> i.type())
                .containsExactly(ValidationIssueType.ORPHANED_CLOSER);
    }

    @Test
    @DisplayName("nested comment opening → warning, outer pair matched LIFO")
    void nested_comment_opening() {
        ValidationReport report = validate("<!-- a <!-- b --> c -->");

        assertThat(report.matchedPairs()).isEqualTo(2);
        assertThat(report.orphans()).isEmpty();
        assertThat(report.warnings()).extracting(i -> i.type())
                .containsExactly(ValidationIssueType.NESTED_COMMENT_OPENING);
        assertThat(report.passed()).isTrue();
    }

    @Test
    @DisplayName("document without comments → score 0.0")
    void no_comments() {
        ValidationReport report = validate("<div></div>");

        assertThat(report.totalItems()).isZero();
        assertThat(report.consistencyScore()).isZero();
        assertThat(report.passed()).isFalse();
    }
}
