package com.bracketscan.infrastructure.markup.reconstruction;

import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.Element;
import com.bracketscan.domain.markup.model.ReconstructionResult;
import com.bracketscan.infrastructure.markup.element.ElementBuilder;
import com.bracketscan.infrastructure.markup.element.TagVocabulary;
import com.bracketscan.infrastructure.markup.pairing.LifoPairMatcher;
import com.bracketscan.infrastructure.markup.scanning.DelimiterClassifier;
import com.bracketscan.infrastructure.markup.scanning.DelimiterScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentReconstructorTest {

    private DocumentReconstructor reconstructor;
    private DelimiterScanner scanner;
    private DelimiterClassifier classifier;
    private ElementBuilder builder;

    @BeforeEach
    void setUp() {
        reconstructor = new DocumentReconstructor();
        scanner = new DelimiterScanner();
        classifier = new DelimiterClassifier(5);
        builder = new ElementBuilder(TagVocabulary.standard());
    }

    private ReconstructionResult reconstruct(String document) {
        List<Element> elements = builder.build(classifier.classify(scanner.scan(document), document), document);
        return reconstructor.reconstruct(elements, document);
    }

    @Nested
    @DisplayName("Views")
    class Views {

        @Test
        @DisplayName("closing delimiter is part of every element slice")
        void closing_delimiter_kept() {
            ReconstructionResult result = reconstruct("x<a>y</a>z");

            assertThat(result.elementsOnly()).isEqualTo("<a></a>");
            assertThat(result.nonElementsOnly()).isEqualTo("xyz");
            assertThat(result.full()).isEqualTo("x<a>y</a>z");
            assertThat(result.roundTripExact()).isTrue();
        }

        @Test
        void empty_document() {
            ReconstructionResult result = reconstruct("");

            assertThat(result.full()).isEmpty();
            assertThat(result.elementsOnly()).isEmpty();
            assertThat(result.roundTripExact()).isTrue();
            assertThat(result.sourceUtf8Length()).isZero();
        }

        @Test
        void document_without_delimiters() {
            ReconstructionResult result = reconstruct("just text");

            assertThat(result.full()).isEqualTo("just text");
            assertThat(result.nonElementsOnly()).isEqualTo("just text");
            assertThat(result.elementsOnly()).isEmpty();
        }

        @Test
        @DisplayName("element nested in an earlier element is counted as overlapping")
        void overlapping_element() {
            ReconstructionResult result = reconstruct("<!-- a <!-- b --> c -->!");

            assertThat(result.overlappingElements()).isEqualTo(1);
            assertThat(result.full()).isEqualTo("<!-- a <!-- b --> c -->!");
            assertThat(result.nonElementsOnly()).isEqualTo("!");
        }

        @Test
        void utf8_lengths() {
            ReconstructionResult result = reconstruct("é<b>");

            assertThat(result.sourceUtf8Length()).isEqualTo(5);
            assertThat(result.reconstructedUtf8Length()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        private static final String ALPHABET = "<>!- abc/\n<>--";

        @Test
        @DisplayName("full view equals the source and matched delimiter pairs open before they close")
        void random_documents_round_trip() {
            Random random = new Random(42);
            for (int run = 0; run < 500; run++) {
                StringBuilder doc = new StringBuilder();
                int length = random.nextInt(80);
                for (int i = 0; i < length; i++) {
                    doc.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
                }
                String document = doc.toString();

                List<DelimiterContext> delimiters = classifier.classify(scanner.scan(document), document);
                for (LifoPairMatcher.Pair<DelimiterContext> pair : LifoPairMatcher.byGlyph().match(delimiters).pairs()) {
                    assertThat(pair.opener().ordinal()).as("document %s", document)
                            .isLessThan(pair.closer().ordinal());
                    assertThat(pair.opener().position()).isLessThan(pair.closer().position());
                }

                ReconstructionResult result = reconstruct(document);

                assertThat(result.full()).as("document %s", document).isEqualTo(document);
                assertThat(result.roundTripExact()).isTrue();
            }
        }

        @Test
        @DisplayName("elements-only view is the concatenation of inclusive slices, each ending with >")
        void element_slices_include_closing_delimiter() {
            Random random = new Random(7);
            for (int run = 0; run < 200; run++) {
                StringBuilder doc = new StringBuilder();
                int length = random.nextInt(60);
                for (int i = 0; i < length; i++) {
                    doc.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
                }
                String document = doc.toString();
                List<Element> elements = builder.build(
                        classifier.classify(scanner.scan(document), document), document);

                StringBuilder expected = new StringBuilder();
                for (Element element : elements) {
                    assertThat(document.charAt(element.closePosition())).isEqualTo('>');
                    expected.append(document, element.openPosition(), element.closePosition() + 1);
                }

                assertThat(reconstructor.reconstruct(elements, document).elementsOnly())
                        .as("document %s", document)
                        .isEqualTo(expected.toString())
                        .hasSize(elements.stream().mapToInt(Element::spanLength).sum());
            }
        }

        @Test
        void verified_reconstruction_passes_for_real_elements() {
            String document = "<html><!-- c --><p>text</p></html>";
            List<Element> elements = builder.build(classifier.classify(scanner.scan(document), document), document);

            assertThat(reconstructor.reconstructVerified(elements, document).full()).isEqualTo(document);
        }

        @Test
        @DisplayName("result whose full view differs from the source → mismatch with first differing position")
        void mismatch_is_rejected() {
            String document = "<a>b<c>";
            ReconstructionResult tampered = new ReconstructionResult(
                    "<a>x<c>", "<a><c>", "x", 0, 7, 7, false);

            assertThatThrownBy(() -> reconstructor.verify(tampered, document))
                    .isInstanceOf(ReconstructionMismatchException.class)
                    .hasMessageContaining("position 3")
                    .extracting(e -> ((ReconstructionMismatchException) e).getFirstDifference())
                    .isEqualTo(3);
        }

        @Test
        void exact_result_passes_verification() {
            ReconstructionResult result = reconstruct("<a>b");

            assertThat(reconstructor.verify(result, "<a>b")).isSameAs(result);
        }

        @Test
        void first_difference() {
            assertThat(DocumentReconstructor.firstDifference("abc", "abd")).isEqualTo(2);
            assertThat(DocumentReconstructor.firstDifference("abc", "ab")).isEqualTo(2);
            assertThat(DocumentReconstructor.firstDifference("abc", "abc")).isEqualTo(3);
        }
    }
}
