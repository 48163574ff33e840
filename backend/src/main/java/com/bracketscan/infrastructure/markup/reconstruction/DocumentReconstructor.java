package com.bracketscan.infrastructure.markup.reconstruction;

import com.bracketscan.domain.markup.model.Element;
import com.bracketscan.domain.markup.model.ReconstructionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Replays a chronological element sequence against its source document.
 * <p>
 * Each element is sliced as {@code [openPosition, closePosition + 1)} so the closing
 * delimiter is kept; dropping the {@code + 1} loses every {@code >} from the output.
 */
@Slf4j
@Component
public class DocumentReconstructor {

    /**
     * Build the full, elements-only and non-elements-only views.
     *
     * @param elements elements sorted by open position
     * @param document the source document
     * @return the three views plus length bookkeeping
     */
    public ReconstructionResult reconstruct(List<Element> elements, String document) {
        StringBuilder full = new StringBuilder(document.length());
        StringBuilder elementsOnly = new StringBuilder();
        StringBuilder nonElementsOnly = new StringBuilder();
        int cursor = 0;
        int overlapping = 0;

        for (Element element : elements) {
            int sliceEnd = element.closePosition() + 1;
            String elementText = document.substring(element.openPosition(), sliceEnd);
            elementsOnly.append(elementText);

            if (element.openPosition() < cursor) {
                // Starts inside an earlier element; only the uncovered suffix is new text
                overlapping++;
                if (sliceEnd > cursor) {
                    full.append(document, cursor, sliceEnd);
                    cursor = sliceEnd;
                }
                continue;
            }

            String before = document.substring(cursor, element.openPosition());
            full.append(before).append(elementText);
            nonElementsOnly.append(before);
            cursor = sliceEnd;
        }

        // Text after the last element
        String trailing = document.substring(cursor);
        full.append(trailing);
        nonElementsOnly.append(trailing);

        String fullText = full.toString();
        if (overlapping > 0) {
            log.warn("[Reconstruction] {} element(s) overlap an earlier element", overlapping);
        }

        return new ReconstructionResult(
                fullText,
                elementsOnly.toString(),
                nonElementsOnly.toString(),
                overlapping,
                utf8Length(document),
                utf8Length(fullText),
                fullText.equals(document));
    }

    /**
     * Reconstruct and fail hard if the full view does not equal the document.
     * The cursor walk keeps {@code full} equal to the consumed document prefix, so a
     * mismatch here means {@link #reconstruct} itself was broken.
     *
     * @throws ReconstructionMismatchException if the round trip is not exact
     */
    public ReconstructionResult reconstructVerified(List<Element> elements, String document) {
        return verify(reconstruct(elements, document), document);
    }

    ReconstructionResult verify(ReconstructionResult result, String document) {
        if (!result.roundTripExact()) {
            int diff = firstDifference(document, result.full());
            log.error("[Reconstruction] Round trip mismatch: source={} bytes, rebuilt={} bytes, first difference at {}",
                    result.sourceUtf8Length(), result.reconstructedUtf8Length(), diff);
            throw new ReconstructionMismatchException(
                    "Reconstructed document differs from source at position " + diff, diff);
        }
        return result;
    }

    static int firstDifference(String expected, String actual) {
        int limit = Math.min(expected.length(), actual.length());
        for (int i = 0; i < limit; i++) {
            if (expected.charAt(i) != actual.charAt(i)) {
                return i;
            }
        }
        return limit;
    }

    private static long utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
