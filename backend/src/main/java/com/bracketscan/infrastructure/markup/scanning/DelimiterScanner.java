package com.bracketscan.infrastructure.markup.scanning;

import com.bracketscan.domain.markup.model.DelimiterGlyph;
import com.bracketscan.domain.markup.model.DelimiterOccurrence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every {@code <} and {@code >} in a document in a single linear pass.
 * The ordinal of each occurrence is its index in the returned list.
 */
@Component
public class DelimiterScanner {

    /**
     * @param document the document text; null or empty yields an empty list
     * @return occurrences in document order
     */
    public List<DelimiterOccurrence> scan(String document) {
        if (document == null || document.isEmpty()) {
            return List.of();
        }

        List<DelimiterOccurrence> occurrences = new ArrayList<>();
        for (int pos = 0; pos < document.length(); pos++) {
            DelimiterGlyph glyph = DelimiterGlyph.of(document.charAt(pos));
            if (glyph != null) {
                occurrences.add(new DelimiterOccurrence(occurrences.size(), pos, glyph));
            }
        }
        return occurrences;
    }
}
