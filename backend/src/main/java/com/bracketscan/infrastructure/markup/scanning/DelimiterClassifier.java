package com.bracketscan.infrastructure.markup.scanning;

import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.DelimiterGlyph;
import com.bracketscan.domain.markup.model.DelimiterKind;
import com.bracketscan.domain.markup.model.DelimiterOccurrence;
import com.bracketscan.infrastructure.markup.pairing.LifoPairMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches context windows to delimiter occurrences and classifies them:
 * <ol>
 *   <li>local pass: comment-open, comment-close or regular, from (glyph, before, after) alone</li>
 *   <li>second pass: regular delimiters enclosed by a matched comment become inner-comment-content</li>
 * </ol>
 */
@Slf4j
@Component
public class DelimiterClassifier {

    static final String COMMENT_OPEN_TAIL = "!--";
    static final String COMMENT_CLOSE_HEAD = "--";

    private final int contextWindow;

    public DelimiterClassifier(@Value("${markup.context-window:5}") int contextWindow) {
        if (contextWindow < COMMENT_OPEN_TAIL.length()) {
            throw new IllegalArgumentException("markup.context-window is restricted to values of at least "
                    + COMMENT_OPEN_TAIL.length() + ", the length of the \"!--\" comment marker; got " + contextWindow);
        }
        this.contextWindow = contextWindow;
    }

    public int contextWindow() {
        return contextWindow;
    }

    /**
     * Classify a delimiter from its local context only.
     */
    public static DelimiterKind classify(DelimiterGlyph glyph, String before, String after) {
        if (glyph == DelimiterGlyph.OPEN && after.startsWith(COMMENT_OPEN_TAIL)) {
            return DelimiterKind.COMMENT_OPEN;
        }
        if (glyph == DelimiterGlyph.CLOSE && before.endsWith(COMMENT_CLOSE_HEAD)) {
            return DelimiterKind.COMMENT_CLOSE;
        }
        return DelimiterKind.REGULAR;
    }

    /**
     * Build classified contexts for all occurrences of a document.
     *
     * @param occurrences scanner output for {@code document}
     * @param document    the scanned document
     * @return one context per occurrence, same order
     */
    public List<DelimiterContext> classify(List<DelimiterOccurrence> occurrences, String document) {
        if (occurrences.isEmpty()) {
            return List.of();
        }

        List<DelimiterContext> contexts = new ArrayList<>(occurrences.size());
        for (DelimiterOccurrence occurrence : occurrences) {
            String before = before(document, occurrence.position());
            String after = after(document, occurrence.position());
            contexts.add(new DelimiterContext(
                    occurrence.ordinal(),
                    occurrence.position(),
                    occurrence.glyph(),
                    before,
                    after,
                    classify(occurrence.glyph(), before, after)));
        }

        return markInnerCommentContent(contexts);
    }

    /**
     * Reclassify regular delimiters between each matched comment-open / comment-close pair.
     * The list is indexed by ordinal.
     */
    List<DelimiterContext> markInnerCommentContent(List<DelimiterContext> contexts) {
        List<DelimiterContext> result = new ArrayList<>(contexts);
        LifoPairMatcher.Result<DelimiterContext> comments = LifoPairMatcher.byCommentKind().match(contexts);

        int reclassified = 0;
        for (LifoPairMatcher.Pair<DelimiterContext> pair : comments.pairs()) {
            for (int i = pair.opener().ordinal() + 1; i < pair.closer().ordinal(); i++) {
                DelimiterContext inner = result.get(i);
                if (inner.kind() == DelimiterKind.REGULAR) {
                    result.set(i, inner.withKind(DelimiterKind.INNER_COMMENT_CONTENT));
                    reclassified++;
                }
            }
        }

        if (!comments.nestedOpeners().isEmpty()) {
            log.warn("[Classifier] {} comment opening(s) found inside an unclosed comment",
                    comments.nestedOpeners().size());
        }
        log.debug("[Classifier] {} comment pair(s), {} delimiter(s) marked as inner comment content",
                comments.pairs().size(), reclassified);

        return result;
    }

    String before(String document, int position) {
        return document.substring(Math.max(0, position - contextWindow), position);
    }

    String after(String document, int position) {
        int start = Math.min(document.length(), position + 1);
        return document.substring(start, Math.min(document.length(), start + contextWindow));
    }
}
