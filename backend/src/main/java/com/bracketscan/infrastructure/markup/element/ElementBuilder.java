package com.bracketscan.infrastructure.markup.element;

import com.bracketscan.domain.markup.model.CommentSpan;
import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.DelimiterKind;
import com.bracketscan.domain.markup.model.Element;
import com.bracketscan.domain.markup.model.ElementKind;
import com.bracketscan.infrastructure.markup.pairing.LifoPairMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the chronological element sequence of a document:
 * <p>
 * comment elements (matched comment markers) + tag-like elements (adjacent regular {@code <}/{@code >}) → sort by open position
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ElementBuilder {

    private static final int COMMENT_OPEN_LENGTH = "<!--".length();
    private static final int COMMENT_CLOSE_HEAD_LENGTH = "--".length();
    private static final String DOCTYPE_NAME = "!doctype";

    private final TagVocabulary vocabulary;

    /**
     * @param delimiters classified delimiters of {@code document}
     * @param document   the source document
     * @return all elements sorted ascending by open position
     */
    public List<Element> build(List<DelimiterContext> delimiters, String document) {
        List<Element> elements = new ArrayList<>();

        for (CommentSpan span : collectCommentSpans(delimiters, document)) {
            elements.add(Element.comment(span, document.substring(span.openPosition() + 1, span.closePosition())));
        }
        int commentCount = elements.size();

        elements.addAll(buildTagElements(delimiters, document));

        elements.sort(Comparator.comparingInt(Element::openPosition)
                .thenComparingInt(Element::closePosition));

        log.debug("[ElementBuilder] {} comment element(s), {} tag-like element(s)",
                commentCount, elements.size() - commentCount);
        return elements;
    }

    /**
     * Match comment markers LIFO and extract the text between {@code <!--} and {@code -->}.
     */
    public List<CommentSpan> collectCommentSpans(List<DelimiterContext> delimiters, String document) {
        List<CommentSpan> spans = new ArrayList<>();
        for (LifoPairMatcher.Pair<DelimiterContext> pair : LifoPairMatcher.byCommentKind().match(delimiters).pairs()) {
            int openPos = pair.opener().position();
            int closePos = pair.closer().position();
            spans.add(new CommentSpan(
                    pair.opener().ordinal(),
                    pair.closer().ordinal(),
                    openPos,
                    closePos,
                    commentText(document, openPos, closePos)));
        }
        spans.sort(Comparator.comparingInt(CommentSpan::openOrdinal));
        return spans;
    }

    /**
     * Pair each regular {@code <} with the regular {@code >} right after it; any other
     * regular delimiter is skipped on its own.
     */
    List<Element> buildTagElements(List<DelimiterContext> delimiters, String document) {
        List<DelimiterContext> regular = delimiters.stream()
                .filter(d -> d.kind() == DelimiterKind.REGULAR)
                .toList();

        List<Element> elements = new ArrayList<>();
        int i = 0;
        while (i < regular.size() - 1) {
            DelimiterContext open = regular.get(i);
            DelimiterContext close = regular.get(i + 1);

            if (open.isOpening() && close.isClosing()) {
                elements.add(tagElement(open, close, document));
                i += 2;
            } else {
                i++;
            }
        }
        return elements;
    }

    private Element tagElement(DelimiterContext open, DelimiterContext close, String document) {
        String body = document.substring(open.position() + 1, close.position());
        TagNameExtractor.TagName tagName = TagNameExtractor.extract(body);

        String name = tagName != null ? tagName.name() : null;
        boolean closing = tagName != null && tagName.closing();

        return new Element(
                open.ordinal(),
                close.ordinal(),
                open.position(),
                close.position(),
                kindOf(tagName),
                name,
                body,
                null,
                closing);
    }

    /**
     * Unnamed without a name or for the doctype declaration; other names, declarations
     * included, are looked up in the vocabulary.
     */
    ElementKind kindOf(TagNameExtractor.TagName tagName) {
        if (tagName == null || DOCTYPE_NAME.equals(tagName.name())) {
            return ElementKind.UNNAMED;
        }
        return vocabulary.isKnown(tagName.name()) ? ElementKind.STANDARD_NAMED : ElementKind.CUSTOM;
    }

    static String commentText(String document, int openPos, int closePos) {
        int start = openPos + COMMENT_OPEN_LENGTH;
        int end = closePos - COMMENT_CLOSE_HEAD_LENGTH;
        if (start >= end) {
            return "";
        }
        return document.substring(start, end).strip();
    }
}
