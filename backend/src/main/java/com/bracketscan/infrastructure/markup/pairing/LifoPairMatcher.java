package com.bracketscan.infrastructure.markup.pairing;

import com.bracketscan.domain.markup.model.DelimiterContext;
import com.bracketscan.domain.markup.model.DelimiterKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Stack-based matcher pairing each closer with the most recent unmatched opener.
 * Items that are neither openers nor closers are ignored.
 *
 * @param <T> item type
 */
public final class LifoPairMatcher<T> {

    private final Predicate<? super T> isOpener;
    private final Predicate<? super T> isCloser;

    public LifoPairMatcher(Predicate<? super T> isOpener, Predicate<? super T> isCloser) {
        this.isOpener = isOpener;
        this.isCloser = isCloser;
    }

    /**
     * Pairs {@code <} with {@code >} regardless of classification.
     */
    public static LifoPairMatcher<DelimiterContext> byGlyph() {
        return new LifoPairMatcher<>(DelimiterContext::isOpening, DelimiterContext::isClosing);
    }

    /**
     * Pairs comment-open with comment-close delimiters only.
     */
    public static LifoPairMatcher<DelimiterContext> byCommentKind() {
        return new LifoPairMatcher<>(
                c -> c.kind() == DelimiterKind.COMMENT_OPEN,
                c -> c.kind() == DelimiterKind.COMMENT_CLOSE);
    }

    /**
     * @param items items in order
     * @return pairs in closing order plus everything left unmatched
     */
    public Result<T> match(List<T> items) {
        Deque<T> stack = new ArrayDeque<>();
        List<Pair<T>> pairs = new ArrayList<>();
        List<T> unmatchedClosers = new ArrayList<>();
        List<T> nestedOpeners = new ArrayList<>();

        for (T item : items) {
            if (isOpener.test(item)) {
                if (!stack.isEmpty()) {
                    nestedOpeners.add(item);
                }
                stack.push(item);
            } else if (isCloser.test(item)) {
                if (stack.isEmpty()) {
                    unmatchedClosers.add(item);
                } else {
                    pairs.add(new Pair<>(stack.pop(), item));
                }
            }
        }

        // Stack iterates top-first; report leftovers in document order
        List<T> unmatchedOpeners = new ArrayList<>(stack);
        Collections.reverse(unmatchedOpeners);

        return new Result<>(pairs, unmatchedOpeners, unmatchedClosers, nestedOpeners);
    }

    public record Pair<T>(T opener, T closer) {}

    /**
     * @param pairs            matched pairs, in the order their closer was seen
     * @param unmatchedOpeners openers still on the stack at the end, in document order
     * @param unmatchedClosers closers that arrived with an empty stack
     * @param nestedOpeners    openers pushed while another opener was pending
     */
    public record Result<T>(
            List<Pair<T>> pairs,
            List<T> unmatchedOpeners,
            List<T> unmatchedClosers,
            List<T> nestedOpeners
    ) {
        public int openerCount() {
            return pairs.size() + unmatchedOpeners.size();
        }

        public int closerCount() {
            return pairs.size() + unmatchedClosers.size();
        }
    }
}
