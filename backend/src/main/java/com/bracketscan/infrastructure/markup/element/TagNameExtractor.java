package com.bracketscan.infrastructure.markup.element;

import java.util.Locale;

/**
 * Extracts the leading name of a tag body ({@code "div class=x"} → {@code div}).
 * <p>
 * A name is an optional {@code !} (declaration) or {@code /} (closing tag) followed by a
 * letter or digit, then letters, digits, {@code -}, {@code _}, {@code :} or {@code .}.
 * Names are lower-cased; the closing {@code /} is dropped, the declaration {@code !} kept.
 */
public final class TagNameExtractor {

    private TagNameExtractor() {
    }

    /**
     * @param name        extracted name, e.g. {@code div}, {@code !doctype}, {@code my-widget}
     * @param closing     body started with {@code /}
     * @param declaration body started with {@code !}
     */
    public record TagName(String name, boolean closing, boolean declaration) {}

    /**
     * @param body text strictly inside {@code <} and {@code >}
     * @return the name, or null if the body does not start with one
     */
    public static TagName extract(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }

        char first = body.charAt(0);
        boolean closing = first == '/';
        boolean declaration = first == '!';
        int start = closing || declaration ? 1 : 0;

        if (start >= body.length() || !Character.isLetterOrDigit(body.charAt(start))) {
            return null;
        }

        int end = start + 1;
        while (end < body.length() && isNameChar(body.charAt(end))) {
            end++;
        }

        String run = body.substring(start, end).toLowerCase(Locale.ROOT);
        return new TagName(declaration ? "!" + run : run, closing, declaration);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == ':' || c == '.';
    }
}
