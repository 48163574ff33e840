package com.bracketscan.infrastructure.markup.element;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Known tag names. A tag-like element whose name is listed here is {@code standard_named};
 * any other extracted name is {@code custom}.
 */
@Slf4j
@Component
public class TagVocabulary {

    private static final List<String> STANDARD_TAGS = List.of(
            // document
            "html", "head", "body", "title", "meta", "link", "script", "style", "base", "noscript", "template",
            // sectioning
            "nav", "header", "footer", "main", "section", "article", "aside", "address", "hgroup",
            "h1", "h2", "h3", "h4", "h5", "h6",
            // grouping
            "div", "p", "hr", "pre", "blockquote", "ul", "ol", "li", "dl", "dt", "dd",
            "figure", "figcaption", "details", "summary", "dialog", "menu", "menuitem",
            // text-level
            "a", "span", "br", "wbr", "em", "strong", "b", "i", "u", "s", "mark", "small", "sub", "sup",
            "del", "ins", "cite", "q", "abbr", "acronym", "time", "data", "var", "samp", "kbd", "code",
            "dfn", "bdi", "bdo", "ruby", "rt", "rp",
            // tables
            "table", "caption", "colgroup", "col", "thead", "tbody", "tfoot", "tr", "td", "th",
            // forms
            "form", "label", "input", "button", "textarea", "select", "option", "optgroup", "datalist",
            "fieldset", "legend", "output", "progress", "meter", "keygen", "command",
            // embedded
            "img", "picture", "source", "track", "video", "audio", "iframe", "embed", "object", "param",
            "canvas", "map", "area", "slot",
            // svg
            "svg", "path", "circle", "rect", "ellipse", "line", "polyline", "polygon", "use", "g", "defs"
    );

    private final Set<String> tags;

    public TagVocabulary(@Value("${markup.vocabulary.extra-tags:}") String[] extraTags) {
        Set<String> all = new HashSet<>(STANDARD_TAGS);
        Arrays.stream(extraTags)
                .map(String::strip)
                .filter(tag -> !tag.isEmpty())
                .map(tag -> tag.toLowerCase(Locale.ROOT))
                .forEach(all::add);
        this.tags = Set.copyOf(all);

        if (tags.size() > STANDARD_TAGS.size()) {
            log.info("Tag vocabulary extended with {} configured tag(s)", tags.size() - STANDARD_TAGS.size());
        }
    }

    public static TagVocabulary standard() {
        return new TagVocabulary(new String[0]);
    }

    /**
     * @param name tag name, any case; null is never known
     */
    public boolean isKnown(String name) {
        return name != null && tags.contains(name.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return tags.size();
    }
}
