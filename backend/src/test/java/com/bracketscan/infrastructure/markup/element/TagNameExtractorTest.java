package com.bracketscan.infrastructure.markup.element;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TagNameExtractorTest {

    @Test
    void opening_tag_with_attributes() {
        TagNameExtractor.TagName name = TagNameExtractor.extract("DIV class=\"x\"");

        assertThat(name.name()).isEqualTo("div");
        assertThat(name.closing()).isFalse();
        assertThat(name.declaration()).isFalse();
    }

    @Test
    void closing_tag_drops_slash() {
        TagNameExtractor.TagName name = TagNameExtractor.extract("/span");

        assertThat(name.name()).isEqualTo("span");
        assertThat(name.closing()).isTrue();
    }

    @Test
    void declaration_keeps_bang() {
        TagNameExtractor.TagName name = TagNameExtractor.extract("!DOCTYPE html");

        assertThat(name.name()).isEqualTo("!doctype");
        assertThat(name.declaration()).isTrue();
    }

    @Test
    @DisplayName("self-closing slash ends the name")
    void self_closing() {
        assertThat(TagNameExtractor.extract("br/").name()).isEqualTo("br");
    }

    @Test
    void custom_names_with_punctuation() {
        assertThat(TagNameExtractor.extract("my-widget data-id=1").name()).isEqualTo("my-widget");
        assertThat(TagNameExtractor.extract("svg:rect").name()).isEqualTo("svg:rect");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " div", "/", "!", "= b", "-x", "?xml version"})
    @DisplayName("bodies without a leading name → null")
    void no_name(String body) {
        assertThat(TagNameExtractor.extract(body)).isNull();
    }

    @Test
    void null_body() {
        assertThat(TagNameExtractor.extract(null)).isNull();
    }
}
