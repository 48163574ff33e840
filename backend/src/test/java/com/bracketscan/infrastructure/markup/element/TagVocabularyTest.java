package com.bracketscan.infrastructure.markup.element;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TagVocabularyTest {

    @Test
    void standard_tags_are_known_in_any_case() {
        TagVocabulary vocabulary = TagVocabulary.standard();

        assertThat(vocabulary.isKnown("div")).isTrue();
        assertThat(vocabulary.isKnown("TABLE")).isTrue();
        assertThat(vocabulary.isKnown("my-widget")).isFalse();
        assertThat(vocabulary.isKnown(null)).isFalse();
    }

    @Test
    void configured_extra_tags_extend_the_vocabulary() {
        TagVocabulary standard = TagVocabulary.standard();
        TagVocabulary extended = new TagVocabulary(new String[]{" My-Widget ", "", "div"});

        assertThat(extended.isKnown("my-widget")).isTrue();
        assertThat(extended.size()).isEqualTo(standard.size() + 1);
    }
}
