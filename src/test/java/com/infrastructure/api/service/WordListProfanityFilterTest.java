package com.infrastructure.api.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WordListProfanityFilterTest {

    private final WordListProfanityFilter filter = new WordListProfanityFilter(List.of("darn", " heck ", ""));

    @Test
    void masksWholeWordsIgnoringCase() {
        assertThat(filter.clean("Darn bridge over heck creek")).isEqualTo("**** bridge over **** creek");
    }

    @Test
    void leavesWordsContainingAListedWordAlone() {
        assertThat(filter.clean("Darnley heckler")).isEqualTo("Darnley heckler");
    }

    @Test
    void passesNullAndCleanTextThrough() {
        assertThat(filter.clean(null)).isNull();
        assertThat(filter.clean("Harbour expansion")).isEqualTo("Harbour expansion");
        assertThat(filter.size()).isEqualTo(2);
    }

    @Test
    void emptyListMasksNothing() {
        assertThat(new WordListProfanityFilter(List.of()).clean("darn")).isEqualTo("darn");
    }
}
