package com.bageldb.client.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageRequestTest {

    @Test
    @DisplayName("Should leave a well-formed URL untouched")
    void shouldLeaveLegalUrlUntouched() {
        String url = "http://localhost:8080/collection/a/items?query=t:=:x+y%2Bs:z&pageNumber=1&perPage=10";

        assertThat(new PageRequest(url, 1).uri().toString()).isEqualTo(url);
    }

    @Test
    @DisplayName("Should escape characters that are illegal in a URI")
    void shouldEscapeIllegalCharacters() {
        PageRequest request = new PageRequest("http://h/items?query=views:>:10&note=a b|é", 1);

        assertThat(request.uri().getRawQuery()).isEqualTo("query=views:%3E:10&note=a%20b%7C%C3%A9");
    }

    @Test
    @DisplayName("Should reject page numbers below 1")
    void shouldRejectPageZero() {
        assertThatThrownBy(() -> new PageRequest("http://h/items", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
