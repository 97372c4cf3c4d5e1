package com.skmarket.crawler.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class UrlUtilsTest {

    @Test
    void shouldJoinBaseAndPath() {
        assertThat(UrlUtils.toAbsolute("https://www.sk-ah.com/", "history").toString())
            .isEqualTo("https://www.sk-ah.com/history");
        assertThat(UrlUtils.toAbsolute("https://www.sk-ah.com", "history").toString())
            .isEqualTo("https://www.sk-ah.com/history");
    }

    @Test
    void shouldEncodeSpacesAndBrackets() {
        assertThat(UrlUtils.toAbsolute("https://www.sk-ah.com/", "item/Iron Ore [T2]").toString())
            .isEqualTo("https://www.sk-ah.com/item/Iron%20Ore%20%5BT2%5D");
    }

    @Test
    void shouldReturnBaseForBlankPath() {
        assertThat(UrlUtils.toAbsolute("https://www.sk-ah.com", "").toString()).isEqualTo("https://www.sk-ah.com/");
    }

    @Test
    void shouldRequireBase() {
        assertThatThrownBy(() -> UrlUtils.toAbsolute(" ", "history")).isInstanceOf(IllegalArgumentException.class);
    }
}
