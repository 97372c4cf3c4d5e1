package com.skmarket.crawler.core;

import java.util.Optional;

public interface PageElement {

    Optional<String> textContent();

    Optional<String> getAttribute(String name);

    void click();

    /**
     * Looks up a descendant. Selectors are evaluated relative to this element.
     */
    Optional<PageElement> query(String selector);

    default boolean hasAttribute(String name) {
        return getAttribute(name).isPresent();
    }

    default Optional<String> trimmedText() {
        return textContent().map(String::trim).filter(s -> !s.isEmpty());
    }
}
