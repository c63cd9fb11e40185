package com.infrastructure.api.service;

/**
 * Masks disallowed words in free text before it is stored.
 */
public interface ProfanityFilter {

    /**
     * @return the text with every disallowed word replaced by asterisks of the same length;
     *         {@code null} stays {@code null}
     */
    String clean(String text);
}
