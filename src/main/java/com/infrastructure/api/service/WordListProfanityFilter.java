package com.infrastructure.api.service;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches whole words from a fixed list, ignoring case.
 */
public class WordListProfanityFilter implements ProfanityFilter {

    private static final char MASK = '*';

    private final ImmutableSet<String> words;
    private final Pattern pattern;

    public WordListProfanityFilter(Collection<String> words) {
        this.words = words.stream()
                .map(String::trim)
                .filter(w -> !w.isEmpty())
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(ImmutableSet.toImmutableSet());
        this.pattern = this.words.isEmpty() ? null : Pattern.compile(
                this.words.stream().map(Pattern::quote).collect(Collectors.joining("|", "\\b(?:", ")\\b")),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    @Override
    public String clean(String text) {
        if (text == null || pattern == null) {
            return text;
        }
        Matcher matcher = pattern.matcher(text);
        StringBuilder cleaned = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(cleaned, Strings.repeat(String.valueOf(MASK), matcher.group().length()));
        }
        matcher.appendTail(cleaned);
        return cleaned.toString();
    }

    public int size() {
        return words.size();
    }
}
