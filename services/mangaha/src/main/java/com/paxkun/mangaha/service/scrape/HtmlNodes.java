package com.paxkun.mangaha.service.scrape;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Null-free accessors over jsoup elements.
 * <p>
 * Every lookup answers with an {@link Optional}; an element that is missing from the markup
 * is never an exception. {@link #orEmpty(Optional, String, String)} turns an absent value into
 * the empty string and logs it as a parse warning.
 */
@Slf4j
public final class HtmlNodes {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^(\\d[\\d,]*)");

    private HtmlNodes() {
    }

    /**
     * Trimmed text of the first element matching {@code selector} under {@code scope}.
     */
    @NotNull
    public static Optional<String> text(@NotNull Element scope, @NotNull String selector) {
        Element element = scope.selectFirst(selector);
        if (element == null) {
            return Optional.empty();
        }
        return Optional.of(element.text().trim());
    }

    /**
     * Trimmed, non-blank texts of every element matching {@code selector}, in document order.
     */
    @NotNull
    public static List<String> texts(@NotNull Element scope, @NotNull String selector) {
        return scope.select(selector).stream()
                .map(element -> element.text().trim())
                .filter(text -> !text.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Raw value of the first non-blank attribute among {@code attributes} on the first match.
     */
    @NotNull
    public static Optional<String> attr(@NotNull Element scope, @NotNull String selector, @NotNull String... attributes) {
        Element element = scope.selectFirst(selector);
        if (element == null) {
            return Optional.empty();
        }
        for (String attribute : attributes) {
            String value = element.attr(attribute).trim();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #attr(Element, String, String...)} but resolved against the document's base URI.
     * Falls back to the raw value when it cannot be made absolute.
     */
    @NotNull
    public static Optional<String> url(@NotNull Element scope, @NotNull String selector, @NotNull String... attributes) {
        Element element = scope.selectFirst(selector);
        if (element == null) {
            return Optional.empty();
        }
        return absUrl(element, attributes);
    }

    /**
     * Absolute URL held by the first non-blank attribute of {@code element} itself.
     */
    @NotNull
    public static Optional<String> absUrl(@NotNull Element element, @NotNull String... attributes) {
        for (String attribute : attributes) {
            String raw = element.attr(attribute).trim();
            if (raw.isEmpty()) {
                continue;
            }
            String absolute = element.absUrl(attribute);
            return Optional.of(absolute.isEmpty() ? raw : absolute);
        }
        return Optional.empty();
    }

    /**
     * Leading integer of a heading such as {@code "1,024 results for \"x\""}.
     * Empty when the text does not start with a digit.
     */
    @NotNull
    public static Optional<Integer> leadingInteger(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = LEADING_INTEGER.matcher(text.trim());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String digits = matcher.group(1).replace(",", "");
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Unwraps {@code value}, substituting an empty string and logging a parse warning when absent.
     *
     * @param field  name of the field being read, for the log line
     * @param source URL of the page being parsed, for the log line
     */
    @NotNull
    public static String orEmpty(@NotNull Optional<String> value, String field, String source) {
        if (value.isPresent()) {
            return value.get();
        }
        log.warn("⚠️ Missing '{}' on {}, using empty value", field, source);
        return "";
    }
}
