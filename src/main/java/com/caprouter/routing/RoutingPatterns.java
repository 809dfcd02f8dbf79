package com.caprouter.routing;

import java.util.regex.Pattern;

final class RoutingPatterns {

    // Unicode-aware word boundaries so accented letters count as word characters.
    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final String EDGE_CHARS = " \t\n\r?¡!.,;:";

    private RoutingPatterns() {
    }

    static Pattern compile(String regex) {
        return Pattern.compile(regex, FLAGS);
    }

    /**
     * Trims whitespace and sentence punctuation from both ends.
     */
    static String trimEdges(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && EDGE_CHARS.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_CHARS.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
