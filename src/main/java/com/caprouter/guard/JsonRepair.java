package com.caprouter.guard;

import java.util.regex.Pattern;

/**
 * Cheap local fixes for model output that is almost JSON: code fences, surrounding prose,
 * trailing commas. Applied before paying for another model round-trip.
 */
public final class JsonRepair {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private JsonRepair() {
    }

    public static String repair(String raw) {
        String candidate = extractFirstObject(raw);
        if (candidate.isEmpty()) {
            candidate = stripFences(raw);
        }
        return stripTrailingCommas(candidate).trim();
    }

    public static String stripFences(String text) {
        String cleaned = stripInvisibleEdgeChars(text == null ? "" : text.trim());
        cleaned = LEADING_FENCE.matcher(cleaned).replaceFirst("");
        cleaned = TRAILING_FENCE.matcher(cleaned).replaceFirst("");
        return cleaned.trim();
    }

    /**
     * Returns the first balanced {@code {...}} span, or "" when there is none. Braces inside
     * string literals (including escaped quotes) do not count towards depth.
     */
    public static String extractFirstObject(String text) {
        String cleaned = stripFences(text);
        if (cleaned.isEmpty()) {
            return "";
        }
        int start = cleaned.indexOf('{');
        if (start < 0) {
            return "";
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return cleaned.substring(start, i + 1);
                }
            }
        }
        return "";
    }

    /**
     * Drops commas that directly precede (modulo whitespace) a closing brace or bracket.
     * Commas inside string literals are left alone.
     */
    public static String stripTrailingCommas(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
                out.append(c);
                continue;
            }
            if (c == ',') {
                int j = i + 1;
                while (j < text.length() && Character.isWhitespace(text.charAt(j))) {
                    j++;
                }
                if (j < text.length() && (text.charAt(j) == '}' || text.charAt(j) == ']')) {
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    private static String stripInvisibleEdgeChars(String value) {
        // Providers occasionally prepend/append BOMs or zero-width characters.
        int start = 0;
        int end = value.length();
        while (start < end && isInvisible(value.charAt(start))) {
            start++;
        }
        while (end > start && isInvisible(value.charAt(end - 1))) {
            end--;
        }
        if (start == 0 && end == value.length()) return value;
        return value.substring(start, end).trim();
    }

    private static boolean isInvisible(char c) {
        return c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060';
    }
}
