package com.nevis.dossier.service;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Best-effort cleanup of JSON produced by a language model: markdown fences, leading prose,
 * thousand separators in numbers, trailing commas and truncation.
 * <p>
 * The result is not guaranteed to parse; callers still handle parse failures.
 */
public final class ResponseRepairer {

    private static final String FENCE = "```";

    private ResponseRepairer() {
    }

    public static String repair(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String text = stripFences(raw.strip());
        int start = firstContainerStart(text);
        if (start < 0) {
            return text.strip();
        }

        StringBuilder out = new StringBuilder(text.length() + 8);
        Deque<Character> closers = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        boolean stringIsKey = false;
        boolean lastTokenWasKey = false;

        int i = start;
        scan:
        while (i < text.length()) {
            char c = text.charAt(i);

            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                    lastTokenWasKey = stringIsKey;
                }
                i++;
                continue;
            }

            switch (c) {
                case '"' -> {
                    char previous = lastSignificant(out);
                    stringIsKey = !closers.isEmpty() && closers.peek() == '}' && (previous == '{' || previous == ',');
                    inString = true;
                    out.append(c);
                }
                case '{' -> {
                    closers.push('}');
                    out.append(c);
                }
                case '[' -> {
                    closers.push(']');
                    out.append(c);
                }
                case '}', ']' -> {
                    if (!closers.contains(c)) {
                        // stray closer with no matching opener
                        i++;
                        continue;
                    }
                    dropTrailingComma(out);
                    while (!closers.isEmpty()) {
                        char expected = closers.pop();
                        out.append(expected);
                        if (expected == c) {
                            break;
                        }
                    }
                    if (closers.isEmpty()) {
                        break scan;
                    }
                }
                default -> {
                    if (isNumberStart(c) && lastSignificant(out) == ':') {
                        i = copyNumber(text, i, out);
                        lastTokenWasKey = false;
                        continue;
                    }
                    if (!Character.isWhitespace(c)) {
                        lastTokenWasKey = false;
                    }
                    out.append(c);
                }
            }
            i++;
        }

        if (closers.isEmpty() && !inString) {
            return out.toString();
        }

        if (inString) {
            if (escaped) {
                out.setLength(out.length() - 1);
            }
            out.append('"');
            lastTokenWasKey = stringIsKey;
        }

        completeDanglingLiteral(out);
        dropTrailingComma(out);
        trimTrailingWhitespace(out);

        char last = out.length() > 0 ? out.charAt(out.length() - 1) : 0;
        if (last == ':') {
            out.append(" null");
        } else if (lastTokenWasKey && last == '"') {
            out.append(": null");
        }

        while (!closers.isEmpty()) {
            out.append(closers.pop());
        }
        return out.toString();
    }

    private static String stripFences(String text) {
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return text;
        }
        int bodyStart = open + FENCE.length();
        while (bodyStart < text.length() && Character.isLetter(text.charAt(bodyStart))) {
            bodyStart++;
        }
        String body = text.substring(bodyStart);
        int close = body.indexOf(FENCE);
        return close >= 0 ? body.substring(0, close) : body;
    }

    private static int firstContainerStart(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        if (bracket < 0) {
            return brace;
        }
        return Math.min(brace, bracket);
    }

    private static boolean isNumberStart(char c) {
        return Character.isDigit(c) || c == '-';
    }

    /**
     * Copies a numeric value starting at {@code from}, dropping commas used as thousand separators
     * ({@code 12,500.50}). Returns the index of the first character after the number.
     */
    private static int copyNumber(String text, int from, StringBuilder out) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E') {
                out.append(c);
                i++;
            } else if (c == ',' && isThousandGroup(text, i + 1) && i > from) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static boolean isThousandGroup(String text, int from) {
        if (from + 3 > text.length()) {
            return false;
        }
        for (int k = from; k < from + 3; k++) {
            if (!Character.isDigit(text.charAt(k))) {
                return false;
            }
        }
        return from + 3 == text.length() || !Character.isDigit(text.charAt(from + 3));
    }

    private static char lastSignificant(StringBuilder out) {
        for (int k = out.length() - 1; k >= 0; k--) {
            char c = out.charAt(k);
            if (!Character.isWhitespace(c)) {
                return c;
            }
        }
        return 0;
    }

    private static void dropTrailingComma(StringBuilder out) {
        trimTrailingWhitespace(out);
        if (out.length() > 0 && out.charAt(out.length() - 1) == ',') {
            out.setLength(out.length() - 1);
            trimTrailingWhitespace(out);
        }
    }

    private static void trimTrailingWhitespace(StringBuilder out) {
        while (out.length() > 0 && Character.isWhitespace(out.charAt(out.length() - 1))) {
            out.setLength(out.length() - 1);
        }
    }

    /**
     * Finishes a literal cut mid-word ({@code tr}, {@code fals}, {@code nu}) or a number ending in a
     * dot or exponent marker.
     */
    private static void completeDanglingLiteral(StringBuilder out) {
        trimTrailingWhitespace(out);
        int end = out.length();
        int k = end;
        while (k > 0 && Character.isLetter(out.charAt(k - 1))) {
            k--;
        }
        if (k < end) {
            String word = out.substring(k, end);
            for (String literal : new String[]{"true", "false", "null"}) {
                if (literal.startsWith(word) && !literal.equals(word)) {
                    out.append(literal.substring(word.length()));
                    return;
                }
            }
            if ((word.equals("e") || word.equals("E")) && k > 0 && Character.isDigit(out.charAt(k - 1))) {
                out.setLength(k);
            }
            return;
        }
        if (end > 0) {
            char last = out.charAt(end - 1);
            if (last == '.' || last == '-' || last == '+') {
                out.append('0');
            }
        }
    }
}
