package com.purchasingpower.thesugraph.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers for building node labels.
 */
public final class DotText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DotText() {
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Escapes text placed inside an HTML-like label.
     */
    public static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    /**
     * Breaks text into chunks of at most {@code width} characters at whitespace and terminates
     * each chunk with {@code <br/>}. Chunks are HTML-escaped.
     */
    public static String wrap(String text, int width) {
        String collapsed = collapseWhitespace(text);
        Matcher matcher = Pattern.compile("(.{1," + width + "})(?:\\s|$)").matcher(collapsed);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            // characters the pattern could not place (a word longer than width) are kept as is
            sb.append(escapeHtml(collapsed.substring(last, matcher.start())));
            sb.append(escapeHtml(matcher.group(1))).append("<br/>");
            last = matcher.end();
        }
        sb.append(escapeHtml(collapsed.substring(last)));
        return sb.toString();
    }

    /**
     * Wrapped paraphrasis, or {@code "/"} when there is none.
     */
    public static String paraphrasis(String text, int width) {
        String collapsed = collapseWhitespace(text);
        return collapsed.isEmpty() ? "/" : wrap(collapsed, width);
    }

    /**
     * Centres {@code s} in a field of {@code width} spaces; longer strings are returned unchanged.
     */
    public static String pad(String s, int width) {
        String value = s == null ? "" : s;
        int padding = width - value.length();
        if (padding <= 0) {
            return value;
        }
        int left = padding / 2;
        return " ".repeat(left) + value + " ".repeat(padding - left);
    }

    /**
     * First three and last two words of a passage longer than five words.
     */
    public static String snippet(String text) {
        List<String> words = words(text);
        if (words.size() <= 5) {
            return String.join(" ", words);
        }
        return String.join(" ", words.subList(0, 3)) + " ... "
                + String.join(" ", words.subList(words.size() - 2, words.size()));
    }

    /**
     * Keeps the first and last {@code keep} words of a passage longer than {@code 2 * keep} words.
     */
    public static String abbreviateWords(String text, int keep) {
        List<String> words = words(text);
        if (words.size() <= keep * 2) {
            return String.join(" ", words);
        }
        return String.join(" ", words.subList(0, keep)) + " ... "
                + String.join(" ", words.subList(words.size() - keep, words.size()));
    }

    /**
     * Value after a leading {@code #} or after the last {@code #} of a {@code file#id} reference.
     */
    public static String afterHash(String ref) {
        if (ref == null) {
            return null;
        }
        int idx = ref.lastIndexOf('#');
        return idx >= 0 ? ref.substring(idx + 1) : ref;
    }

    public static String toClusterSafe(String id) {
        return id.replace('.', '_').replace('-', '_');
    }

    private static List<String> words(String text) {
        String collapsed = collapseWhitespace(text);
        if (collapsed.isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.asList(collapsed.split(" "));
    }
}
