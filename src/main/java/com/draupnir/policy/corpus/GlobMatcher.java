package com.draupnir.policy.corpus;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shell-style glob matching over forward-slash relative paths, with brace alternation.
 * <p>
 * Supported syntax:
 * <ul>
 *   <li>{@code *} any run of characters except '/'</li>
 *   <li>{@code **} any run of characters including '/'</li>
 *   <li>{@code ?} one character except '/'</li>
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [!abc]} character classes, never matching '/'</li>
 *   <li>{@code {a,b,c}} alternation, first group only, no nesting</li>
 * </ul>
 * A pattern starting with {@code **}{@code /} also matches files at the top level, so
 * {@code **}{@code /*.yaml} selects {@code web.yaml} as well as {@code prod/web.yaml}.
 * Matching is case-sensitive and anchored at both ends. Nothing is cached: patterns are
 * expanded and compiled on every call.
 */
public final class GlobMatcher {

    public static final String RECURSIVE_PREFIX = "**/";

    private GlobMatcher() {
    }

    /**
     * @return true when the candidate matches any expansion of the pattern;
     *         false for a null or empty pattern
     */
    public static boolean matches(String candidate, String pattern) {
        if (candidate == null || pattern == null || pattern.isEmpty()) {
            return false;
        }
        for (String expanded : expand(pattern)) {
            if (toRegex(expanded).matcher(candidate).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Brace alternatives, each followed by its top-level variant when it starts with
     * {@code **}{@code /}.
     */
    public static List<String> expand(String pattern) {
        List<String> result = new ArrayList<>();
        for (String alternative : expandBraces(pattern)) {
            result.add(alternative);
            if (alternative.startsWith(RECURSIVE_PREFIX)) {
                result.add(alternative.substring(RECURSIVE_PREFIX.length()));
            }
        }
        return result;
    }

    /**
     * Substitute each alternative of the first {@code {...}} group. A pattern without a
     * '{' followed later by a '}' comes back unchanged.
     */
    public static List<String> expandBraces(String pattern) {
        List<String> result = new ArrayList<>();
        int open = pattern.indexOf('{');
        int close = open < 0 ? -1 : pattern.indexOf('}', open + 1);
        if (open < 0 || close < 0) {
            result.add(pattern);
            return result;
        }
        String prefix = pattern.substring(0, open);
        String suffix = pattern.substring(close + 1);
        String inner = pattern.substring(open + 1, close);
        for (String option : inner.split(",", -1)) {
            result.add(prefix + option + suffix);
        }
        return result;
    }

    /**
     * Translate one brace-free glob into an anchored regex.
     */
    static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < n && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if (c == '[') {
                int end = findClassEnd(glob, i);
                if (end < 0) {
                    regex.append("\\[");
                } else {
                    appendCharClass(regex, glob.substring(i + 1, end));
                    i = end;
                }
            } else {
                appendLiteral(regex, c);
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }

    private static int findClassEnd(String glob, int open) {
        int j = open + 1;
        if (j < glob.length() && glob.charAt(j) == '!') {
            j++;
        }
        // a ']' right after the opening bracket is a member, not the end
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        int end = glob.indexOf(']', j);
        return end;
    }

    /**
     * A class never matches '/': negated classes list it, positive ones intersect it away.
     */
    private static void appendCharClass(StringBuilder regex, String content) {
        boolean negated = content.startsWith("!");
        regex.append(negated ? "[^/" : "[");
        int first = negated ? 1 : 0;
        for (int k = first; k < content.length(); k++) {
            char c = content.charAt(k);
            boolean range = c == '-' && k > first && k < content.length() - 1;
            if (range || Character.isLetterOrDigit(c)) {
                regex.append(c);
            } else {
                regex.append('\\').append(c);
            }
        }
        if (!negated) {
            regex.append("&&[^/]");
        }
        regex.append(']');
    }

    private static void appendLiteral(StringBuilder regex, char c) {
        if ("\\.^$|+(){}[]".indexOf(c) >= 0) {
            regex.append('\\');
        }
        regex.append(c);
    }
}
